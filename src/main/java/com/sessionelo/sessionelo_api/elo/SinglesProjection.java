package com.sessionelo.sessionelo_api.elo;

import com.sessionelo.sessionelo_api.model.MatchType;
import com.sessionelo.sessionelo_api.model.RatingKind;

import java.util.List;
import java.util.Map;

/**
 * Player ratings from singles matches. Each side's delta uses its own
 * pre-match rating and match count.
 */
public class SinglesProjection implements RatingProjection {

    @Override
    public RatingKind kind() {
        return RatingKind.SINGLES;
    }

    @Override
    public MatchType matchType() {
        return MatchType.SINGLES;
    }

    @Override
    public List<String> participantsOf(MatchRecord match) {
        return List.of(match.playerIds().get(0), match.playerIds().get(1));
    }

    @Override
    public MatchOutcome apply(MatchRecord match, Map<String, RatingState> states) {
        String p1 = match.playerIds().get(0);
        String p2 = match.playerIds().get(1);
        RatingState s1 = RatingProjection.stateOf(states, p1);
        RatingState s2 = RatingProjection.stateOf(states, p2);

        MatchResult r1 = MatchResult.of(match.score1(), match.score2());
        MatchResult r2 = r1.opposite();

        int d1 = EloCalculator.delta(s1.elo(), s2.elo(), r1, s1.matchesPlayed());
        int d2 = EloCalculator.delta(s2.elo(), s1.elo(), r2, s2.matchesPlayed());

        return new MatchOutcome(match.id(), match.sessionId(), kind(), List.of(
                new ParticipantChange(p1, s1, s1.after(r1, d1), EloCalculator.kFactor(s1.matchesPlayed())),
                new ParticipantChange(p2, s2, s2.after(r2, d2), EloCalculator.kFactor(s2.matchesPlayed()))
        ));
    }
}
