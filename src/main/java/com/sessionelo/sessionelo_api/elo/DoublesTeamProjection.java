package com.sessionelo.sessionelo_api.elo;

import com.sessionelo.sessionelo_api.model.MatchType;
import com.sessionelo.sessionelo_api.model.RatingKind;

import java.util.List;
import java.util.Map;

/**
 * Team ratings from doubles matches. A pairing is rated as one participant:
 * the team's own rating and match count drive the delta.
 */
public class DoublesTeamProjection implements RatingProjection {

    private final TeamIdResolver teamIdResolver;

    public DoublesTeamProjection(TeamIdResolver teamIdResolver) {
        this.teamIdResolver = teamIdResolver;
    }

    @Override
    public RatingKind kind() {
        return RatingKind.DOUBLES_TEAM;
    }

    @Override
    public MatchType matchType() {
        return MatchType.DOUBLES;
    }

    @Override
    public List<String> participantsOf(MatchRecord match) {
        List<String> ids = match.playerIds();
        return List.of(
                teamIdResolver.resolve(ids.get(0), ids.get(1)),
                teamIdResolver.resolve(ids.get(2), ids.get(3))
        );
    }

    @Override
    public MatchOutcome apply(MatchRecord match, Map<String, RatingState> states) {
        List<String> teams = participantsOf(match);
        String team1 = teams.get(0);
        String team2 = teams.get(1);
        RatingState s1 = RatingProjection.stateOf(states, team1);
        RatingState s2 = RatingProjection.stateOf(states, team2);

        MatchResult r1 = MatchResult.of(match.score1(), match.score2());
        MatchResult r2 = r1.opposite();

        int d1 = EloCalculator.delta(s1.elo(), s2.elo(), r1, s1.matchesPlayed());
        int d2 = EloCalculator.delta(s2.elo(), s1.elo(), r2, s2.matchesPlayed());

        return new MatchOutcome(match.id(), match.sessionId(), kind(), List.of(
                new ParticipantChange(team1, s1, s1.after(r1, d1), EloCalculator.kFactor(s1.matchesPlayed())),
                new ParticipantChange(team2, s2, s2.after(r2, d2), EloCalculator.kFactor(s2.matchesPlayed()))
        ));
    }
}
