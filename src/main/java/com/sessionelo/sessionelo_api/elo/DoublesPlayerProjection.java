package com.sessionelo.sessionelo_api.elo;

import com.sessionelo.sessionelo_api.model.MatchType;
import com.sessionelo.sessionelo_api.model.RatingKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Individual ratings from doubles matches only.
 *
 * Each side is rated by the average of its two players' doubles Elo and the
 * average of their doubles match counts. Both members of a side receive the
 * same delta. Ratings here can drift apart from {@link DoublesTeamProjection}
 * over the same matches; the two are never reconciled.
 */
public class DoublesPlayerProjection implements RatingProjection {

    @Override
    public RatingKind kind() {
        return RatingKind.DOUBLES_PLAYER;
    }

    @Override
    public MatchType matchType() {
        return MatchType.DOUBLES;
    }

    @Override
    public List<String> participantsOf(MatchRecord match) {
        return match.playerIds().subList(0, 4);
    }

    @Override
    public MatchOutcome apply(MatchRecord match, Map<String, RatingState> states) {
        List<String> ids = match.playerIds();
        RatingState a1 = RatingProjection.stateOf(states, ids.get(0));
        RatingState a2 = RatingProjection.stateOf(states, ids.get(1));
        RatingState b1 = RatingProjection.stateOf(states, ids.get(2));
        RatingState b2 = RatingProjection.stateOf(states, ids.get(3));

        double side1Elo = (a1.elo() + a2.elo()) / 2.0;
        double side2Elo = (b1.elo() + b2.elo()) / 2.0;
        double side1Matches = (a1.matchesPlayed() + a2.matchesPlayed()) / 2.0;
        double side2Matches = (b1.matchesPlayed() + b2.matchesPlayed()) / 2.0;

        MatchResult r1 = MatchResult.of(match.score1(), match.score2());
        MatchResult r2 = r1.opposite();

        int d1 = EloCalculator.delta(side1Elo, side2Elo, r1, side1Matches);
        int d2 = EloCalculator.delta(side2Elo, side1Elo, r2, side2Matches);
        int k1 = EloCalculator.kFactor(side1Matches);
        int k2 = EloCalculator.kFactor(side2Matches);

        List<ParticipantChange> changes = new ArrayList<>(4);
        changes.add(new ParticipantChange(ids.get(0), a1, a1.after(r1, d1), k1));
        changes.add(new ParticipantChange(ids.get(1), a2, a2.after(r1, d1), k1));
        changes.add(new ParticipantChange(ids.get(2), b1, b1.after(r2, d2), k2));
        changes.add(new ParticipantChange(ids.get(3), b2, b2.after(r2, d2), k2));
        return new MatchOutcome(match.id(), match.sessionId(), kind(), changes);
    }
}
