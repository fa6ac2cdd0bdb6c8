package com.sessionelo.sessionelo_api.elo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies an ordered match sequence to a starting state, one match at a time.
 *
 * Every rating the service persists is produced here. The result depends only
 * on (projection, start states, match order): the same inputs always give the
 * same end states and outcomes. The caller's map is never modified.
 */
public final class ReplayEngine {

    private ReplayEngine() {}

    public static ReplayResult apply(RatingProjection projection,
                                     Map<String, RatingState> startStates,
                                     List<MatchRecord> matchesInOrder) {
        Map<String, RatingState> states = new LinkedHashMap<>(startStates);
        List<MatchOutcome> outcomes = new ArrayList<>();

        for (MatchRecord match : matchesInOrder) {
            // Unscored or short-handed matches count as not played
            if (!projection.accepts(match)) continue;

            MatchOutcome outcome = projection.apply(match, states);
            for (ParticipantChange change : outcome.changes()) {
                states.put(change.participantId(), change.after());
            }
            outcomes.add(outcome);
        }

        return new ReplayResult(
                Collections.unmodifiableMap(states),
                Collections.unmodifiableList(outcomes)
        );
    }
}
