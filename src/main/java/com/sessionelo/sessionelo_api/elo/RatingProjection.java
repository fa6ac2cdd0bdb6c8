package com.sessionelo.sessionelo_api.elo;

import com.sessionelo.sessionelo_api.model.MatchType;
import com.sessionelo.sessionelo_api.model.RatingKind;

import java.util.List;
import java.util.Map;

/**
 * One named rating pipeline over the match log. Implementations read
 * pre-match states from the given map and never write to it; the
 * {@link ReplayEngine} owns the running state.
 */
public interface RatingProjection {

    RatingKind kind();

    MatchType matchType();

    /**
     * Whether the match counts for this projection. Matches of another type,
     * without both scores, or with too few players are treated as not played.
     */
    default boolean accepts(MatchRecord match) {
        return match.type() == matchType()
                && match.isScored()
                && match.playerIds().size() >= matchType().getPlayerCount();
    }

    /** Ids of the rated participants of an accepted match, side 1 first. */
    List<String> participantsOf(MatchRecord match);

    /** Apply one accepted match against the current states (absent = unrated). */
    MatchOutcome apply(MatchRecord match, Map<String, RatingState> states);

    static RatingState stateOf(Map<String, RatingState> states, String participantId) {
        return states.getOrDefault(participantId, RatingState.initial());
    }
}
