package com.sessionelo.sessionelo_api.elo;

import com.sessionelo.sessionelo_api.model.Match;
import com.sessionelo.sessionelo_api.model.MatchStatus;
import com.sessionelo.sessionelo_api.model.MatchType;

import java.util.Comparator;
import java.util.List;

/**
 * Immutable view of a match as the replay engine sees it. Decoupled from the
 * entity so a corrected score can be substituted without touching the row.
 */
public record MatchRecord(
        String id,
        String sessionId,
        int roundNumber,
        int matchOrder,
        MatchType type,
        List<String> playerIds,
        Integer score1,
        Integer score2,
        MatchStatus status
) {

    /** Canonical order inside a session: round, then order within the round. */
    public static final Comparator<MatchRecord> CANONICAL_ORDER =
            Comparator.comparingInt(MatchRecord::roundNumber).thenComparingInt(MatchRecord::matchOrder);

    public MatchRecord {
        playerIds = List.copyOf(playerIds);
    }

    public static MatchRecord from(Match match) {
        return new MatchRecord(
                match.getId(),
                match.getSessionId(),
                match.getRoundNumber(),
                match.getMatchOrder(),
                match.getMatchType(),
                match.getPlayerIds(),
                match.getTeam1Score(),
                match.getTeam2Score(),
                match.getStatus()
        );
    }

    public MatchRecord withScores(int newScore1, int newScore2) {
        return new MatchRecord(id, sessionId, roundNumber, matchOrder, type, playerIds,
                newScore1, newScore2, status);
    }

    public boolean isScored() {
        return score1 != null && score2 != null;
    }
}
