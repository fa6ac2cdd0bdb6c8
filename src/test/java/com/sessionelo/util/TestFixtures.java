package com.sessionelo.util;

import com.sessionelo.sessionelo_api.elo.MatchRecord;
import com.sessionelo.sessionelo_api.model.Match;
import com.sessionelo.sessionelo_api.model.MatchStatus;
import com.sessionelo.sessionelo_api.model.MatchType;
import com.sessionelo.sessionelo_api.model.Player;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.model.SessionStatus;
import com.sessionelo.sessionelo_api.service.SessionService.NewMatch;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Factory class for creating test data.
 * Never hardcode Elo values or timestamps inline in tests.
 */
public class TestFixtures {

    public static final int DEFAULT_ELO = 1500;
    public static final LocalDateTime BASE_TIME = LocalDateTime.of(2024, 3, 1, 18, 0);

    // =========================================================================
    // Player builders
    // =========================================================================

    public static Player buildPlayer(String displayName) {
        Player player = new Player(displayName);
        ReflectionTestUtils.setField(player, "id", UUID.randomUUID().toString());
        return player;
    }

    // =========================================================================
    // Session builders
    // =========================================================================

    public static Session buildSession(String id, LocalDateTime createdAt, SessionStatus status) {
        Session session = new Session("Session " + id, createdAt);
        ReflectionTestUtils.setField(session, "id", id);
        session.setStatus(status);
        return session;
    }

    /** Session number n, ordered n days after BASE_TIME. */
    public static LocalDateTime dayOf(int n) {
        return BASE_TIME.plusDays(n);
    }

    // =========================================================================
    // Match builders (entities)
    // =========================================================================

    /**
     * Singles match with a fixed id. Null scores leave it PENDING.
     */
    public static Match buildSinglesMatch(String id, String sessionId, int round, int order,
                                          String player1, String player2, Integer score1, Integer score2) {
        Match match = new Match(sessionId, round, order, MatchType.SINGLES, List.of(player1, player2));
        ReflectionTestUtils.setField(match, "id", id);
        if (score1 != null && score2 != null) {
            match.complete(score1, score2, BASE_TIME);
        }
        return match;
    }

    public static Match buildDoublesMatch(String id, String sessionId, int round, int order,
                                          List<String> players, Integer score1, Integer score2) {
        Match match = new Match(sessionId, round, order, MatchType.DOUBLES, players);
        ReflectionTestUtils.setField(match, "id", id);
        if (score1 != null && score2 != null) {
            match.complete(score1, score2, BASE_TIME);
        }
        return match;
    }

    // =========================================================================
    // Replay inputs
    // =========================================================================

    public static MatchRecord singles(String id, String player1, String player2, Integer score1, Integer score2) {
        return new MatchRecord(id, "session-1", 1, 1, MatchType.SINGLES, List.of(player1, player2),
                score1, score2, MatchStatus.COMPLETED);
    }

    public static MatchRecord doubles(String id, List<String> players, Integer score1, Integer score2) {
        return new MatchRecord(id, "session-1", 1, 1, MatchType.DOUBLES, players,
                score1, score2, MatchStatus.COMPLETED);
    }

    // =========================================================================
    // Session creation requests
    // =========================================================================

    public static NewMatch newSingles(int round, int order, String player1, String player2) {
        return new NewMatch(round, order, MatchType.SINGLES, List.of(player1, player2));
    }

    public static NewMatch newDoubles(int round, int order, String a1, String a2, String b1, String b2) {
        return new NewMatch(round, order, MatchType.DOUBLES, List.of(a1, a2, b1, b2));
    }
}
