package com.sessionelo.sessionelo_api.repository;

import com.sessionelo.sessionelo_api.model.Match;
import com.sessionelo.sessionelo_api.model.MatchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MatchRepository extends JpaRepository<Match, String> {

    /**
     * All matches of a session in canonical replay order.
     */
    @Query("""
        SELECT m FROM Match m
        WHERE m.sessionId = :sessionId
        ORDER BY m.roundNumber ASC, m.matchOrder ASC
        """)
    List<Match> findBySessionOrdered(@Param("sessionId") String sessionId);

    @Query("""
        SELECT m FROM Match m
        WHERE m.sessionId = :sessionId
        AND m.status = :status
        ORDER BY m.roundNumber ASC, m.matchOrder ASC
        """)
    List<Match> findBySessionAndStatusOrdered(@Param("sessionId") String sessionId,
                                              @Param("status") MatchStatus status);

    List<Match> findBySessionIdAndRoundNumberOrderByMatchOrderAsc(String sessionId, int roundNumber);

    long countBySessionIdAndStatus(String sessionId, MatchStatus status);

    @Query("SELECT m.id FROM Match m WHERE m.sessionId = :sessionId")
    List<String> findIdsBySessionId(@Param("sessionId") String sessionId);

    @Modifying
    @Query("DELETE FROM Match m WHERE m.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") String sessionId);
}
