package com.sessionelo.sessionelo_api.repository;

import com.sessionelo.sessionelo_api.model.EloHistoryEntry;
import com.sessionelo.sessionelo_api.model.RatingKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface EloHistoryRepository extends JpaRepository<EloHistoryEntry, Long> {

    List<EloHistoryEntry> findByMatchId(String matchId);

    /**
     * A participant's rating history in log order.
     */
    @Query("""
        SELECT h FROM EloHistoryEntry h, Match m, Session s
        WHERE h.matchId = m.id
        AND m.sessionId = s.id
        AND h.kind = :kind
        AND h.participantId = :participantId
        ORDER BY s.createdAt ASC, s.id ASC, m.roundNumber ASC, m.matchOrder ASC
        """)
    List<EloHistoryEntry> findHistory(@Param("kind") RatingKind kind,
                                      @Param("participantId") String participantId);

    @Modifying
    @Query("DELETE FROM EloHistoryEntry h WHERE h.matchId IN :matchIds")
    int deleteByMatchIdIn(@Param("matchIds") Collection<String> matchIds);

    @Modifying
    @Query("DELETE FROM EloHistoryEntry h")
    int deleteAllHistory();
}
