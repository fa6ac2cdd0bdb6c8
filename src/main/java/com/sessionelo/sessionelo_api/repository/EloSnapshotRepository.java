package com.sessionelo.sessionelo_api.repository;

import com.sessionelo.sessionelo_api.model.EloSnapshot;
import com.sessionelo.sessionelo_api.model.RatingKind;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface EloSnapshotRepository extends JpaRepository<EloSnapshot, Long> {

    Optional<EloSnapshot> findByMatchIdAndKindAndParticipantId(String matchId, RatingKind kind, String participantId);

    List<EloSnapshot> findByMatchId(String matchId);

    /**
     * A participant's snapshots strictly before a position in the log, latest
     * first. The position is (session createdAt, session id, round, order).
     * Only the same session and completed sessions are considered, matching
     * what a session baseline replays. Take the first row with a page of 1.
     */
    @Query("""
        SELECT es FROM EloSnapshot es, Match m, Session s
        WHERE es.matchId = m.id
        AND m.sessionId = s.id
        AND es.kind = :kind
        AND es.participantId = :participantId
        AND (s.id = :sessionId OR s.status = com.sessionelo.sessionelo_api.model.SessionStatus.COMPLETED)
        AND (
            s.createdAt < :createdAt
            OR (s.createdAt = :createdAt AND s.id < :sessionId)
            OR (s.id = :sessionId AND (
                m.roundNumber < :roundNumber
                OR (m.roundNumber = :roundNumber AND m.matchOrder < :matchOrder)))
        )
        ORDER BY s.createdAt DESC, s.id DESC, m.roundNumber DESC, m.matchOrder DESC
        """)
    List<EloSnapshot> findLatestBefore(@Param("kind") RatingKind kind,
                                       @Param("participantId") String participantId,
                                       @Param("sessionId") String sessionId,
                                       @Param("createdAt") LocalDateTime createdAt,
                                       @Param("roundNumber") int roundNumber,
                                       @Param("matchOrder") int matchOrder,
                                       Pageable pageable);

    @Modifying
    @Query("DELETE FROM EloSnapshot es WHERE es.matchId IN :matchIds")
    int deleteByMatchIdIn(@Param("matchIds") Collection<String> matchIds);

    @Modifying
    @Query("DELETE FROM EloSnapshot es")
    int deleteAllSnapshots();
}
