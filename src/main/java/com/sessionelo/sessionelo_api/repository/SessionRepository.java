package com.sessionelo.sessionelo_api.repository;

import com.sessionelo.sessionelo_api.model.RecalcStatus;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.model.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SessionRepository extends JpaRepository<Session, String> {

    // =========================================================================
    // Chronological lookups (createdAt, id as tiebreaker)
    // =========================================================================

    Optional<Session> findFirstByStatusOrderByCreatedAtDescIdDesc(SessionStatus status);

    List<Session> findAllByOrderByCreatedAtAscIdAsc();

    /**
     * Sessions with the given status ordered before the session identified by
     * ({@code createdAt}, {@code id}), oldest first. Same ordering as
     * {@link #findOrderedAfter}. Used to build the baseline entering a session.
     */
    @Query("""
        SELECT s FROM Session s
        WHERE s.status = :status
        AND (s.createdAt < :createdAt
             OR (s.createdAt = :createdAt AND s.id < :id))
        ORDER BY s.createdAt ASC, s.id ASC
        """)
    List<Session> findByStatusOrderedBefore(@Param("status") SessionStatus status,
                                            @Param("createdAt") LocalDateTime createdAt,
                                            @Param("id") String id);

    /**
     * Every session ordered after the given one (any status), oldest first.
     */
    @Query("""
        SELECT s FROM Session s
        WHERE s.createdAt > :createdAt
        OR (s.createdAt = :createdAt AND s.id > :id)
        ORDER BY s.createdAt ASC, s.id ASC
        """)
    List<Session> findOrderedAfter(@Param("createdAt") LocalDateTime createdAt, @Param("id") String id);

    // =========================================================================
    // Recalculation lock (compare-and-swap on recalc_status)
    // =========================================================================

    /**
     * Move the lock to RUNNING if it is currently one of {@code acquirable}
     * (or was never used). Returns 1 when this caller won, 0 otherwise.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Session s
        SET s.recalcStatus = :running, s.recalcToken = :token,
            s.recalcStartedAt = :now, s.recalcFinishedAt = null
        WHERE s.id = :id
        AND (s.recalcStatus IS NULL OR s.recalcStatus IN :acquirable)
        """)
    int tryAcquireRecalcLock(@Param("id") String id,
                             @Param("token") String token,
                             @Param("now") LocalDateTime now,
                             @Param("acquirable") Collection<RecalcStatus> acquirable,
                             @Param("running") RecalcStatus running);

    /**
     * Same as {@link #tryAcquireRecalcLock} but also takes over a RUNNING lock
     * that started before {@code staleBefore}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Session s
        SET s.recalcStatus = :running, s.recalcToken = :token,
            s.recalcStartedAt = :now, s.recalcFinishedAt = null
        WHERE s.id = :id
        AND (s.recalcStatus IS NULL
             OR s.recalcStatus IN :acquirable
             OR (s.recalcStatus = :running AND s.recalcStartedAt < :staleBefore))
        """)
    int tryAcquireOrTakeOverStaleRecalcLock(@Param("id") String id,
                                            @Param("token") String token,
                                            @Param("now") LocalDateTime now,
                                            @Param("staleBefore") LocalDateTime staleBefore,
                                            @Param("acquirable") Collection<RecalcStatus> acquirable,
                                            @Param("running") RecalcStatus running);

    /**
     * Finish a recalculation. Only the holder of {@code token} can release,
     * so a taken-over stale holder cannot clobber its successor.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Session s
        SET s.recalcStatus = :status, s.recalcToken = null, s.recalcFinishedAt = :now
        WHERE s.id = :id
        AND s.recalcToken = :token
        """)
    int releaseRecalcLock(@Param("id") String id,
                          @Param("token") String token,
                          @Param("status") RecalcStatus status,
                          @Param("now") LocalDateTime now);
}
