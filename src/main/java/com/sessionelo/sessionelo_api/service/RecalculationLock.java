package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.exception.RecalculationConflictException;
import com.sessionelo.sessionelo_api.model.RecalcStatus;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Per-session recalculation mutex kept in the sessions table.
 *
 * State machine: IDLE | DONE | FAILED → RUNNING → DONE | FAILED, or back to
 * IDLE when the holder gives the lock up without having recalculated.
 * Acquisition is a single conditional UPDATE, so it is exclusive across
 * requests and processes. Losers get a conflict; nobody waits or retries.
 *
 * Each transition commits in its own transaction so other requests see it
 * immediately, independent of the caller's transaction.
 */
@Service
public class RecalculationLock {

    private static final Logger log = LoggerFactory.getLogger(RecalculationLock.class);

    private static final Set<RecalcStatus> ACQUIRABLE =
            EnumSet.of(RecalcStatus.IDLE, RecalcStatus.DONE, RecalcStatus.FAILED);

    private final SessionRepository sessionRepository;
    // A RUNNING lock older than this is assumed orphaned by a crashed holder. 0 = never take over.
    private final long staleLockTimeoutMinutes;

    public RecalculationLock(SessionRepository sessionRepository,
                             @Value("${sessionelo.recalc.stale-lock-timeout-minutes:15}") long staleLockTimeoutMinutes) {
        this.sessionRepository = sessionRepository;
        this.staleLockTimeoutMinutes = staleLockTimeoutMinutes;
    }

    /**
     * @return the fencing token identifying this holder
     * @throws RecalculationConflictException if another recalculation holds the lock
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String acquire(String sessionId) {
        String token = UUID.randomUUID().toString();
        LocalDateTime now = LocalDateTime.now();

        int updated;
        if (staleLockTimeoutMinutes > 0) {
            updated = sessionRepository.tryAcquireOrTakeOverStaleRecalcLock(
                    sessionId, token, now, now.minusMinutes(staleLockTimeoutMinutes),
                    ACQUIRABLE, RecalcStatus.RUNNING);
        } else {
            updated = sessionRepository.tryAcquireRecalcLock(
                    sessionId, token, now, ACQUIRABLE, RecalcStatus.RUNNING);
        }

        if (updated == 0) {
            log.warn("Recalculation lock for session {} is held by another request", sessionId);
            throw new RecalculationConflictException(sessionId);
        }
        log.info("Recalculation lock acquired for session {} (token {})", sessionId, token);
        return token;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markDone(String sessionId, String token) {
        release(sessionId, token, RecalcStatus.DONE);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(String sessionId, String token) {
        release(sessionId, token, RecalcStatus.FAILED);
    }

    /**
     * Give the lock back without a recalculation having run, e.g. when a
     * multi-session acquisition loses on a later session.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void abandon(String sessionId, String token) {
        release(sessionId, token, RecalcStatus.IDLE);
    }

    private void release(String sessionId, String token, RecalcStatus status) {
        int updated = sessionRepository.releaseRecalcLock(sessionId, token, status, LocalDateTime.now());
        if (updated == 0) {
            // Taken over as stale while we were still running; the new holder owns it now
            log.warn("Recalculation lock for session {} was no longer held by token {}; not marking {}",
                    sessionId, token, status);
        } else {
            log.info("Recalculation lock for session {} released as {}", sessionId, status);
        }
    }
}
