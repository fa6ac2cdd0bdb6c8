package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.MatchRecord;
import com.sessionelo.sessionelo_api.elo.RatingProjection;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.elo.ReplayEngine;
import com.sessionelo.sessionelo_api.elo.ReplayResult;
import com.sessionelo.sessionelo_api.exception.RecalculationConflictException;
import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.exception.SessionNotDeletableException;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.model.SessionStatus;
import com.sessionelo.sessionelo_api.repository.MatchRepository;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;

/**
 * Deletes the most recent completed session and rebuilds every rating from
 * the remaining log.
 *
 * Only the chronologically latest completed session may go: later ratings
 * depend on earlier sessions, and Elo cannot be undone by subtracting deltas
 * because K depends on the running match count. The rebuild therefore always
 * replays forward from the all-default state.
 */
@Service
public class SessionDeletionService {

    private static final Logger log = LoggerFactory.getLogger(SessionDeletionService.class);

    private final SessionRepository sessionRepository;
    private final MatchRepository matchRepository;
    private final MatchLog matchLog;
    private final RatingProjections projections;
    private final SnapshotStore snapshotStore;
    private final RatingStore ratingStore;
    private final TransactionTemplate transactionTemplate;

    public SessionDeletionService(SessionRepository sessionRepository,
                                  MatchRepository matchRepository,
                                  MatchLog matchLog,
                                  RatingProjections projections,
                                  SnapshotStore snapshotStore,
                                  RatingStore ratingStore,
                                  PlatformTransactionManager transactionManager) {
        this.sessionRepository = sessionRepository;
        this.matchRepository = matchRepository;
        this.matchLog = matchLog;
        this.projections = projections;
        this.snapshotStore = snapshotStore;
        this.ratingStore = ratingStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // =========================================================================
    // Preconditions
    // =========================================================================

    public Deletability checkDeletable(String sessionId) {
        Session session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));

        if (!session.isCompleted()) {
            return Deletability.no("Only completed sessions can be deleted");
        }
        boolean latest = sessionRepository.findFirstByStatusOrderByCreatedAtDescIdDesc(SessionStatus.COMPLETED)
                .map(s -> s.getId().equals(sessionId))
                .orElse(false);
        if (!latest) {
            return Deletability.no("Only the most recent completed session can be deleted");
        }
        if (session.isRecalculating()) {
            return Deletability.no("A recalculation is in progress for this session");
        }
        return Deletability.yes();
    }

    // =========================================================================
    // Delete + rebuild
    // =========================================================================

    public DeletionResult deleteSession(String sessionId) {
        Session session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
        if (session.isRecalculating()) {
            throw new RecalculationConflictException(sessionId);
        }
        Deletability deletability = checkDeletable(sessionId);
        if (!deletability.deletable()) {
            throw new SessionNotDeletableException(sessionId, deletability.reason());
        }

        DeletionResult result = transactionTemplate.execute(status -> deleteAndRebuild(session));
        log.info("Deleted session {} and rebuilt ratings from {} sessions ({} matches)",
                sessionId, result.replayedSessions(), result.replayedMatches());
        return result;
    }

    private DeletionResult deleteAndRebuild(Session session) {
        // 1. Remove the session and everything derived from it
        List<String> matchIds = matchRepository.findIdsBySessionId(session.getId());
        snapshotStore.deleteFrom(matchIds);
        matchRepository.deleteBySessionId(session.getId());
        sessionRepository.deleteById(session.getId());
        sessionRepository.flush();

        // 2. Forget every derived rating, checkpoint and history row
        ratingStore.clearAll();
        snapshotStore.deleteAll();

        // 3. Replay the remaining log forward, session by session
        List<Session> remaining = sessionRepository.findAllByOrderByCreatedAtAscIdAsc();
        int replayedMatches = 0;
        for (RatingProjection projection : projections.all()) {
            Map<String, RatingState> running = Map.of();
            for (Session s : remaining) {
                List<MatchRecord> matches = matchLog.completedMatchesOf(s.getId());
                ReplayResult result = ReplayEngine.apply(projection, running, matches);
                snapshotStore.record(result.outcomes());
                running = result.endStates();
                replayedMatches += result.outcomes().size();
                log.debug("Rebuild {}: replayed session {} ({} matches)",
                        projection.kind(), s.getId(), result.outcomes().size());
            }
            ratingStore.persist(projection.kind(), running);
        }

        return new DeletionResult(session.getId(), remaining.size(), replayedMatches);
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record Deletability(boolean deletable, String reason) {
        static Deletability yes() {
            return new Deletability(true, null);
        }

        static Deletability no(String reason) {
            return new Deletability(false, reason);
        }
    }

    /** {@code replayedMatches} counts applied matches summed over all projections. */
    public record DeletionResult(String deletedSessionId, int replayedSessions, int replayedMatches) {}
}
