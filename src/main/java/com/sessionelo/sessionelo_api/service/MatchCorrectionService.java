package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.MatchOutcome;
import com.sessionelo.sessionelo_api.elo.MatchRecord;
import com.sessionelo.sessionelo_api.elo.ParticipantChange;
import com.sessionelo.sessionelo_api.elo.RatingProjection;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.elo.ReplayEngine;
import com.sessionelo.sessionelo_api.elo.ReplayResult;
import com.sessionelo.sessionelo_api.exception.RecalculationConflictException;
import com.sessionelo.sessionelo_api.exception.RecalculationFailedException;
import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.exception.ValidationException;
import com.sessionelo.sessionelo_api.model.Match;
import com.sessionelo.sessionelo_api.model.MatchType;
import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.repository.MatchRepository;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Corrects the score of one completed singles match and re-derives every
 * rating that depends on it.
 *
 * Flow:
 * 1. Validate (unknown ids → 404, bad score / doubles / pending match → 400).
 * 2. Acquire the recalculation lock of the session and of every later
 *    session, oldest first, since the replay rewrites all of them. Losing
 *    any of them gives back the ones already taken (→ 409).
 * 3. Locate the match at position p in the session's canonical order. The
 *    replay set is every completed singles match from p to the end of the
 *    session, then every completed singles match of later sessions.
 * 4. Baseline: session baseline when p is the session's first match,
 *    otherwise each participant's snapshot before p, falling back to the
 *    session baseline when a snapshot is missing.
 * 5. Drop the replay set's snapshots and history, replay in memory with the
 *    corrected score, then write snapshots, history, current ratings and
 *    the edit metadata.
 * 6. Release the locks as DONE (or FAILED on any error), then compare the
 *    persisted ratings with the computed ones.
 *
 * Steps 3 to 5 run in one transaction. Nothing in step 5 reads a persisted
 * rating: the result depends only on the baseline and the ordered matches.
 */
@Service
public class MatchCorrectionService {

    private static final Logger log = LoggerFactory.getLogger(MatchCorrectionService.class);

    private final SessionRepository sessionRepository;
    private final MatchRepository matchRepository;
    private final MatchLog matchLog;
    private final RatingProjections projections;
    private final SessionBaselineService baselineService;
    private final SnapshotStore snapshotStore;
    private final RatingStore ratingStore;
    private final RecalculationLock recalculationLock;
    private final SessionSummaryService summaryService;
    private final TransactionTemplate transactionTemplate;

    public MatchCorrectionService(SessionRepository sessionRepository,
                                  MatchRepository matchRepository,
                                  MatchLog matchLog,
                                  RatingProjections projections,
                                  SessionBaselineService baselineService,
                                  SnapshotStore snapshotStore,
                                  RatingStore ratingStore,
                                  RecalculationLock recalculationLock,
                                  SessionSummaryService summaryService,
                                  PlatformTransactionManager transactionManager) {
        this.sessionRepository = sessionRepository;
        this.matchRepository = matchRepository;
        this.matchLog = matchLog;
        this.projections = projections;
        this.baselineService = baselineService;
        this.snapshotStore = snapshotStore;
        this.ratingStore = ratingStore;
        this.recalculationLock = recalculationLock;
        this.summaryService = summaryService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // =========================================================================
    // Entry point
    // =========================================================================

    public CorrectionResult correctMatch(String sessionId, String matchId, CorrectionRequest request) {
        Session session = validate(sessionId, matchId, request);

        List<String> affectedSessionIds = new ArrayList<>();
        affectedSessionIds.add(sessionId);
        for (Session later : sessionRepository.findOrderedAfter(session.getCreatedAt(), sessionId)) {
            affectedSessionIds.add(later.getId());
        }
        Map<String, String> tokens = acquireAll(affectedSessionIds);

        CorrectionResult result;
        try {
            result = transactionTemplate.execute(status -> recalculate(sessionId, matchId, request, tokens.keySet()));
            tokens.forEach(recalculationLock::markDone);
        } catch (DataAccessException | TransactionException e) {
            tokens.forEach(recalculationLock::markFailed);
            log.error("Correction of match {} in session {} failed; locks of {} marked FAILED",
                    matchId, sessionId, tokens.keySet(), e);
            throw new RecalculationFailedException(sessionId, e);
        } catch (RuntimeException e) {
            tokens.forEach(recalculationLock::markFailed);
            log.error("Correction of match {} in session {} failed; locks of {} marked FAILED",
                    matchId, sessionId, tokens.keySet(), e);
            throw e;
        }

        log.info("Corrected match {} in session {} to {}-{}: replayed {} matches, {} ratings rewritten",
                matchId, sessionId, request.team1Score(), request.team2Score(),
                result.replayedMatches(), result.finalRatings().size());

        verifyPersisted(sessionId, result.finalRatings());
        return result;
    }

    private Session validate(String sessionId, String matchId, CorrectionRequest request) {
        if (request == null || request.team1Score() == null || request.team2Score() == null) {
            throw new ValidationException("Both team1Score and team2Score are required");
        }
        if (request.team1Score() < 0 || request.team2Score() < 0) {
            throw new ValidationException("Scores must be non-negative");
        }

        Session session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
        Match match = matchRepository.findById(matchId)
                .filter(m -> m.getSessionId().equals(sessionId))
                .orElseThrow(() -> new ResourceNotFoundException("Match", matchId));

        if (match.getMatchType() != MatchType.SINGLES) {
            throw new ValidationException("Only singles matches can be corrected; match " + matchId + " is "
                    + match.getMatchType());
        }
        if (!match.isCompleted()) {
            throw new ValidationException("Only completed matches can be corrected; match " + matchId + " is "
                    + match.getStatus());
        }
        return session;
    }

    /**
     * Takes the locks in the given order. On a conflict the locks already
     * taken are given back before the conflict propagates.
     */
    private Map<String, String> acquireAll(List<String> sessionIds) {
        Map<String, String> tokens = new LinkedHashMap<>();
        try {
            for (String id : sessionIds) {
                tokens.put(id, recalculationLock.acquire(id));
            }
        } catch (RuntimeException e) {
            tokens.forEach(recalculationLock::abandon);
            throw e;
        }
        return tokens;
    }

    // =========================================================================
    // Recalculation (runs under the lock, inside one transaction)
    // =========================================================================

    private CorrectionResult recalculate(String sessionId, String matchId, CorrectionRequest request,
                                         Set<String> lockedSessionIds) {
        RatingProjection singles = projections.singles();
        Session session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));

        // 1. Locate the edited match in canonical order
        List<Match> sessionMatches = matchRepository.findBySessionOrdered(sessionId);
        int position = -1;
        for (int i = 0; i < sessionMatches.size(); i++) {
            if (sessionMatches.get(i).getId().equals(matchId)) {
                position = i;
                break;
            }
        }
        if (position < 0) {
            throw new ResourceNotFoundException("Match", matchId);
        }
        Match edited = sessionMatches.get(position);

        // 2. Replay set: the edited match onward, then later sessions
        List<MatchRecord> replaySet = new ArrayList<>();
        for (int i = position; i < sessionMatches.size(); i++) {
            Match match = sessionMatches.get(i);
            if (!match.isCompleted()) continue;
            MatchRecord record = MatchRecord.from(match);
            if (i == position) record = record.withScores(request.team1Score(), request.team2Score());
            if (singles.accepts(record)) replaySet.add(record);
        }
        List<Session> laterSessions = sessionRepository.findOrderedAfter(session.getCreatedAt(), session.getId());
        for (Session later : laterSessions) {
            // Created after the locks were taken
            if (!lockedSessionIds.contains(later.getId())) {
                throw new RecalculationConflictException(later.getId());
            }
        }
        for (MatchRecord record : matchLog.completedMatchesOf(laterSessions)) {
            if (singles.accepts(record)) replaySet.add(record);
        }

        Set<String> participants = new LinkedHashSet<>();
        replaySet.forEach(record -> participants.addAll(singles.participantsOf(record)));

        // 3. Baseline entering the edited match
        Map<String, RatingState> baseline = position == 0
                ? restrictTo(baselineService.baselineBefore(session, singles), participants)
                : baselineFromSnapshots(session, sessionMatches, position, participants);

        // 4. Invalidate everything derived from the replay set
        List<String> replayIds = replaySet.stream().map(MatchRecord::id).toList();
        snapshotStore.deleteFrom(replayIds);

        // 5. Pure replay, then persist
        ReplayResult result = ReplayEngine.apply(singles, baseline, replaySet);
        snapshotStore.record(result.outcomes());
        ratingStore.persist(RatingKind.SINGLES, result.endStates());

        edited.correctScore(request.team1Score(), request.team2Score(),
                request.editedBy(), request.reason(), LocalDateTime.now());
        matchRepository.save(edited);

        // 6. Cached best/worst of every completed session whose results moved
        if (session.isCompleted()) summaryService.refreshBestWorst(session);
        for (Session later : laterSessions) {
            if (later.isCompleted()) summaryService.refreshBestWorst(later);
        }

        List<ParticipantChange> editedChanges = result.outcomes().stream()
                .filter(outcome -> outcome.matchId().equals(matchId))
                .findFirst()
                .map(MatchOutcome::changes)
                .orElse(List.of());

        return new CorrectionResult(sessionId, matchId,
                request.team1Score(), request.team2Score(),
                replaySet.size(), editedChanges, result.endStates());
    }

    private Map<String, RatingState> baselineFromSnapshots(Session session, List<Match> sessionMatches,
                                                           int position, Set<String> participants) {
        Match edited = sessionMatches.get(position);
        RatingProjection singles = projections.singles();
        Map<String, RatingState> sessionBaseline = null;
        Map<String, RatingState> baseline = new LinkedHashMap<>();

        for (String participantId : participants) {
            Optional<RatingState> snapshot = snapshotStore.getBefore(RatingKind.SINGLES, participantId, edited, session);
            if (snapshot.isPresent()) {
                baseline.put(participantId, snapshot.get());
                continue;
            }

            if (sessionBaseline == null) {
                sessionBaseline = baselineService.baselineBefore(session, singles);
            }
            if (playedEarlierInSession(participantId, sessionMatches, position)) {
                log.warn("Missing snapshot for {} before match {} in session {}; falling back to session baseline {}",
                        participantId, edited.getId(), session.getId(), sessionBaseline.get(participantId));
            }
            RatingState fallback = sessionBaseline.get(participantId);
            if (fallback != null) baseline.put(participantId, fallback);
        }
        return baseline;
    }

    private boolean playedEarlierInSession(String participantId, List<Match> sessionMatches, int position) {
        for (int i = 0; i < position; i++) {
            Match match = sessionMatches.get(i);
            if (match.isCompleted() && match.getMatchType() == MatchType.SINGLES && match.involves(participantId)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, RatingState> restrictTo(Map<String, RatingState> states, Set<String> participantIds) {
        Map<String, RatingState> restricted = new LinkedHashMap<>();
        for (String participantId : participantIds) {
            RatingState state = states.get(participantId);
            if (state != null) restricted.put(participantId, state);
        }
        return restricted;
    }

    // =========================================================================
    // Post-write consistency check
    // =========================================================================

    /**
     * Compares persisted ratings with the computed ones. A mismatch is logged
     * and never fails the request: by now the correction has committed.
     */
    private void verifyPersisted(String sessionId, Map<String, RatingState> expected) {
        try {
            Map<String, RatingState> persisted = ratingStore.load(RatingKind.SINGLES, expected.keySet());
            for (Map.Entry<String, RatingState> entry : expected.entrySet()) {
                RatingState actual = persisted.get(entry.getKey());
                if (!entry.getValue().equals(actual)) {
                    log.error("Post-write mismatch in session {} for {}: computed {} but persisted {}",
                            sessionId, entry.getKey(), entry.getValue(), actual);
                }
            }
        } catch (DataAccessException e) {
            log.error("Post-write check for session {} could not read ratings", sessionId, e);
        }
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record CorrectionRequest(
            Integer team1Score,
            Integer team2Score,
            String editedBy,
            String reason
    ) {}

    public record CorrectionResult(
            String sessionId,
            String matchId,
            int team1Score,
            int team2Score,
            int replayedMatches,
            List<ParticipantChange> editedMatchChanges,
            Map<String, RatingState> finalRatings
    ) {}
}
