package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.MatchOutcome;
import com.sessionelo.sessionelo_api.elo.MatchRecord;
import com.sessionelo.sessionelo_api.elo.RatingProjection;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.elo.ReplayEngine;
import com.sessionelo.sessionelo_api.elo.ReplayResult;
import com.sessionelo.sessionelo_api.exception.InvalidSessionStateException;
import com.sessionelo.sessionelo_api.exception.RecalculationFailedException;
import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.exception.ValidationException;
import com.sessionelo.sessionelo_api.model.Match;
import com.sessionelo.sessionelo_api.model.MatchStatus;
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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Appends a round of results to the log.
 *
 * Flow:
 * 1. Validate the round and its scores (no lock taken on bad input).
 * 2. Take the session's recalculation lock, so a correction of the same
 *    session can never interleave with an append.
 * 3. Mark the round's matches completed with their scores.
 * 4. Per projection: start from the current persisted ratings of the round's
 *    participants and run the round through the replay engine.
 * 5. Write snapshots, history rows and the new current ratings.
 * 6. Complete the session once no pending match is left, caching best/worst.
 */
@Service
public class EloService {

    private static final Logger log = LoggerFactory.getLogger(EloService.class);

    private final SessionRepository sessionRepository;
    private final MatchRepository matchRepository;
    private final RatingProjections projections;
    private final RatingStore ratingStore;
    private final SnapshotStore snapshotStore;
    private final RecalculationLock recalculationLock;
    private final SessionSummaryService summaryService;
    private final TransactionTemplate transactionTemplate;

    public EloService(SessionRepository sessionRepository,
                      MatchRepository matchRepository,
                      RatingProjections projections,
                      RatingStore ratingStore,
                      SnapshotStore snapshotStore,
                      RecalculationLock recalculationLock,
                      SessionSummaryService summaryService,
                      PlatformTransactionManager transactionManager) {
        this.sessionRepository = sessionRepository;
        this.matchRepository = matchRepository;
        this.projections = projections;
        this.ratingStore = ratingStore;
        this.snapshotStore = snapshotStore;
        this.recalculationLock = recalculationLock;
        this.summaryService = summaryService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // =========================================================================
    // Core: Submit a round
    // =========================================================================

    public RoundResult submitRound(String sessionId, int roundNumber, List<ScoreEntry> scores) {
        Session session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
        validateRound(session, roundNumber, scores);

        String token = recalculationLock.acquire(sessionId);
        try {
            RoundResult result = transactionTemplate.execute(status -> applyRound(sessionId, roundNumber, scores));
            recalculationLock.markDone(sessionId, token);
            log.info("Round {} of session {} applied: {} matches, session completed: {}",
                    roundNumber, sessionId, result.outcomes().size(), result.sessionCompleted());
            return result;
        } catch (DataAccessException | TransactionException e) {
            recalculationLock.markFailed(sessionId, token);
            throw new RecalculationFailedException(sessionId, e);
        } catch (RuntimeException e) {
            recalculationLock.markFailed(sessionId, token);
            throw e;
        }
    }

    private void validateRound(Session session, int roundNumber, List<ScoreEntry> scores) {
        if (session.isCompleted()) {
            throw new InvalidSessionStateException("Session " + session.getId() + " is already completed");
        }

        List<Match> round = matchRepository.findBySessionIdAndRoundNumberOrderByMatchOrderAsc(session.getId(), roundNumber);
        if (round.isEmpty()) {
            throw new ResourceNotFoundException("Round", session.getId() + "/" + roundNumber);
        }
        if (round.stream().allMatch(Match::isCompleted)) {
            throw new InvalidSessionStateException("Round " + roundNumber + " is already completed");
        }
        if (scores == null || scores.isEmpty()) {
            throw new ValidationException("Scores are required for every match of the round");
        }

        Map<String, ScoreEntry> byMatch = new HashMap<>();
        for (ScoreEntry entry : scores) {
            if (entry.matchId() == null) {
                throw new ValidationException("Every score needs a matchId");
            }
            if (byMatch.put(entry.matchId(), entry) != null) {
                throw new ValidationException("Duplicate score for match " + entry.matchId());
            }
            if (entry.team1Score() == null || entry.team2Score() == null) {
                throw new ValidationException("Both scores are required for match " + entry.matchId());
            }
            if (entry.team1Score() < 0 || entry.team2Score() < 0) {
                throw new ValidationException("Scores must be non-negative for match " + entry.matchId());
            }
        }

        Set<String> roundIds = new LinkedHashSet<>();
        for (Match match : round) {
            roundIds.add(match.getId());
            if (!match.isCompleted() && !byMatch.containsKey(match.getId())) {
                throw new ValidationException("Missing score for match " + match.getId());
            }
        }
        for (String matchId : byMatch.keySet()) {
            if (!roundIds.contains(matchId)) {
                throw new ValidationException("Match " + matchId + " is not part of round " + roundNumber);
            }
        }
    }

    private RoundResult applyRound(String sessionId, int roundNumber, List<ScoreEntry> scores) {
        // Re-read under the lock; the state may have moved since validation
        Session session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
        if (session.isCompleted()) {
            throw new InvalidSessionStateException("Session " + sessionId + " is already completed");
        }

        Map<String, ScoreEntry> byMatch = new HashMap<>();
        scores.forEach(entry -> byMatch.put(entry.matchId(), entry));

        LocalDateTime now = LocalDateTime.now();
        List<Match> completedNow = new ArrayList<>();
        List<MatchRecord> applied = new ArrayList<>();
        for (Match match : matchRepository.findBySessionIdAndRoundNumberOrderByMatchOrderAsc(sessionId, roundNumber)) {
            if (match.isCompleted()) continue;
            ScoreEntry entry = byMatch.get(match.getId());
            match.complete(entry.team1Score(), entry.team2Score(), now);
            completedNow.add(match);
            applied.add(MatchRecord.from(match));
        }
        matchRepository.saveAll(completedNow);

        List<MatchOutcome> outcomes = new ArrayList<>();
        for (RatingProjection projection : projections.all()) {
            Set<String> participants = new LinkedHashSet<>();
            for (MatchRecord match : applied) {
                if (projection.accepts(match)) participants.addAll(projection.participantsOf(match));
            }
            if (participants.isEmpty()) continue;

            Map<String, RatingState> current = ratingStore.load(projection.kind(), participants);
            ReplayResult result = ReplayEngine.apply(projection, current, applied);

            snapshotStore.record(result.outcomes());
            ratingStore.persist(projection.kind(), result.endStates());
            outcomes.addAll(result.outcomes());
        }

        boolean completed = matchRepository.countBySessionIdAndStatus(sessionId, MatchStatus.PENDING) == 0;
        if (completed) {
            session.complete(now);
            summaryService.refreshBestWorst(session);
            log.info("Session {} completed after round {}", sessionId, roundNumber);
        }

        return new RoundResult(sessionId, roundNumber, completed, outcomes);
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record ScoreEntry(String matchId, Integer team1Score, Integer team2Score) {}

    public record RoundResult(
            String sessionId,
            int roundNumber,
            boolean sessionCompleted,
            List<MatchOutcome> outcomes
    ) {}
}
