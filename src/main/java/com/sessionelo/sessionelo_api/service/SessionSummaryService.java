package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.RatingProjection;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-session results: Elo before/after and this session's record for every
 * participant, and the session's best and worst singles performer.
 */
@Service
@Transactional(readOnly = true)
public class SessionSummaryService {

    // Wins DESC, losses ASC, Elo change DESC, then id for a deterministic order
    private static final Comparator<ParticipantSummary> STANDINGS_ORDER =
            Comparator.comparingInt(ParticipantSummary::wins).reversed()
                    .thenComparingInt(ParticipantSummary::losses)
                    .thenComparing(Comparator.comparingInt(ParticipantSummary::delta).reversed())
                    .thenComparing(ParticipantSummary::participantId);

    private final SessionRepository sessionRepository;
    private final SessionBaselineService baselineService;
    private final RatingProjections projections;

    public SessionSummaryService(SessionRepository sessionRepository,
                                 SessionBaselineService baselineService,
                                 RatingProjections projections) {
        this.sessionRepository = sessionRepository;
        this.baselineService = baselineService;
        this.projections = projections;
    }

    // =========================================================================
    // Summary
    // =========================================================================

    public SessionSummary computeSessionSummary(String sessionId) {
        Session session = loadSession(sessionId);

        Map<RatingKind, List<ParticipantSummary>> byKind = new EnumMap<>(RatingKind.class);
        for (RatingProjection projection : projections.all()) {
            byKind.put(projection.kind(), summarize(session, projection));
        }

        return new SessionSummary(
                session.getId(),
                byKind.get(RatingKind.SINGLES),
                byKind.get(RatingKind.DOUBLES_PLAYER),
                byKind.get(RatingKind.DOUBLES_TEAM)
        );
    }

    private List<ParticipantSummary> summarize(Session session, RatingProjection projection) {
        Map<String, RatingState> before = baselineService.baselineBefore(session, projection);
        Map<String, RatingState> after = baselineService.replayThisSession(session.getId(), before, projection);

        List<ParticipantSummary> rows = new ArrayList<>();
        for (Map.Entry<String, RatingState> entry : after.entrySet()) {
            RatingState start = before.getOrDefault(entry.getKey(), RatingState.initial());
            RatingState end = entry.getValue();
            if (end.matchesPlayed() == start.matchesPlayed()) continue; // didn't play this session

            rows.add(new ParticipantSummary(
                    entry.getKey(),
                    start.elo(),
                    end.elo(),
                    end.elo() - start.elo(),
                    end.matchesPlayed() - start.matchesPlayed(),
                    end.wins() - start.wins(),
                    end.losses() - start.losses(),
                    end.draws() - start.draws()
            ));
        }
        rows.sort(STANDINGS_ORDER);
        return rows;
    }

    // =========================================================================
    // Best / worst player
    // =========================================================================

    /**
     * Best and worst singles Elo change of the session. Ties go to the lowest
     * participant id. Empty when nobody played a completed singles match.
     */
    public Optional<BestWorst> computeBestWorstOfSession(String sessionId) {
        return computeBestWorst(loadSession(sessionId));
    }

    Optional<BestWorst> computeBestWorst(Session session) {
        List<ParticipantSummary> singles = summarize(session, projections.singles());
        if (singles.isEmpty()) return Optional.empty();

        Comparator<ParticipantSummary> byId = Comparator.comparing(ParticipantSummary::participantId);
        ParticipantSummary best = singles.stream()
                .min(Comparator.comparingInt(ParticipantSummary::delta).reversed().thenComparing(byId))
                .orElseThrow();
        ParticipantSummary worst = singles.stream()
                .min(Comparator.comparingInt(ParticipantSummary::delta).thenComparing(byId))
                .orElseThrow();

        return Optional.of(new BestWorst(
                new PlayerDelta(best.participantId(), best.delta()),
                new PlayerDelta(worst.participantId(), worst.delta())
        ));
    }

    /**
     * Re-derive and store the session's cached best/worst columns.
     * Must run inside the caller's write transaction.
     */
    @Transactional
    public void refreshBestWorst(Session session) {
        Optional<BestWorst> bestWorst = computeBestWorst(session);
        session.setBestPlayerId(bestWorst.map(bw -> bw.best().playerId()).orElse(null));
        session.setBestPlayerDelta(bestWorst.map(bw -> bw.best().delta()).orElse(null));
        session.setWorstPlayerId(bestWorst.map(bw -> bw.worst().playerId()).orElse(null));
        session.setWorstPlayerDelta(bestWorst.map(bw -> bw.worst().delta()).orElse(null));
        sessionRepository.save(session);
    }

    private Session loadSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record SessionSummary(
            String sessionId,
            List<ParticipantSummary> singles,
            List<ParticipantSummary> doublesPlayers,
            List<ParticipantSummary> doublesTeams
    ) {}

    /** Counts are this session's only (after minus before). */
    public record ParticipantSummary(
            String participantId,
            int eloBefore, int eloAfter, int delta,
            int matchesPlayed, int wins, int losses, int draws
    ) {}

    public record BestWorst(PlayerDelta best, PlayerDelta worst) {}

    public record PlayerDelta(String playerId, int delta) {}
}
