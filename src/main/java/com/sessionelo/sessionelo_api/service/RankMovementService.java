package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.RatingProjection;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.model.SessionStatus;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * How the leaderboard moved over the latest completed session.
 *
 * The ranking before is the state entering that session, i.e. after the
 * previous completed one; the ranking after adds the session's own matches.
 * Both come from the session baseline, never from the ratings table.
 */
@Service
@Transactional(readOnly = true)
public class RankMovementService {

    private static final Logger log = LoggerFactory.getLogger(RankMovementService.class);

    // Elo DESC, then id, as on the leaderboard
    private static final Comparator<Map.Entry<String, RatingState>> RANK_ORDER =
            Comparator.<Map.Entry<String, RatingState>>comparingInt(e -> e.getValue().elo()).reversed()
                    .thenComparing(Map.Entry::getKey);

    private final SessionRepository sessionRepository;
    private final SessionBaselineService baselineService;
    private final RatingProjections projections;

    public RankMovementService(SessionRepository sessionRepository,
                               SessionBaselineService baselineService,
                               RatingProjections projections) {
        this.sessionRepository = sessionRepository;
        this.baselineService = baselineService;
        this.projections = projections;
    }

    /**
     * Movement per ranked participant, in current rank order. Positive means
     * the participant climbed. Participants ranked for the first time get 0
     * and no previous rank. Empty when no session has completed yet.
     */
    public RankMovements computeRankMovements(RatingKind kind) {
        Optional<Session> latest = sessionRepository.findFirstByStatusOrderByCreatedAtDescIdDesc(SessionStatus.COMPLETED);
        if (latest.isEmpty()) {
            return new RankMovements(kind, null, List.of());
        }
        Session session = latest.get();
        RatingProjection projection = projections.forKind(kind);

        Map<String, RatingState> before = baselineService.baselineBefore(session, projection);
        Map<String, RatingState> after = baselineService.replayThisSession(session.getId(), before, projection);

        Map<String, Integer> previousRanks = new HashMap<>();
        List<Map.Entry<String, RatingState>> previous = ranked(before);
        for (int i = 0; i < previous.size(); i++) {
            previousRanks.put(previous.get(i).getKey(), i + 1);
        }

        List<RankMovement> movements = new ArrayList<>();
        List<Map.Entry<String, RatingState>> current = ranked(after);
        for (int i = 0; i < current.size(); i++) {
            String participantId = current.get(i).getKey();
            int rank = i + 1;
            Integer previousRank = previousRanks.get(participantId);
            movements.add(new RankMovement(
                    participantId,
                    current.get(i).getValue().elo(),
                    rank,
                    previousRank,
                    previousRank == null ? 0 : previousRank - rank
            ));
        }

        log.debug("Rank movements for {} over session {}: {} ranked, {} before",
                kind, session.getId(), movements.size(), previousRanks.size());
        return new RankMovements(kind, session.getId(), movements);
    }

    private static List<Map.Entry<String, RatingState>> ranked(Map<String, RatingState> states) {
        return states.entrySet().stream()
                .filter(e -> e.getValue().matchesPlayed() > 0)
                .sorted(RANK_ORDER)
                .toList();
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record RankMovements(RatingKind kind, String sessionId, List<RankMovement> movements) {}

    public record RankMovement(
            String participantId,
            int elo,
            int rank,
            Integer previousRank,
            int movement
    ) {}
}
