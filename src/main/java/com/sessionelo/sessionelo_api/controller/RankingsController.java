package com.sessionelo.sessionelo_api.controller;

import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.model.Rating;
import com.sessionelo.sessionelo_api.repository.EloHistoryRepository;
import com.sessionelo.sessionelo_api.repository.RatingRepository;
import com.sessionelo.sessionelo_api.service.RankMovementService;
import com.sessionelo.sessionelo_api.service.RankMovementService.RankMovements;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api")
public class RankingsController {

    private final RatingRepository ratingRepository;
    private final EloHistoryRepository historyRepository;
    private final RankMovementService rankMovementService;
    private final int maxLimit;

    public RankingsController(RatingRepository ratingRepository,
                              EloHistoryRepository historyRepository,
                              RankMovementService rankMovementService,
                              @Value("${sessionelo.rankings.max-limit:100}") int maxLimit) {
        this.ratingRepository = ratingRepository;
        this.historyRepository = historyRepository;
        this.rankMovementService = rankMovementService;
        this.maxLimit = maxLimit;
    }

    // =========================================================================
    // Leaderboard (one per projection)
    // =========================================================================

    /**
     * GET /api/rankings?kind=SINGLES&limit=50
     */
    @GetMapping("/rankings")
    public ResponseEntity<RankingsResponse> getRankings(
            @RequestParam(defaultValue = "SINGLES") RatingKind kind,
            @RequestParam(defaultValue = "50") int limit) {

        limit = Math.max(1, Math.min(limit, maxLimit));
        List<Rating> top = ratingRepository.findTopByKind(kind, PageRequest.of(0, limit));

        List<RankedParticipantDTO> ranked = new ArrayList<>();
        for (int i = 0; i < top.size(); i++) {
            Rating r = top.get(i);
            ranked.add(new RankedParticipantDTO(
                    i + 1,
                    r.getParticipantId(),
                    r.getElo(),
                    r.getMatchesPlayed(),
                    r.getWins(),
                    r.getLosses(),
                    r.getDraws()
            ));
        }
        return ResponseEntity.ok(new RankingsResponse(kind.name(), ranked));
    }

    /**
     * GET /api/rankings/movements?kind=SINGLES
     * Rank changes over the latest completed session.
     */
    @GetMapping("/rankings/movements")
    public ResponseEntity<RankMovements> getRankMovements(@RequestParam(defaultValue = "SINGLES") RatingKind kind) {
        return ResponseEntity.ok(rankMovementService.computeRankMovements(kind));
    }

    // =========================================================================
    // Per-participant Elo history
    // =========================================================================

    /**
     * GET /api/players/{participantId}/elo-history?kind=SINGLES
     * For DOUBLES_TEAM pass the team id.
     */
    @GetMapping("/players/{participantId}/elo-history")
    public ResponseEntity<List<EloHistoryDTO>> getEloHistory(
            @PathVariable String participantId,
            @RequestParam(defaultValue = "SINGLES") RatingKind kind) {

        List<EloHistoryDTO> history = historyRepository.findHistory(kind, participantId).stream()
                .map(h -> new EloHistoryDTO(
                        h.getMatchId(), h.getSessionId(),
                        h.getEloBefore(), h.getEloAfter(), h.getDelta(), h.getKFactor()))
                .toList();
        return ResponseEntity.ok(history);
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record RankingsResponse(String kind, List<RankedParticipantDTO> participants) {}

    public record RankedParticipantDTO(
            int rank, String participantId,
            int elo, int matchesPlayed,
            int wins, int losses, int draws
    ) {}

    public record EloHistoryDTO(
            String matchId, String sessionId,
            int eloBefore, int eloAfter, int delta, int kFactor
    ) {}
}
