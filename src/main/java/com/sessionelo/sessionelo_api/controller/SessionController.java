package com.sessionelo.sessionelo_api.controller;

import com.sessionelo.sessionelo_api.elo.ParticipantChange;
import com.sessionelo.sessionelo_api.model.Match;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.service.EloService;
import com.sessionelo.sessionelo_api.service.EloService.RoundResult;
import com.sessionelo.sessionelo_api.service.EloService.ScoreEntry;
import com.sessionelo.sessionelo_api.service.MatchCorrectionService;
import com.sessionelo.sessionelo_api.service.MatchCorrectionService.CorrectionRequest;
import com.sessionelo.sessionelo_api.service.MatchCorrectionService.CorrectionResult;
import com.sessionelo.sessionelo_api.service.SessionDeletionService;
import com.sessionelo.sessionelo_api.service.SessionDeletionService.Deletability;
import com.sessionelo.sessionelo_api.service.SessionDeletionService.DeletionResult;
import com.sessionelo.sessionelo_api.service.SessionService;
import com.sessionelo.sessionelo_api.service.SessionService.NewSession;
import com.sessionelo.sessionelo_api.service.SessionService.SessionView;
import com.sessionelo.sessionelo_api.service.SessionSummaryService;
import com.sessionelo.sessionelo_api.service.SessionSummaryService.BestWorst;
import com.sessionelo.sessionelo_api.service.SessionSummaryService.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionService sessionService;
    private final EloService eloService;
    private final MatchCorrectionService correctionService;
    private final SessionDeletionService deletionService;
    private final SessionSummaryService summaryService;

    public SessionController(SessionService sessionService,
                             EloService eloService,
                             MatchCorrectionService correctionService,
                             SessionDeletionService deletionService,
                             SessionSummaryService summaryService) {
        this.sessionService = sessionService;
        this.eloService = eloService;
        this.correctionService = correctionService;
        this.deletionService = deletionService;
        this.summaryService = summaryService;
    }

    // =========================================================================
    // Session lifecycle
    // =========================================================================

    /**
     * POST /api/sessions
     */
    @PostMapping
    public ResponseEntity<SessionResponse> createSession(@RequestBody NewSession request) {
        SessionView view = sessionService.createSession(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(view));
    }

    /**
     * GET /api/sessions/{sessionId}
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.from(sessionService.getSession(sessionId)));
    }

    /**
     * POST /api/sessions/{sessionId}/complete
     * Closes the session early; pending matches are left unplayed.
     */
    @PostMapping("/{sessionId}/complete")
    public ResponseEntity<SessionResponse> completeSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionResponse.from(sessionService.completeSession(sessionId)));
    }

    // =========================================================================
    // Results
    // =========================================================================

    /**
     * POST /api/sessions/{sessionId}/rounds/{roundNumber}/submit
     */
    @PostMapping("/{sessionId}/rounds/{roundNumber}/submit")
    public ResponseEntity<RoundResult> submitRound(@PathVariable String sessionId,
                                                   @PathVariable int roundNumber,
                                                   @RequestBody SubmitRoundRequest request) {
        log.info("Round {} submitted for session {}", roundNumber, sessionId);
        List<ScoreEntry> scores = request == null ? List.of() : request.scores();
        return ResponseEntity.ok(eloService.submitRound(sessionId, roundNumber, scores));
    }

    /**
     * PUT /api/sessions/{sessionId}/matches/{matchId}
     * Corrects a completed singles score. 409 while another recalculation runs.
     */
    @PutMapping("/{sessionId}/matches/{matchId}")
    public ResponseEntity<CorrectionResponse> correctMatch(@PathVariable String sessionId,
                                                           @PathVariable String matchId,
                                                           @RequestBody CorrectionRequest request) {
        log.info("Correction requested for match {} in session {}", matchId, sessionId);
        CorrectionResult result = correctionService.correctMatch(sessionId, matchId, request);
        return ResponseEntity.ok(new CorrectionResponse(
                result.sessionId(), result.matchId(),
                result.team1Score(), result.team2Score(),
                result.replayedMatches(),
                result.editedMatchChanges().stream().map(EloChangeDTO::from).toList()
        ));
    }

    // =========================================================================
    // Deletion
    // =========================================================================

    /**
     * GET /api/sessions/{sessionId}/deletable
     */
    @GetMapping("/{sessionId}/deletable")
    public ResponseEntity<Deletability> checkDeletable(@PathVariable String sessionId) {
        return ResponseEntity.ok(deletionService.checkDeletable(sessionId));
    }

    /**
     * DELETE /api/sessions/{sessionId}
     * Only the most recent completed session; all ratings are rebuilt.
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<DeletionResult> deleteSession(@PathVariable String sessionId) {
        log.info("Deletion requested for session {}", sessionId);
        return ResponseEntity.ok(deletionService.deleteSession(sessionId));
    }

    // =========================================================================
    // Summaries
    // =========================================================================

    /**
     * GET /api/sessions/{sessionId}/summary
     */
    @GetMapping("/{sessionId}/summary")
    public ResponseEntity<SessionSummary> getSummary(@PathVariable String sessionId) {
        return ResponseEntity.ok(summaryService.computeSessionSummary(sessionId));
    }

    /**
     * GET /api/sessions/{sessionId}/best-worst
     * 204 when nobody played a completed singles match.
     */
    @GetMapping("/{sessionId}/best-worst")
    public ResponseEntity<BestWorst> getBestWorst(@PathVariable String sessionId) {
        return summaryService.computeBestWorstOfSession(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record SubmitRoundRequest(List<ScoreEntry> scores) {}

    public record SessionResponse(
            String id, String name, String status,
            LocalDateTime createdAt, LocalDateTime completedAt,
            String recalcStatus,
            String bestPlayerId, Integer bestPlayerDelta,
            String worstPlayerId, Integer worstPlayerDelta,
            List<MatchDTO> matches
    ) {
        static SessionResponse from(SessionView view) {
            Session s = view.session();
            return new SessionResponse(
                    s.getId(), s.getName(), s.getStatus().name(),
                    s.getCreatedAt(), s.getCompletedAt(),
                    s.getRecalcStatus() != null ? s.getRecalcStatus().name() : "IDLE",
                    s.getBestPlayerId(), s.getBestPlayerDelta(),
                    s.getWorstPlayerId(), s.getWorstPlayerDelta(),
                    view.matches().stream().map(MatchDTO::from).toList()
            );
        }
    }

    public record MatchDTO(
            String id, int roundNumber, int matchOrder, String matchType,
            List<String> playerIds, Integer team1Score, Integer team2Score,
            String status, boolean edited, String editedBy, String editReason
    ) {
        static MatchDTO from(Match m) {
            return new MatchDTO(
                    m.getId(), m.getRoundNumber(), m.getMatchOrder(), m.getMatchType().name(),
                    m.getPlayerIds(), m.getTeam1Score(), m.getTeam2Score(),
                    m.getStatus().name(), m.isEdited(), m.getEditedBy(), m.getEditReason()
            );
        }
    }

    public record CorrectionResponse(
            String sessionId, String matchId,
            int team1Score, int team2Score,
            int replayedMatches,
            List<EloChangeDTO> changes
    ) {}

    public record EloChangeDTO(String participantId, int eloBefore, int eloAfter, int delta, int kFactor) {
        static EloChangeDTO from(ParticipantChange change) {
            return new EloChangeDTO(change.participantId(),
                    change.before().elo(), change.after().elo(), change.delta(), change.kFactor());
        }
    }
}
