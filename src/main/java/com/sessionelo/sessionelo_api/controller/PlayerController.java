package com.sessionelo.sessionelo_api.controller;

import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.exception.ValidationException;
import com.sessionelo.sessionelo_api.model.Player;
import com.sessionelo.sessionelo_api.repository.PlayerRepository;
import com.sessionelo.sessionelo_api.service.HeadToHeadService;
import com.sessionelo.sessionelo_api.service.HeadToHeadService.HeadToHead;
import com.sessionelo.sessionelo_api.service.HeadToHeadService.OpponentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/players")
public class PlayerController {
    private static final Logger log = LoggerFactory.getLogger(PlayerController.class);

    private final PlayerRepository playerRepository;
    private final HeadToHeadService headToHeadService;

    public PlayerController(PlayerRepository playerRepository, HeadToHeadService headToHeadService) {
        this.playerRepository = playerRepository;
        this.headToHeadService = headToHeadService;
    }

    /**
     * POST /api/players
     */
    @PostMapping
    public ResponseEntity<PlayerDTO> createPlayer(@RequestBody NewPlayerRequest request) {
        String displayName = request == null || request.displayName() == null ? "" : request.displayName().trim();
        if (displayName.isEmpty()) {
            throw new ValidationException("displayName is required");
        }
        if (playerRepository.existsByDisplayName(displayName)) {
            throw new ValidationException("displayName already taken: " + displayName);
        }

        Player player = playerRepository.save(new Player(displayName));
        log.info("Registered player {} ({})", player.getDisplayName(), player.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(PlayerDTO.from(player));
    }

    /**
     * GET /api/players
     */
    @GetMapping
    public ResponseEntity<List<PlayerDTO>> listPlayers() {
        return ResponseEntity.ok(playerRepository.findAllByOrderByDisplayNameAsc().stream()
                .map(PlayerDTO::from).toList());
    }

    /**
     * GET /api/players/{playerId}
     */
    @GetMapping("/{playerId}")
    public ResponseEntity<PlayerDTO> getPlayer(@PathVariable String playerId) {
        Player player = playerRepository.findById(playerId)
                .orElseThrow(() -> new ResourceNotFoundException("Player", playerId));
        return ResponseEntity.ok(PlayerDTO.from(player));
    }

    // =========================================================================
    // Head-to-head (singles only)
    // =========================================================================

    /**
     * GET /api/players/{playerId}/head-to-head?opponentId=...
     */
    @GetMapping("/{playerId}/head-to-head")
    public ResponseEntity<HeadToHead> getHeadToHead(@PathVariable String playerId,
                                                    @RequestParam(required = false) String opponentId) {
        return ResponseEntity.ok(headToHeadService.headToHead(playerId, opponentId));
    }

    /**
     * GET /api/players/{playerId}/opponents
     */
    @GetMapping("/{playerId}/opponents")
    public ResponseEntity<List<OpponentRecord>> getOpponentRecords(@PathVariable String playerId) {
        return ResponseEntity.ok(headToHeadService.opponentRecords(playerId));
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record NewPlayerRequest(String displayName) {}

    public record PlayerDTO(String id, String displayName, String createdAt) {
        static PlayerDTO from(Player p) {
            return new PlayerDTO(p.getId(), p.getDisplayName(),
                    p.getCreatedAt() != null ? p.getCreatedAt().toString() : null);
        }
    }
}
