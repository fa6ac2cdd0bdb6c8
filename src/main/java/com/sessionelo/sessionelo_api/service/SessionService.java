package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.exception.InvalidSessionStateException;
import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.exception.ValidationException;
import com.sessionelo.sessionelo_api.model.Match;
import com.sessionelo.sessionelo_api.model.MatchType;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.model.SessionStatus;
import com.sessionelo.sessionelo_api.repository.MatchRepository;
import com.sessionelo.sessionelo_api.repository.PlayerRepository;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Session lifecycle outside of rating math: create a session with its
 * scheduled matches, read it back, force it closed.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRepository sessionRepository;
    private final MatchRepository matchRepository;
    private final PlayerRepository playerRepository;
    private final SessionSummaryService summaryService;

    public SessionService(SessionRepository sessionRepository,
                          MatchRepository matchRepository,
                          PlayerRepository playerRepository,
                          SessionSummaryService summaryService) {
        this.sessionRepository = sessionRepository;
        this.matchRepository = matchRepository;
        this.playerRepository = playerRepository;
        this.summaryService = summaryService;
    }

    // =========================================================================
    // Create
    // =========================================================================

    /**
     * Creates an ACTIVE session with every match PENDING. {@code createdAt}
     * defaults to now; it must be strictly after the latest completed session.
     * Sessions are only appended to the end of the log, and an equal
     * timestamp would leave the order to the generated id.
     */
    @Transactional
    public SessionView createSession(NewSession request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new ValidationException("Session name is required");
        }
        if (request.matches() == null || request.matches().isEmpty()) {
            throw new ValidationException("A session needs at least one match");
        }

        LocalDateTime createdAt = request.createdAt() != null ? request.createdAt() : LocalDateTime.now();
        sessionRepository.findFirstByStatusOrderByCreatedAtDescIdDesc(SessionStatus.COMPLETED)
                .filter(latest -> !createdAt.isAfter(latest.getCreatedAt()))
                .ifPresent(latest -> {
                    throw new ValidationException("createdAt " + createdAt
                            + " must be after the latest completed session (" + latest.getCreatedAt() + ")");
                });

        validateMatches(request.matches());

        Session session = sessionRepository.save(new Session(request.name().trim(), createdAt));
        List<Match> matches = request.matches().stream()
                .map(m -> new Match(session.getId(), m.roundNumber(), m.matchOrder(), m.matchType(), m.playerIds()))
                .toList();
        matchRepository.saveAll(matches);

        log.info("Created session {} '{}' with {} matches", session.getId(), session.getName(), matches.size());
        return new SessionView(session, matchRepository.findBySessionOrdered(session.getId()));
    }

    private void validateMatches(List<NewMatch> matches) {
        Set<String> slots = new HashSet<>();
        Set<String> allPlayers = new HashSet<>();

        for (NewMatch match : matches) {
            if (match.matchType() == null) {
                throw new ValidationException("matchType is required");
            }
            if (match.roundNumber() < 1 || match.matchOrder() < 1) {
                throw new ValidationException("roundNumber and matchOrder start at 1");
            }
            if (!slots.add(match.roundNumber() + "/" + match.matchOrder())) {
                throw new ValidationException("Duplicate match at round " + match.roundNumber()
                        + ", order " + match.matchOrder());
            }

            List<String> ids = match.playerIds();
            int expected = match.matchType().getPlayerCount();
            if (ids == null || ids.size() != expected) {
                throw new ValidationException(match.matchType() + " matches need exactly " + expected + " players");
            }
            if (ids.stream().anyMatch(id -> id == null || id.isBlank())) {
                throw new ValidationException("Player ids must not be blank");
            }
            if (new HashSet<>(ids).size() != ids.size()) {
                throw new ValidationException("A player can appear only once in a match");
            }
            allPlayers.addAll(ids);
        }

        long known = playerRepository.findAllById(allPlayers).size();
        if (known != allPlayers.size()) {
            throw new ValidationException("Unknown player id in session matches");
        }
    }

    // =========================================================================
    // Read
    // =========================================================================

    @Transactional(readOnly = true)
    public SessionView getSession(String sessionId) {
        Session session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
        return new SessionView(session, matchRepository.findBySessionOrdered(sessionId));
    }

    // =========================================================================
    // Force-complete
    // =========================================================================

    /**
     * Closes an ACTIVE session early. Its pending matches stay pending and are
     * never replayed.
     */
    @Transactional
    public SessionView completeSession(String sessionId) {
        Session session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
        if (session.isCompleted()) {
            throw new InvalidSessionStateException("Session " + sessionId + " is already completed");
        }

        session.complete(LocalDateTime.now());
        summaryService.refreshBestWorst(session);
        log.info("Session {} force-completed", sessionId);
        return new SessionView(session, matchRepository.findBySessionOrdered(sessionId));
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record NewSession(String name, LocalDateTime createdAt, List<NewMatch> matches) {}

    public record NewMatch(int roundNumber, int matchOrder, MatchType matchType, List<String> playerIds) {}

    public record SessionView(Session session, List<Match> matches) {}
}
