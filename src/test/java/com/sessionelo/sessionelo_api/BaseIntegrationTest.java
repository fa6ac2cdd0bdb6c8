package com.sessionelo.sessionelo_api;

import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.model.Match;
import com.sessionelo.sessionelo_api.model.Player;
import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.repository.DoubleTeamRepository;
import com.sessionelo.sessionelo_api.repository.EloHistoryRepository;
import com.sessionelo.sessionelo_api.repository.EloSnapshotRepository;
import com.sessionelo.sessionelo_api.repository.MatchRepository;
import com.sessionelo.sessionelo_api.repository.PlayerRepository;
import com.sessionelo.sessionelo_api.repository.RatingRepository;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import com.sessionelo.sessionelo_api.service.EloService;
import com.sessionelo.sessionelo_api.service.EloService.RoundResult;
import com.sessionelo.sessionelo_api.service.EloService.ScoreEntry;
import com.sessionelo.sessionelo_api.service.RatingStore;
import com.sessionelo.sessionelo_api.service.SessionService;
import com.sessionelo.sessionelo_api.service.SessionService.NewMatch;
import com.sessionelo.sessionelo_api.service.SessionService.NewSession;
import com.sessionelo.sessionelo_api.service.SessionService.SessionView;
import com.sessionelo.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

/**
 * Base class for integration tests.
 *
 * Boots the full Spring context once per concrete test class with real HTTP
 * and an in-memory H2 database (PostgreSQL mode) from the "test" profile.
 * Every test starts from empty tables.
 *
 * Most tests drive the services directly and read results back through the
 * repositories; the HTTP helpers are for status-code and wiring checks.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
public abstract class BaseIntegrationTest {

    // =========================================================================
    // Injected Spring beans
    // =========================================================================

    @LocalServerPort
    protected int port;

    @Autowired protected TestRestTemplate restTemplate;

    @Autowired protected PlayerRepository playerRepository;
    @Autowired protected SessionRepository sessionRepository;
    @Autowired protected MatchRepository matchRepository;
    @Autowired protected RatingRepository ratingRepository;
    @Autowired protected EloSnapshotRepository snapshotRepository;
    @Autowired protected EloHistoryRepository historyRepository;
    @Autowired protected DoubleTeamRepository doubleTeamRepository;

    @Autowired protected SessionService sessionService;
    @Autowired protected EloService eloService;
    @Autowired protected RatingStore ratingStore;

    // =========================================================================
    // Per-test state reset
    // =========================================================================

    @BeforeEach
    void resetState() {
        // Derived tables first, then the log itself
        historyRepository.deleteAllInBatch();
        snapshotRepository.deleteAllInBatch();
        ratingRepository.deleteAllInBatch();
        doubleTeamRepository.deleteAllInBatch();
        matchRepository.deleteAllInBatch();
        sessionRepository.deleteAllInBatch();
        playerRepository.deleteAllInBatch();
    }

    // =========================================================================
    // Data helpers
    // =========================================================================

    protected String player(String displayName) {
        return playerRepository.save(new Player(displayName)).getId();
    }

    /** Session named after its day, created {@code day} days after the fixture base time. */
    protected SessionView session(int day, NewMatch... matches) {
        return sessionService.createSession(
                new NewSession("Session " + day, TestFixtures.dayOf(day), List.of(matches)));
    }

    protected String matchId(SessionView view, int round, int order) {
        return view.matches().stream()
                .filter(m -> m.getRoundNumber() == round && m.getMatchOrder() == order)
                .map(Match::getId)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No match at round " + round + ", order " + order));
    }

    protected RoundResult submit(String sessionId, int round, ScoreEntry... scores) {
        return eloService.submitRound(sessionId, round, List.of(scores));
    }

    protected static ScoreEntry score(String matchId, int team1Score, int team2Score) {
        return new ScoreEntry(matchId, team1Score, team2Score);
    }

    protected RatingState singlesRating(String playerId) {
        return ratingStore.find(RatingKind.SINGLES, playerId)
                .orElseThrow(() -> new IllegalStateException("No singles rating for " + playerId));
    }

    // =========================================================================
    // HTTP helpers (no exception on 4xx/5xx; check the status code)
    // =========================================================================

    protected ResponseEntity<String> httpGet(String path) {
        return restTemplate.getForEntity(url(path), String.class);
    }

    protected ResponseEntity<String> httpPost(String path, Object body) {
        return exchange(path, HttpMethod.POST, body);
    }

    protected ResponseEntity<String> httpPut(String path, Object body) {
        return exchange(path, HttpMethod.PUT, body);
    }

    protected ResponseEntity<String> httpDelete(String path) {
        return exchange(path, HttpMethod.DELETE, null);
    }

    private ResponseEntity<String> exchange(String path, HttpMethod method, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(url(path), method, new HttpEntity<>(body, headers), String.class);
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }
}
