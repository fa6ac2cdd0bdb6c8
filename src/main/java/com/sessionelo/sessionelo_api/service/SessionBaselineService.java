package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.RatingProjection;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.elo.ReplayEngine;
import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.model.SessionStatus;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * "Elo entering a session" and "Elo leaving a session", re-derived from the
 * match log on every call. The ratings table is never read here.
 */
@Service
@Transactional(readOnly = true)
public class SessionBaselineService {

    private final SessionRepository sessionRepository;
    private final MatchLog matchLog;

    public SessionBaselineService(SessionRepository sessionRepository, MatchLog matchLog) {
        this.sessionRepository = sessionRepository;
        this.matchLog = matchLog;
    }

    public Map<String, RatingState> baselineBefore(String sessionId, RatingProjection projection) {
        return baselineBefore(loadSession(sessionId), projection);
    }

    /**
     * Replays every completed session ordered before {@code session} by
     * (createdAt, id), oldest first, from the all-default state. No
     * predecessors = empty map (everyone at 1500/0).
     */
    public Map<String, RatingState> baselineBefore(Session session, RatingProjection projection) {
        List<Session> previous = sessionRepository.findByStatusOrderedBefore(
                SessionStatus.COMPLETED, session.getCreatedAt(), session.getId());
        return ReplayEngine.apply(projection, Map.of(), matchLog.completedMatchesOf(previous)).endStates();
    }

    /**
     * Applies only this session's completed matches on top of {@code baseline}.
     */
    public Map<String, RatingState> replayThisSession(String sessionId,
                                                      Map<String, RatingState> baseline,
                                                      RatingProjection projection) {
        return ReplayEngine.apply(projection, baseline, matchLog.completedMatchesOf(sessionId)).endStates();
    }

    private Session loadSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
    }
}
