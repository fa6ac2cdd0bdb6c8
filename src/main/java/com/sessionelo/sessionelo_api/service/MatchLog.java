package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.MatchRecord;
import com.sessionelo.sessionelo_api.model.MatchStatus;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.repository.MatchRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the match log, already in replay order.
 */
@Component
public class MatchLog {

    private final MatchRepository matchRepository;

    public MatchLog(MatchRepository matchRepository) {
        this.matchRepository = matchRepository;
    }

    /** Completed matches of one session, by (round, order). */
    public List<MatchRecord> completedMatchesOf(String sessionId) {
        return matchRepository.findBySessionAndStatusOrdered(sessionId, MatchStatus.COMPLETED).stream()
                .map(MatchRecord::from)
                .toList();
    }

    /** Completed matches of several sessions, concatenated in the order given. */
    public List<MatchRecord> completedMatchesOf(List<Session> sessionsInOrder) {
        List<MatchRecord> matches = new ArrayList<>();
        for (Session session : sessionsInOrder) {
            matches.addAll(completedMatchesOf(session.getId()));
        }
        return matches;
    }
}
