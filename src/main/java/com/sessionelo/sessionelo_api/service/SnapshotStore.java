package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.MatchOutcome;
import com.sessionelo.sessionelo_api.elo.ParticipantChange;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.model.EloHistoryEntry;
import com.sessionelo.sessionelo_api.model.EloSnapshot;
import com.sessionelo.sessionelo_api.model.Match;
import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.model.Session;
import com.sessionelo.sessionelo_api.repository.EloHistoryRepository;
import com.sessionelo.sessionelo_api.repository.EloSnapshotRepository;
import com.sessionelo.sessionelo_api.repository.MatchRepository;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Per-match checkpoints of rating state, plus the audit history written
 * alongside them.
 *
 * There is no snapshot "before" a match: the state entering match k is the
 * participant's snapshot after their previous match, or the session baseline
 * when there is none.
 */
@Service
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final EloSnapshotRepository snapshotRepository;
    private final EloHistoryRepository historyRepository;
    private final MatchRepository matchRepository;
    private final SessionRepository sessionRepository;

    public SnapshotStore(EloSnapshotRepository snapshotRepository,
                         EloHistoryRepository historyRepository,
                         MatchRepository matchRepository,
                         SessionRepository sessionRepository) {
        this.snapshotRepository = snapshotRepository;
        this.historyRepository = historyRepository;
        this.matchRepository = matchRepository;
        this.sessionRepository = sessionRepository;
    }

    // =========================================================================
    // Writes
    // =========================================================================

    /** Upsert the state after {@code matchId}. Writing the same state twice is a no-op. */
    public void put(String matchId, RatingKind kind, String participantId, RatingState state) {
        EloSnapshot snapshot = snapshotRepository.findByMatchIdAndKindAndParticipantId(matchId, kind, participantId)
                .orElseGet(() -> new EloSnapshot(matchId, kind, participantId, state));
        snapshot.overwrite(state);
        snapshotRepository.save(snapshot);
    }

    /**
     * Write the snapshots and history rows of freshly replayed matches.
     * The matches' previous rows must already have been removed with
     * {@link #deleteFrom(Collection)}.
     */
    public void record(List<MatchOutcome> outcomes) {
        List<EloSnapshot> snapshots = new ArrayList<>();
        List<EloHistoryEntry> history = new ArrayList<>();
        for (MatchOutcome outcome : outcomes) {
            for (ParticipantChange change : outcome.changes()) {
                snapshots.add(new EloSnapshot(outcome.matchId(), outcome.kind(),
                        change.participantId(), change.after()));
                history.add(new EloHistoryEntry(outcome.matchId(), outcome.sessionId(), outcome.kind(),
                        change.participantId(), change.before().elo(), change.after().elo(), change.kFactor()));
            }
        }
        snapshotRepository.saveAll(snapshots);
        historyRepository.saveAll(history);
    }

    /** Remove snapshots and history rows of every match in {@code matchIds}. */
    public void deleteFrom(Collection<String> matchIds) {
        if (matchIds.isEmpty()) return;
        int snapshots = snapshotRepository.deleteByMatchIdIn(matchIds);
        int history = historyRepository.deleteByMatchIdIn(matchIds);
        log.debug("Deleted {} snapshots and {} history rows for {} matches", snapshots, history, matchIds.size());
    }

    public void deleteAll() {
        snapshotRepository.deleteAllSnapshots();
        historyRepository.deleteAllHistory();
    }

    // =========================================================================
    // Reads
    // =========================================================================

    /**
     * State of the participant after their own latest match preceding
     * {@code matchId}, or empty when they have none (use a baseline instead).
     */
    public Optional<RatingState> getBefore(RatingKind kind, String participantId, String matchId) {
        Match match = matchRepository.findById(matchId)
                .orElseThrow(() -> new ResourceNotFoundException("Match", matchId));
        Session session = sessionRepository.findById(match.getSessionId())
                .orElseThrow(() -> new ResourceNotFoundException("Session", match.getSessionId()));
        return getBefore(kind, participantId, match, session);
    }

    public Optional<RatingState> getBefore(RatingKind kind, String participantId, Match match, Session session) {
        return snapshotRepository.findLatestBefore(
                        kind, participantId,
                        session.getId(), session.getCreatedAt(),
                        match.getRoundNumber(), match.getMatchOrder(),
                        PageRequest.of(0, 1))
                .stream()
                .findFirst()
                .map(EloSnapshot::toState);
    }
}
