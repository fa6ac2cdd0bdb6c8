package com.sessionelo.sessionelo_api.service;

import com.sessionelo.sessionelo_api.elo.EloCalculator;
import com.sessionelo.sessionelo_api.elo.MatchRecord;
import com.sessionelo.sessionelo_api.elo.MatchResult;
import com.sessionelo.sessionelo_api.elo.RatingState;
import com.sessionelo.sessionelo_api.exception.ResourceNotFoundException;
import com.sessionelo.sessionelo_api.exception.ValidationException;
import com.sessionelo.sessionelo_api.model.MatchType;
import com.sessionelo.sessionelo_api.model.RatingKind;
import com.sessionelo.sessionelo_api.repository.PlayerRepository;
import com.sessionelo.sessionelo_api.repository.SessionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Singles records of a player against each opponent, read from the match log.
 * Results come from the scores, so a win whose Elo delta rounded to zero is
 * still a win.
 */
@Service
@Transactional(readOnly = true)
public class HeadToHeadService {

    private final PlayerRepository playerRepository;
    private final SessionRepository sessionRepository;
    private final MatchLog matchLog;
    private final RatingStore ratingStore;

    public HeadToHeadService(PlayerRepository playerRepository,
                             SessionRepository sessionRepository,
                             MatchLog matchLog,
                             RatingStore ratingStore) {
        this.playerRepository = playerRepository;
        this.sessionRepository = sessionRepository;
        this.matchLog = matchLog;
        this.ratingStore = ratingStore;
    }

    public HeadToHead headToHead(String playerId, String opponentId) {
        if (opponentId == null || opponentId.isBlank()) {
            throw new ValidationException("opponentId is required");
        }
        if (playerId.equals(opponentId)) {
            throw new ValidationException("Player and opponent cannot be the same");
        }
        requirePlayer(playerId);
        requirePlayer(opponentId);

        OpponentRecord record = recordsOf(playerId)
                .getOrDefault(opponentId, OpponentRecord.none(opponentId));
        return new HeadToHead(playerId, singlesElo(playerId), opponentId, singlesElo(opponentId), record);
    }

    /** One record per opponent, most-played first. */
    public List<OpponentRecord> opponentRecords(String playerId) {
        requirePlayer(playerId);
        return recordsOf(playerId).values().stream()
                .sorted(Comparator.comparingInt(OpponentRecord::matches).reversed()
                        .thenComparing(OpponentRecord::opponentId))
                .toList();
    }

    private Map<String, OpponentRecord> recordsOf(String playerId) {
        Map<String, OpponentRecord> records = new LinkedHashMap<>();
        for (MatchRecord match : matchLog.completedMatchesOf(sessionRepository.findAllByOrderByCreatedAtAscIdAsc())) {
            if (match.type() != MatchType.SINGLES || !match.isScored()) continue;
            int side = match.playerIds().indexOf(playerId);
            if (side < 0) continue;

            String opponentId = match.playerIds().get(1 - side);
            int own = side == 0 ? match.score1() : match.score2();
            int other = side == 0 ? match.score2() : match.score1();
            records.put(opponentId, records.getOrDefault(opponentId, OpponentRecord.none(opponentId)).plus(own, other));
        }
        return records;
    }

    private int singlesElo(String playerId) {
        return ratingStore.find(RatingKind.SINGLES, playerId)
                .map(RatingState::elo)
                .orElse(EloCalculator.DEFAULT_RATING);
    }

    private void requirePlayer(String playerId) {
        if (!playerRepository.existsById(playerId)) {
            throw new ResourceNotFoundException("Player", playerId);
        }
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record HeadToHead(
            String playerId, int playerElo,
            String opponentId, int opponentElo,
            OpponentRecord record
    ) {}

    /** From the player's side: wins are the player's, scoreFor is the player's points. */
    public record OpponentRecord(
            String opponentId,
            int matches, int wins, int losses, int draws,
            int scoreFor, int scoreAgainst
    ) {
        static OpponentRecord none(String opponentId) {
            return new OpponentRecord(opponentId, 0, 0, 0, 0, 0, 0);
        }

        OpponentRecord plus(int own, int other) {
            MatchResult result = MatchResult.of(own, other);
            return new OpponentRecord(opponentId,
                    matches + 1,
                    wins + (result == MatchResult.WIN ? 1 : 0),
                    losses + (result == MatchResult.LOSS ? 1 : 0),
                    draws + (result == MatchResult.DRAW ? 1 : 0),
                    scoreFor + own,
                    scoreAgainst + other);
        }
    }
}
