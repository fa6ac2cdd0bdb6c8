package com.sessionelo.sessionelo_api.elo;

import com.sessionelo.sessionelo_api.model.RatingKind;

import java.util.List;
import java.util.Optional;

/**
 * Everything one applied match did to one projection.
 */
public record MatchOutcome(
        String matchId,
        String sessionId,
        RatingKind kind,
        List<ParticipantChange> changes
) {

    public MatchOutcome {
        changes = List.copyOf(changes);
    }

    public Optional<ParticipantChange> changeFor(String participantId) {
        return changes.stream().filter(c -> c.participantId().equals(participantId)).findFirst();
    }
}
