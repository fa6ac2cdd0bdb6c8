package com.sessionelo.sessionelo_api.elo;

/**
 * One participant's transition across one match.
 */
public record ParticipantChange(
        String participantId,
        RatingState before,
        RatingState after,
        int kFactor
) {
    public int delta() {
        return after.elo() - before.elo();
    }
}
