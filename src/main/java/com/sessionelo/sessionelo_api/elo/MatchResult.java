package com.sessionelo.sessionelo_api.elo;

/**
 * Outcome of a match from one side's point of view.
 */
public enum MatchResult {
    WIN(1.0),
    LOSS(0.0),
    DRAW(0.5);

    private final double actualScore;

    MatchResult(double actualScore) {
        this.actualScore = actualScore;
    }

    public double actualScore() {
        return actualScore;
    }

    public MatchResult opposite() {
        return switch (this) {
            case WIN -> LOSS;
            case LOSS -> WIN;
            case DRAW -> DRAW;
        };
    }

    /** Result for the side that scored {@code ownScore}. Equal scores are a draw. */
    public static MatchResult of(int ownScore, int opponentScore) {
        if (ownScore > opponentScore) return WIN;
        if (ownScore < opponentScore) return LOSS;
        return DRAW;
    }
}
