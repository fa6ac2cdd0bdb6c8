package com.sessionelo.sessionelo_api.elo;

/**
 * One participant's rating and running totals at a point in the match log.
 * Immutable; every transition produces a new instance.
 */
public record RatingState(
        int elo,
        int matchesPlayed,
        int wins,
        int losses,
        int draws,
        int setsWon,
        int setsLost
) {

    public RatingState {
        if (matchesPlayed != wins + losses + draws) {
            throw new IllegalArgumentException(
                    "matchesPlayed (" + matchesPlayed + ") must equal wins + losses + draws ("
                            + wins + " + " + losses + " + " + draws + ")");
        }
    }

    private static final RatingState INITIAL =
            new RatingState(EloCalculator.DEFAULT_RATING, 0, 0, 0, 0, 0, 0);

    /** The unrated state: 1500 and every counter at zero. */
    public static RatingState initial() {
        return INITIAL;
    }

    /**
     * State after one more match with the given result and (already rounded) delta.
     * A set is won or lost on a strict score difference; a draw counts neither.
     */
    public RatingState after(MatchResult result, int delta) {
        return new RatingState(
                elo + delta,
                matchesPlayed + 1,
                wins + (result == MatchResult.WIN ? 1 : 0),
                losses + (result == MatchResult.LOSS ? 1 : 0),
                draws + (result == MatchResult.DRAW ? 1 : 0),
                setsWon + (result == MatchResult.WIN ? 1 : 0),
                setsLost + (result == MatchResult.LOSS ? 1 : 0)
        );
    }
}
