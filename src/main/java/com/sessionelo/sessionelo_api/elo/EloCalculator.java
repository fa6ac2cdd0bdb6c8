package com.sessionelo.sessionelo_api.elo;

/**
 * Pure Elo calculation utility. Stateless, no dependencies.
 *
 * Formula:
 *   Expected score:  E = 1 / (1 + 10^((opponentElo - playerElo) / 400))
 *   Delta:           D = round(K * (S - E))      S = 1 win, 0.5 draw, 0 loss
 *
 * K-factor strategy (fixed three-tier policy):
 *   - K=40 for new participants (< 10 matches)
 *   - K=32 while settling in (10 to 39 matches)
 *   - K=24 for established participants (40+ matches)
 *
 * Rounding is Math.round: halves go toward positive infinity (2.5 → 3, -2.5 → -2).
 * There is no rating floor.
 */
public final class EloCalculator {

    public static final int DEFAULT_RATING = 1500;

    private EloCalculator() {}

    // =========================================================================
    // K-Factor
    // =========================================================================

    public static int kFactor(int matchesPlayed) {
        if (matchesPlayed < 10) return 40;
        if (matchesPlayed < 40) return 32;
        return 24;
    }

    /**
     * K-factor for a fractional match count, used when a doubles side is
     * rated by the average of its two players' match counts.
     */
    public static int kFactor(double matchesPlayed) {
        if (matchesPlayed < 10) return 40;
        if (matchesPlayed < 40) return 32;
        return 24;
    }

    // =========================================================================
    // Expected / Actual Score
    // =========================================================================

    /**
     * Expected score (probability of winning) for A against B, between 0.0 and 1.0.
     */
    public static double expectedScore(double ratingA, double ratingB) {
        return 1.0 / (1.0 + Math.pow(10.0, (ratingB - ratingA) / 400.0));
    }

    public static double actualScore(MatchResult result) {
        return result.actualScore();
    }

    // =========================================================================
    // Delta
    // =========================================================================

    /**
     * Rounded Elo change for A. Each side of a match calls this with its own
     * pre-match rating and match count, so the two deltas may differ in size.
     */
    public static int delta(int ratingA, int ratingB, MatchResult result, int matchesPlayedA) {
        return roundDelta(kFactor(matchesPlayedA) * (actualScore(result) - expectedScore(ratingA, ratingB)));
    }

    /**
     * Same as {@link #delta(int, int, MatchResult, int)} for averaged side
     * ratings and match counts.
     */
    public static int delta(double ratingA, double ratingB, MatchResult result, double matchesPlayedA) {
        return roundDelta(kFactor(matchesPlayedA) * (actualScore(result) - expectedScore(ratingA, ratingB)));
    }

    static int roundDelta(double rawDelta) {
        return (int) Math.round(rawDelta);
    }
}
