package com.sessionelo.sessionelo_api.elo;

import com.sessionelo.util.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class EloCalculatorTest {

    // =========================================================================
    // K-Factor
    // =========================================================================

    @Nested
    @DisplayName("K-factor policy")
    class KFactor {

        @ParameterizedTest(name = "matchesPlayed={0} → K={1}")
        @CsvSource({"0,40", "9,40", "10,32", "39,32", "40,24", "500,24"})
        void kFactor_followsThresholds(int matchesPlayed, int expectedK) {
            assertEquals(expectedK, EloCalculator.kFactor(matchesPlayed));
        }

        @Test
        void kFactor_forAveragedCounts_usesSameThresholds() {
            assertEquals(40, EloCalculator.kFactor(9.5));
            assertEquals(32, EloCalculator.kFactor(10.0));
            assertEquals(32, EloCalculator.kFactor(39.5));
            assertEquals(24, EloCalculator.kFactor(40.0));
        }

        @Test
        void nextMatchAfterNine_usesForty_afterTen_usesThirtyTwo() {
            // Equal ratings: delta = K * 0.5
            assertEquals(20, EloCalculator.delta(1500, 1500, MatchResult.WIN, 9));
            assertEquals(16, EloCalculator.delta(1500, 1500, MatchResult.WIN, 10));
            assertEquals(16, EloCalculator.delta(1500, 1500, MatchResult.WIN, 39));
            assertEquals(12, EloCalculator.delta(1500, 1500, MatchResult.WIN, 40));
        }
    }

    // =========================================================================
    // Expected score
    // =========================================================================

    @Nested
    @DisplayName("Expected score")
    class ExpectedScore {

        @Test
        void equalRatings_isHalf() {
            assertEquals(0.5, EloCalculator.expectedScore(1500, 1500), 1e-12);
        }

        @Test
        void symmetry_sumsToOne() {
            int[] ratings = {800, 1200, 1480, 1500, 1520, 1873, 2400};
            for (int a : ratings) {
                for (int b : ratings) {
                    assertEquals(1.0, EloCalculator.expectedScore(a, b) + EloCalculator.expectedScore(b, a), 1e-12,
                            "a=" + a + " b=" + b);
                }
            }
        }

        @Test
        void fourHundredPointGap_isTenToOne() {
            assertEquals(10.0 / 11.0, EloCalculator.expectedScore(1900, 1500), 1e-12);
        }
    }

    // =========================================================================
    // Delta
    // =========================================================================

    @Nested
    @DisplayName("Delta")
    class Delta {

        @Test
        void firstMatchAtDefaults_movesTwentyPoints() {
            int rating = TestFixtures.DEFAULT_ELO;
            assertEquals(20, EloCalculator.delta(rating, rating, MatchResult.WIN, 0));
            assertEquals(-20, EloCalculator.delta(rating, rating, MatchResult.LOSS, 0));
            assertEquals(0, EloCalculator.delta(rating, rating, MatchResult.DRAW, 0));
        }

        @Test
        void favouriteWinning_gainsLess() {
            // E(1600 vs 1400) ≈ 0.7597 → 40 * 0.2403 ≈ 9.61
            assertEquals(10, EloCalculator.delta(1600, 1400, MatchResult.WIN, 0));
            assertEquals(-10, EloCalculator.delta(1400, 1600, MatchResult.LOSS, 0));
            // Upset: 40 * 0.7597 ≈ 30.39
            assertEquals(30, EloCalculator.delta(1400, 1600, MatchResult.WIN, 0));
        }

        @Test
        void zeroSum_whenBothSidesHaveEqualK() {
            int[] ratings = {1000, 1337, 1500, 1512, 1777, 2101};
            int[] counts = {0, 9, 10, 39, 40, 120};
            for (int a : ratings) {
                for (int b : ratings) {
                    for (int n : counts) {
                        int winner = EloCalculator.delta(a, b, MatchResult.WIN, n);
                        int loser = EloCalculator.delta(b, a, MatchResult.LOSS, n);
                        // Each side rounds independently, so allow one point of drift
                        assertTrue(Math.abs(winner + loser) <= 1,
                                "a=" + a + " b=" + b + " n=" + n + ": " + winner + " vs " + loser);
                    }
                }
            }
        }

        @Test
        void asymmetricK_givesDifferentMagnitudes() {
            int veteranLoss = EloCalculator.delta(1500, 1500, MatchResult.LOSS, 50);
            int newcomerWin = EloCalculator.delta(1500, 1500, MatchResult.WIN, 0);
            assertEquals(-12, veteranLoss);
            assertEquals(20, newcomerWin);
        }

        @Test
        void matchesTestMirror() {
            for (int a = 1100; a <= 1900; a += 37) {
                for (int n : new int[]{0, 12, 45}) {
                    assertEquals(
                            com.sessionelo.util.EloCalculator.delta(a, 1500, 1.0, n),
                            EloCalculator.delta(a, 1500, MatchResult.WIN, n));
                    assertEquals(
                            com.sessionelo.util.EloCalculator.delta(a, 1500, 0.5, n),
                            EloCalculator.delta(a, 1500, MatchResult.DRAW, n));
                }
            }
        }
    }

    // =========================================================================
    // Rounding
    // =========================================================================

    @Nested
    @DisplayName("Rounding mode")
    class Rounding {

        @Test
        void halvesRoundTowardPositiveInfinity() {
            assertEquals(3, EloCalculator.roundDelta(2.5));
            assertEquals(-2, EloCalculator.roundDelta(-2.5));
            assertEquals(1, EloCalculator.roundDelta(0.5));
            assertEquals(0, EloCalculator.roundDelta(-0.5));
            assertEquals(-1, EloCalculator.roundDelta(-1.5));
        }

        @Test
        void nonHalves_roundToNearest() {
            assertEquals(10, EloCalculator.roundDelta(9.61));
            assertEquals(-10, EloCalculator.roundDelta(-9.61));
            assertEquals(-9, EloCalculator.roundDelta(-9.49));
        }
    }

    @Test
    void actualScore_mapsResults() {
        assertEquals(1.0, EloCalculator.actualScore(MatchResult.WIN));
        assertEquals(0.0, EloCalculator.actualScore(MatchResult.LOSS));
        assertEquals(0.5, EloCalculator.actualScore(MatchResult.DRAW));
    }
}
