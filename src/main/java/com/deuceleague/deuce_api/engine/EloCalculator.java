package com.deuceleague.deuce_api.engine;

import java.util.List;

/**
 * Pure Elo arithmetic for league matches. Stateless.
 *
 * Formula:
 *   Expected score:  E = 1 / (1 + 10^((opponentRating - playerRating) / 400))
 *   New rating:      R' = R + K * (S - E)
 *
 * K-factor by matches played in the season:
 *   - K=40 while provisional (< 30 matches)
 *   - K=20 once established (30 to 99 matches)
 *   - K=10 for veterans (100+ matches)
 *
 * Doubles sides are rated as the rounded mean of the two partners.
 * Rating floor: 100. Deviation shrinks by 15 per rated match down to 50.
 */
public final class EloCalculator {

    private static final int RATING_FLOOR = 100;
    private static final int DEVIATION_STEP = 15;
    private static final int DEVIATION_FLOOR = 50;

    private EloCalculator() {}

    // =========================================================================
    // K-Factor
    // =========================================================================

    public static int getKFactor(int matchesPlayed) {
        if (matchesPlayed < 30) return 40;   // Provisional
        if (matchesPlayed < 100) return 20;  // Established
        return 10;                            // Veteran
    }

    // =========================================================================
    // Expected Score
    // =========================================================================

    public static double expectedScore(int playerRating, int opponentRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponentRating - playerRating) / 400.0));
    }

    public static int sideRating(List<Integer> ratings) {
        if (ratings.isEmpty()) {
            throw new IllegalArgumentException("A side needs at least one rated player");
        }
        double sum = 0;
        for (int r : ratings) sum += r;
        return (int) Math.round(sum / ratings.size());
    }

    // =========================================================================
    // Rating Calculation
    // =========================================================================

    /**
     * @param currentRating  player's rating before the match
     * @param opponentRating opposing side's rating
     * @param won            true if this player's side won
     * @param matchesPlayed  player's rated matches this season (for K-factor)
     * @return new rating, floored at {@value #RATING_FLOOR}
     */
    public static int calculateNewRating(int currentRating, int opponentRating, boolean won, int matchesPlayed) {
        double expected = expectedScore(currentRating, opponentRating);
        double actual = won ? 1.0 : 0.0;
        int k = getKFactor(matchesPlayed);

        int newRating = (int) Math.round(currentRating + k * (actual - expected));
        return Math.max(RATING_FLOOR, newRating);
    }

    public static int nextDeviation(int deviation) {
        return Math.max(DEVIATION_FLOOR, deviation - DEVIATION_STEP);
    }

    public static int getRatingFloor() {
        return RATING_FLOOR;
    }
}
