package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.model.RecalculationStep;

import java.util.List;

/**
 * What a cascade run actually managed to do. A failed step leaves the
 * structural edit in place and is retried in the background.
 */
public record RecalculationReport(
        boolean ratingsReversed,
        boolean ratingsRecalculated,
        boolean standingsRecalculated,
        boolean aggregateRecalculated,
        int affectedPlayerCount,
        List<RecalculationStep> failedSteps
) {
    public static RecalculationReport none() {
        return new RecalculationReport(false, false, false, false, 0, List.of());
    }

    public boolean isPartial() {
        return !failedSteps.isEmpty();
    }
}
