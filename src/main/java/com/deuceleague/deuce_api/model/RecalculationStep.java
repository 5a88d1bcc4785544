package com.deuceleague.deuce_api.model;

/**
 * Derived-data steps re-run after a completed match changes. Order matters.
 */
public enum RecalculationStep {
    RATINGS,
    STANDINGS,
    BEST_RESULTS
}
