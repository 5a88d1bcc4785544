package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.model.Match;
import com.deuceleague.deuce_api.model.RatingHistory;

import java.util.List;

/**
 * Applies a completed match to player ratings. Implementations must write one
 * {@link RatingHistory} row per rated player so the change can be reversed,
 * and must be deterministic for the same ratings and the same match.
 */
public interface RatingEngine {

    /**
     * @return the ledger rows written; empty if the match was already rated
     *         or has no decided outcome
     */
    List<RatingHistory> applyMatchResult(Match match);
}
