package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.model.MatchResult;

import java.util.List;
import java.util.UUID;

/**
 * Maintains which of a player's results count toward standings.
 */
public interface BestResultsEngine {

    /** @return the counted results, in sequence order */
    List<MatchResult> recomputeBestN(UUID userId, UUID divisionId, UUID seasonId);
}
