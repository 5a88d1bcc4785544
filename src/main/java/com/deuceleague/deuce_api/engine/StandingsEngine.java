package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.model.DivisionStanding;

import java.util.List;
import java.util.UUID;

public interface StandingsEngine {

    List<DivisionStanding> recomputeStandings(UUID divisionId, UUID seasonId);
}
