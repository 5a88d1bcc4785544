package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.model.MatchResult;
import com.deuceleague.deuce_api.repository.MatchResultRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
public class JpaBestResultsEngine implements BestResultsEngine {

    private final MatchResultRepository matchResultRepository;
    private final DeuceProperties properties;

    public JpaBestResultsEngine(MatchResultRepository matchResultRepository, DeuceProperties properties) {
        this.matchResultRepository = matchResultRepository;
        this.properties = properties;
    }

    @Override
    public List<MatchResult> recomputeBestN(UUID userId, UUID divisionId, UUID seasonId) {
        List<MatchResult> results = matchResultRepository.findByUserIdAndDivisionIdAndSeasonId(userId, divisionId, seasonId);
        List<MatchResult> counted = BestResultsSelector.select(results, properties.getStandings().getBestResultsCount());

        for (MatchResult r : results) {
            int index = counted.indexOf(r);
            r.setCountsForStandings(index >= 0);
            r.setResultSequence(index >= 0 ? index + 1 : null);
        }
        matchResultRepository.saveAll(results);
        return counted;
    }
}
