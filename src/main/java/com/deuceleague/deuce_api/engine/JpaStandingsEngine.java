package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.model.DivisionStanding;
import com.deuceleague.deuce_api.model.MatchResult;
import com.deuceleague.deuce_api.repository.DivisionStandingRepository;
import com.deuceleague.deuce_api.repository.MatchResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Rebuilds a division's table from its match results. Totals cover every
 * result; points cover only the best-N counted results.
 */
@Component
public class JpaStandingsEngine implements StandingsEngine {

    private static final Logger log = LoggerFactory.getLogger(JpaStandingsEngine.class);

    private static final Comparator<DivisionStanding> TABLE_ORDER =
            Comparator.comparingInt(DivisionStanding::getTotalPoints).reversed()
                    .thenComparing(Comparator.comparingInt(DivisionStanding::getWins).reversed())
                    .thenComparing(Comparator.comparingInt(DivisionStanding::getSetDifference).reversed())
                    .thenComparing(Comparator.comparingInt(DivisionStanding::getGameDifference).reversed());

    private final MatchResultRepository matchResultRepository;
    private final DivisionStandingRepository standingRepository;
    private final DeuceProperties properties;

    public JpaStandingsEngine(MatchResultRepository matchResultRepository,
                              DivisionStandingRepository standingRepository,
                              DeuceProperties properties) {
        this.matchResultRepository = matchResultRepository;
        this.standingRepository = standingRepository;
        this.properties = properties;
    }

    @Override
    public List<DivisionStanding> recomputeStandings(UUID divisionId, UUID seasonId) {
        Map<UUID, List<MatchResult>> byPlayer = matchResultRepository.findByDivisionIdAndSeasonId(divisionId, seasonId)
                .stream()
                .collect(Collectors.groupingBy(MatchResult::getUserId, LinkedHashMap::new, Collectors.toList()));

        int bestN = properties.getStandings().getBestResultsCount();
        List<DivisionStanding> table = new ArrayList<>();
        byPlayer.forEach((userId, results) -> {
            DivisionStanding row = new DivisionStanding(divisionId, seasonId, userId);
            for (MatchResult r : results) {
                row.setMatchesPlayed(row.getMatchesPlayed() + 1);
                if (r.isWinner()) row.setWins(row.getWins() + 1);
                else row.setLosses(row.getLosses() + 1);
                row.setSetsWon(row.getSetsWon() + r.getSetsWon());
                row.setSetsLost(row.getSetsLost() + r.getSetsLost());
                row.setGamesWon(row.getGamesWon() + r.getGamesWon());
                row.setGamesLost(row.getGamesLost() + r.getGamesLost());
            }
            row.setTotalPoints(BestResultsSelector.select(results, bestN).stream()
                    .mapToInt(MatchResult::getMatchPoints).sum());
            table.add(row);
        });

        table.sort(TABLE_ORDER);
        for (int i = 0; i < table.size(); i++) {
            table.get(i).setRank(i + 1);
        }

        standingRepository.deleteByDivisionAndSeason(divisionId, seasonId);
        standingRepository.saveAll(table);
        log.info("Standings rebuilt for division {} season {}: {} players", divisionId, seasonId, table.size());
        return table;
    }
}
