package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.model.MatchResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the results that count toward a player's standing: the first N wins in
 * the order they were played, then, if there are fewer than N wins, the
 * strongest losses (points, then margin, then most recent).
 */
public final class BestResultsSelector {

    private static final Comparator<MatchResult> CHRONOLOGICAL =
            Comparator.comparing(MatchResult::getDatePlayed);

    private static final Comparator<MatchResult> STRONGEST_LOSS =
            Comparator.comparingInt(MatchResult::getMatchPoints).reversed()
                    .thenComparing(Comparator.comparingInt(MatchResult::getMargin).reversed())
                    .thenComparing(Comparator.comparing(MatchResult::getDatePlayed).reversed());

    private BestResultsSelector() {}

    public static List<MatchResult> select(List<MatchResult> results, int n) {
        List<MatchResult> selected = new ArrayList<>(results.stream()
                .filter(MatchResult::isWinner)
                .sorted(CHRONOLOGICAL)
                .limit(n)
                .toList());

        if (selected.size() < n) {
            results.stream()
                    .filter(r -> !r.isWinner())
                    .sorted(STRONGEST_LOSS)
                    .limit(n - selected.size())
                    .forEach(selected::add);
        }
        return selected;
    }
}
