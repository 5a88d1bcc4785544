package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.model.MatchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.deuceleague.util.TestFixtures.DIVISION_ID;
import static com.deuceleague.util.TestFixtures.NOW;
import static com.deuceleague.util.TestFixtures.SEASON_ID;
import static org.junit.jupiter.api.Assertions.*;

class BestResultsSelectorTest {

    private final UUID player = UUID.randomUUID();

    private MatchResult result(int daysAgo, boolean won, int points, int gamesWon, int gamesLost) {
        return new MatchResult(UUID.randomUUID(), player, UUID.randomUUID(), DIVISION_ID, SEASON_ID,
                won, points, won ? 2 : 1, won ? 1 : 2, gamesWon, gamesLost, NOW.minusDays(daysAgo));
    }

    @Test
    @DisplayName("firstNWins_inPlayedOrder")
    void firstNWins_inPlayedOrder() {
        MatchResult oldest = result(10, true, 5, 12, 7);
        MatchResult middle = result(5, true, 5, 12, 9);
        MatchResult newest = result(1, true, 5, 12, 2);

        List<MatchResult> selected = BestResultsSelector.select(List.of(newest, oldest, middle), 2);

        assertEquals(List.of(oldest, middle), selected);
    }

    @Test
    @DisplayName("fewerWinsThanN_topsUpWithStrongestLosses")
    void fewerWinsThanN_topsUpWithStrongestLosses() {
        MatchResult win = result(8, true, 5, 12, 7);
        MatchResult narrowLoss = result(6, false, 2, 11, 13);
        MatchResult heavyLoss = result(4, false, 2, 4, 12);
        MatchResult shutout = result(2, false, 1, 0, 12);

        List<MatchResult> selected = BestResultsSelector.select(List.of(shutout, heavyLoss, win, narrowLoss), 3);

        assertEquals(List.of(win, narrowLoss, heavyLoss), selected);
    }

    @Test
    @DisplayName("tiedLosses_preferMostRecent")
    void tiedLosses_preferMostRecent() {
        MatchResult older = result(9, false, 2, 10, 12);
        MatchResult recent = result(3, false, 2, 10, 12);

        assertEquals(List.of(recent), BestResultsSelector.select(List.of(older, recent), 1));
    }

    @Test
    @DisplayName("fewerResultsThanN_returnsAll")
    void fewerResultsThanN_returnsAll() {
        List<MatchResult> results = new ArrayList<>(List.of(result(3, true, 5, 12, 5), result(1, false, 1, 3, 12)));

        assertEquals(2, BestResultsSelector.select(results, 6).size());
        assertTrue(BestResultsSelector.select(List.of(), 6).isEmpty());
    }
}
