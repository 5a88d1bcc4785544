package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.engine.BestResultsEngine;
import com.deuceleague.deuce_api.engine.RatingEngine;
import com.deuceleague.deuce_api.engine.StandingsEngine;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.*;
import com.deuceleague.util.TestFixtures;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.deuceleague.util.TestFixtures.DIVISION_ID;
import static com.deuceleague.util.TestFixtures.NOW;
import static com.deuceleague.util.TestFixtures.SEASON_ID;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecalculationCascadeTest {

    @Mock private MatchRepository matchRepository;
    @Mock private RatingHistoryRepository ratingHistoryRepository;
    @Mock private PlayerRatingRepository playerRatingRepository;
    @Mock private MatchResultRepository matchResultRepository;
    @Mock private RecalculationTaskRepository taskRepository;
    @Mock private RatingEngine ratingEngine;
    @Mock private StandingsEngine standingsEngine;
    @Mock private BestResultsEngine bestResultsEngine;

    private RecalculationCascade cascade;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private Match match;

    @BeforeEach
    void setUp() {
        cascade = new RecalculationCascade(matchRepository, ratingHistoryRepository, playerRatingRepository,
                matchResultRepository, taskRepository, ratingEngine, standingsEngine, bestResultsEngine,
                TestFixtures.transactionTemplate(), new DeuceProperties(), TestFixtures.FIXED_CLOCK);

        match = TestFixtures.buildSinglesMatch(alice, bob, MatchStatus.COMPLETED);
        MatchResultService.writeScore(match, TestFixtures.straightSets());
        lenient().when(matchRepository.findByIdForUpdate(match.getId())).thenReturn(Optional.of(match));
    }

    // =========================================================================
    // 1.1 Rederive
    // =========================================================================

    @Nested
    @DisplayName("1.1 Rederive")
    class Rederive {

        @Test
        @DisplayName("allStepsSucceed_reportIsComplete")
        void allStepsSucceed_reportIsComplete() {
            RecalculationReport report = cascade.rederive(match.getId(), DIVISION_ID, SEASON_ID,
                    List.of(alice, bob, alice), false);

            assertTrue(report.ratingsRecalculated());
            assertTrue(report.standingsRecalculated());
            assertTrue(report.aggregateRecalculated());
            assertEquals(2, report.affectedPlayerCount());
            assertFalse(report.isPartial());
            verify(bestResultsEngine, times(1)).recomputeBestN(alice, DIVISION_ID, SEASON_ID);
            verify(matchRepository).findByIdForUpdate(match.getId());
            verify(matchRepository, never()).findById(any());
            verifyNoInteractions(taskRepository);
        }

        @Test
        @DisplayName("standingsFailure_queuesRetryAndOtherStepsStillRun")
        void standingsFailure_queuesRetryAndOtherStepsStillRun() {
            when(standingsEngine.recomputeStandings(DIVISION_ID, SEASON_ID))
                    .thenThrow(new IllegalStateException("deadlock detected"));

            RecalculationReport report = cascade.rederive(match.getId(), DIVISION_ID, SEASON_ID,
                    List.of(alice, bob), true);

            assertTrue(report.isPartial());
            assertEquals(List.of(RecalculationStep.STANDINGS), report.failedSteps());
            assertTrue(report.ratingsReversed());
            assertTrue(report.ratingsRecalculated());
            assertFalse(report.standingsRecalculated());
            verify(bestResultsEngine).recomputeBestN(alice, DIVISION_ID, SEASON_ID);
            verify(bestResultsEngine).recomputeBestN(bob, DIVISION_ID, SEASON_ID);

            ArgumentCaptor<RecalculationTask> captor = ArgumentCaptor.forClass(RecalculationTask.class);
            verify(taskRepository).save(captor.capture());
            RecalculationTask task = captor.getValue();
            assertEquals(RecalculationStep.STANDINGS, task.getStep());
            assertEquals(RecalculationTaskStatus.PENDING, task.getStatus());
            assertEquals(NOW.plusMinutes(5), task.getNextAttemptAt());
            assertTrue(task.getLastError().contains("deadlock detected"));
        }

        @Test
        @DisplayName("bestResultsFailure_queuesPerPlayerTask")
        void bestResultsFailure_queuesPerPlayerTask() {
            when(bestResultsEngine.recomputeBestN(bob, DIVISION_ID, SEASON_ID))
                    .thenThrow(new IllegalStateException("boom"));

            RecalculationReport report = cascade.rederive(match.getId(), DIVISION_ID, SEASON_ID,
                    List.of(alice, bob), false);

            assertFalse(report.aggregateRecalculated());
            ArgumentCaptor<RecalculationTask> captor = ArgumentCaptor.forClass(RecalculationTask.class);
            verify(taskRepository).save(captor.capture());
            assertEquals(bob, captor.getValue().getUserId());
        }

        @Test
        @DisplayName("voidedMatch_skipsRatingsButUpdatesStandings")
        void voidedMatch_skipsRatingsButUpdatesStandings() {
            match.setStatus(MatchStatus.VOID);

            RecalculationReport report = cascade.rederive(match.getId(), DIVISION_ID, SEASON_ID, List.of(alice), true);

            assertFalse(report.ratingsRecalculated());
            assertTrue(report.standingsRecalculated());
            assertFalse(report.isPartial());
            verifyNoInteractions(ratingEngine);
        }
    }

    // =========================================================================
    // 1.2 Reverse and rebuild
    // =========================================================================

    @Nested
    @DisplayName("1.2 Reverse and rebuild")
    class ReverseAndRebuild {

        @Test
        @DisplayName("reverse_withoutLedgerRows_isNoop")
        void reverse_withoutLedgerRows_isNoop() {
            when(ratingHistoryRepository.findByMatchId(match.getId())).thenReturn(List.of());

            assertEquals(0, cascade.reverseRatings(match));
            verifyNoInteractions(playerRatingRepository);
        }

        @Test
        @DisplayName("reverse_missingRating_fails")
        void reverse_missingRating_fails() {
            PlayerRating rating = TestFixtures.buildRating(alice, 1216, 1);
            RatingHistory row = new RatingHistory(UUID.randomUUID(), alice, match.getId(),
                    1200, 1216, 350, 340, 32, RatingChangeReason.MATCH_WIN);
            when(ratingHistoryRepository.findByMatchId(match.getId())).thenReturn(List.of(row));
            when(playerRatingRepository.findAllByIdWithLock(anyCollection())).thenReturn(List.of(rating));

            assertThrows(IllegalStateException.class, () -> cascade.reverseRatings(match));
            verify(ratingHistoryRepository, never()).deleteAll(any());
        }

        @Test
        @DisplayName("rebuild_completedMatch_awardsPoints")
        void rebuild_completedMatch_awardsPoints() {
            List<MatchResult> results = cascade.rebuildResults(match);

            assertEquals(2, results.size());
            MatchResult winner = results.stream().filter(MatchResult::isWinner).findFirst().orElseThrow();
            MatchResult loser = results.stream().filter(r -> !r.isWinner()).findFirst().orElseThrow();
            assertEquals(alice, winner.getUserId());
            assertEquals(bob, winner.getOpponentId());
            assertEquals(5, winner.getMatchPoints());
            assertEquals(1, loser.getMatchPoints());
            assertEquals(12, winner.getGamesWon());
            assertEquals(7, winner.getGamesLost());
            verify(matchResultRepository).deleteByMatchId(match.getId());
            verify(matchResultRepository).saveAll(results);
        }
    }

    // =========================================================================
    // 1.3 Retry
    // =========================================================================

    @Nested
    @DisplayName("1.3 Retry")
    class Retry {

        private RecalculationTask task;

        @BeforeEach
        void queueTask() {
            task = new RecalculationTask(match.getId(), RecalculationStep.STANDINGS, null, DIVISION_ID, SEASON_ID, NOW);
        }

        @Test
        @DisplayName("retry_success_marksDone")
        void retry_success_marksDone() {
            assertTrue(cascade.retry(task));

            assertEquals(RecalculationTaskStatus.DONE, task.getStatus());
            assertEquals(1, task.getAttempts());
            verify(taskRepository).save(task);
        }

        @Test
        @DisplayName("retry_failure_backsOff")
        void retry_failure_backsOff() {
            when(standingsEngine.recomputeStandings(DIVISION_ID, SEASON_ID)).thenThrow(new IllegalStateException("still down"));

            assertFalse(cascade.retry(task));

            assertEquals(RecalculationTaskStatus.PENDING, task.getStatus());
            assertEquals(1, task.getAttempts());
            assertEquals(NOW.plusMinutes(10), task.getNextAttemptAt());
            assertEquals("still down", task.getLastError());
        }

        @Test
        @DisplayName("retry_lastAttempt_marksFailed")
        void retry_lastAttempt_marksFailed() {
            task.setAttempts(4);
            when(standingsEngine.recomputeStandings(DIVISION_ID, SEASON_ID)).thenThrow(new IllegalStateException("still down"));

            cascade.retry(task);

            assertEquals(RecalculationTaskStatus.FAILED, task.getStatus());
            assertEquals(5, task.getAttempts());
        }

        @Test
        @DisplayName("retryDueTasks_countsSuccesses")
        void retryDueTasks_countsSuccesses() {
            when(taskRepository.findByStatusAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(
                    eq(RecalculationTaskStatus.PENDING), eq(NOW), any())).thenReturn(List.of(task));

            assertEquals(1, cascade.retryDueTasks());
        }
    }
}
