package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.engine.BestResultsEngine;
import com.deuceleague.deuce_api.engine.MatchPointsCalculator;
import com.deuceleague.deuce_api.engine.RatingEngine;
import com.deuceleague.deuce_api.engine.StandingsEngine;
import com.deuceleague.deuce_api.exception.CascadeStepException;
import com.deuceleague.deuce_api.exception.NotFoundException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Unwinds and re-derives everything that depends on a completed match's facts.
 *
 * Steps 1 and 2 ({@link #reverseRatings}, {@link #rebuildResults}) run inside
 * the caller's transaction together with the edit. Step 3 ({@link #rederive})
 * runs after commit: ratings, standings and best results are each attempted in
 * their own transaction, and a failure is logged and queued as a
 * {@link RecalculationTask} instead of undoing the edit.
 */
@Component
public class RecalculationCascade {

    private static final Logger log = LoggerFactory.getLogger(RecalculationCascade.class);
    private static final int RETRY_BATCH_SIZE = 50;

    private final MatchRepository matchRepository;
    private final RatingHistoryRepository ratingHistoryRepository;
    private final PlayerRatingRepository playerRatingRepository;
    private final MatchResultRepository matchResultRepository;
    private final RecalculationTaskRepository taskRepository;
    private final RatingEngine ratingEngine;
    private final StandingsEngine standingsEngine;
    private final BestResultsEngine bestResultsEngine;
    private final TransactionTemplate transactionTemplate;
    private final DeuceProperties properties;
    private final Clock clock;

    public RecalculationCascade(MatchRepository matchRepository,
                                RatingHistoryRepository ratingHistoryRepository,
                                PlayerRatingRepository playerRatingRepository,
                                MatchResultRepository matchResultRepository,
                                RecalculationTaskRepository taskRepository,
                                RatingEngine ratingEngine,
                                StandingsEngine standingsEngine,
                                BestResultsEngine bestResultsEngine,
                                TransactionTemplate transactionTemplate,
                                DeuceProperties properties,
                                Clock clock) {
        this.matchRepository = matchRepository;
        this.ratingHistoryRepository = ratingHistoryRepository;
        this.playerRatingRepository = playerRatingRepository;
        this.matchResultRepository = matchResultRepository;
        this.taskRepository = taskRepository;
        this.ratingEngine = ratingEngine;
        this.standingsEngine = standingsEngine;
        this.bestResultsEngine = bestResultsEngine;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Step 1: reverse ratings (caller's transaction)
    // =========================================================================

    /**
     * Restores every rated player to the "before" values stored on the match's
     * ledger rows, then deletes those rows.
     *
     * @return number of ledger rows reversed
     */
    public int reverseRatings(Match match) {
        List<RatingHistory> rows = ratingHistoryRepository.findByMatchId(match.getId());
        if (rows.isEmpty()) return 0;

        // Lock in ascending id order to prevent deadlocks
        List<UUID> ratingIds = rows.stream().map(RatingHistory::getPlayerRatingId).distinct().sorted().toList();
        Map<UUID, PlayerRating> locked = playerRatingRepository.findAllByIdWithLock(ratingIds).stream()
                .collect(Collectors.toMap(PlayerRating::getId, Function.identity()));

        for (RatingHistory row : rows) {
            PlayerRating rating = locked.get(row.getPlayerRatingId());
            if (rating == null) {
                throw new IllegalStateException("Rating " + row.getPlayerRatingId() + " missing for ledger row " + row.getId());
            }
            rating.restore(row.getRatingBefore(), row.getDeviationBefore());
        }
        ratingHistoryRepository.deleteAll(rows);
        log.info("Reversed {} rating change(s) for match {}", rows.size(), match.getId());
        return rows.size();
    }

    // =========================================================================
    // Step 2: derived per-player results (caller's transaction)
    // =========================================================================

    /**
     * Replaces the match's {@link MatchResult} rows. Only a COMPLETED match with
     * an outcome produces new rows.
     */
    public List<MatchResult> rebuildResults(Match match) {
        matchResultRepository.deleteByMatchId(match.getId());
        if (match.getStatus() != MatchStatus.COMPLETED) return List.of();

        LocalDateTime played = match.getScheduledTime() != null ? match.getScheduledTime() : LocalDateTime.now(clock);
        List<MatchResult> results = MatchPointsCalculator.resultsFor(match, played);
        matchResultRepository.saveAll(results);
        return results;
    }

    // =========================================================================
    // Step 3: re-derive (after commit, best-effort)
    // =========================================================================

    public RecalculationReport rederive(UUID matchId, UUID divisionId, UUID seasonId,
                                        Collection<UUID> affectedUserIds, boolean ratingsReversed) {
        List<RecalculationStep> failed = new ArrayList<>();

        boolean ratings = attempt(RecalculationStep.RATINGS, matchId, null, divisionId, seasonId, failed);
        boolean standings = attempt(RecalculationStep.STANDINGS, matchId, null, divisionId, seasonId, failed);

        boolean aggregate = true;
        for (UUID userId : new LinkedHashSet<>(affectedUserIds)) {
            aggregate &= attempt(RecalculationStep.BEST_RESULTS, matchId, userId, divisionId, seasonId, failed);
        }

        RecalculationReport report = new RecalculationReport(ratingsReversed, ratings, standings, aggregate,
                new HashSet<>(affectedUserIds).size(), List.copyOf(new LinkedHashSet<>(failed)));
        if (report.isPartial()) {
            log.warn("Recalculation for match {} partially failed: {}", matchId, report.failedSteps());
        } else {
            log.info("Recalculation for match {} complete ({} players)", matchId, report.affectedPlayerCount());
        }
        return report;
    }

    private boolean attempt(RecalculationStep step, UUID matchId, UUID userId, UUID divisionId, UUID seasonId,
                            List<RecalculationStep> failed) {
        try {
            return runStep(step, matchId, userId, divisionId, seasonId);
        } catch (RuntimeException e) {
            CascadeStepException error = new CascadeStepException(step, matchId, e);
            log.error(error.getMessage(), e);
            failed.add(step);
            enqueueRetry(step, matchId, userId, divisionId, seasonId, error.getMessage());
            return false;
        }
    }

    /** @return false when the step had nothing to do (e.g. ratings for a voided match) */
    private boolean runStep(RecalculationStep step, UUID matchId, UUID userId, UUID divisionId, UUID seasonId) {
        Boolean done = transactionTemplate.execute(status -> doStep(step, matchId, userId, divisionId, seasonId));
        return Boolean.TRUE.equals(done);
    }

    private boolean doStep(RecalculationStep step, UUID matchId, UUID userId, UUID divisionId, UUID seasonId) {
        switch (step) {
            case RATINGS -> {
                // Same lock as the match writers, so a concurrent void or edit cannot interleave
                Match match = matchRepository.findByIdForUpdate(matchId)
                        .orElseThrow(() -> new NotFoundException("Match", matchId));
                if (match.getStatus() != MatchStatus.COMPLETED) return false;
                ratingEngine.applyMatchResult(match);
            }
            case STANDINGS -> standingsEngine.recomputeStandings(divisionId, seasonId);
            case BEST_RESULTS -> bestResultsEngine.recomputeBestN(userId, divisionId, seasonId);
        }
        return true;
    }

    private void enqueueRetry(RecalculationStep step, UUID matchId, UUID userId, UUID divisionId, UUID seasonId,
                              String error) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                RecalculationTask task = new RecalculationTask(matchId, step, userId, divisionId, seasonId,
                        LocalDateTime.now(clock).plusMinutes(properties.getRecalculation().getRetryBackoffMinutes()));
                task.setLastError(truncate(error));
                taskRepository.save(task);
            });
        } catch (RuntimeException e) {
            log.error("Could not queue {} retry for match {}: {}", step, matchId, e.getMessage(), e);
        }
    }

    // =========================================================================
    // Retries
    // =========================================================================

    /** @return number of queued steps that succeeded this round */
    public int retryDueTasks() {
        List<RecalculationTask> due = taskRepository.findByStatusAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(
                RecalculationTaskStatus.PENDING, LocalDateTime.now(clock), PageRequest.of(0, RETRY_BATCH_SIZE));
        int succeeded = 0;
        for (RecalculationTask task : due) {
            if (retry(task)) succeeded++;
        }
        return succeeded;
    }

    boolean retry(RecalculationTask task) {
        boolean ok;
        String error = null;
        try {
            runStep(task.getStep(), task.getMatchId(), task.getUserId(), task.getDivisionId(), task.getSeasonId());
            ok = true;
        } catch (RuntimeException e) {
            ok = false;
            error = e.getMessage();
        }

        task.setAttempts(task.getAttempts() + 1);
        if (ok) {
            task.setStatus(RecalculationTaskStatus.DONE);
            log.info("Retried {} for match {} successfully", task.getStep(), task.getMatchId());
        } else {
            task.setLastError(truncate(error));
            if (task.getAttempts() >= properties.getRecalculation().getMaxAttempts()) {
                task.setStatus(RecalculationTaskStatus.FAILED);
                log.error("Giving up on {} for match {} after {} attempts: {}",
                        task.getStep(), task.getMatchId(), task.getAttempts(), error);
            } else {
                task.setNextAttemptAt(LocalDateTime.now(clock).plusMinutes(
                        (long) properties.getRecalculation().getRetryBackoffMinutes() * (task.getAttempts() + 1)));
                log.warn("Retry {} of {} for match {} failed: {}", task.getAttempts(), task.getStep(),
                        task.getMatchId(), error);
            }
        }
        transactionTemplate.executeWithoutResult(status -> taskRepository.save(task));
        return ok;
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
