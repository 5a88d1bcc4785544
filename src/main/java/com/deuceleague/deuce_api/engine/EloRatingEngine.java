package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.PlayerRatingRepository;
import com.deuceleague.deuce_api.repository.RatingHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Default {@link RatingEngine}: per-season Elo, doubles rated side against side.
 *
 * Flow:
 * 1. Skip if the match already has ledger rows or no outcome.
 * 2. Pessimistic lock every player's season rating (ordered by ID), creating missing ones.
 * 3. Snapshot before-ratings and compute side ratings.
 * 4. Write one RatingHistory row per player and apply it to the rating.
 *
 * Callers provide the transaction.
 */
@Component
public class EloRatingEngine implements RatingEngine {

    private static final Logger log = LoggerFactory.getLogger(EloRatingEngine.class);

    private final PlayerRatingRepository playerRatingRepository;
    private final RatingHistoryRepository ratingHistoryRepository;

    public EloRatingEngine(PlayerRatingRepository playerRatingRepository,
                           RatingHistoryRepository ratingHistoryRepository) {
        this.playerRatingRepository = playerRatingRepository;
        this.ratingHistoryRepository = ratingHistoryRepository;
    }

    @Override
    public List<RatingHistory> applyMatchResult(Match match) {
        // 1. Idempotence: a rated match is never rated twice
        if (match.getOutcome() == null || ratingHistoryRepository.existsByMatchId(match.getId())) {
            log.debug("Match {} not rated (outcome={}, or already rated)", match.getId(), match.getOutcome());
            return List.of();
        }

        List<UUID> team1 = match.getTeamUserIds(MatchTeam.TEAM1);
        List<UUID> team2 = match.getTeamUserIds(MatchTeam.TEAM2);
        List<UUID> everyone = Stream.concat(team1.stream(), team2.stream()).toList();

        // 2. Lock ratings in ascending id order
        Map<UUID, PlayerRating> ratings = lockRatings(everyone, match.getSeasonId());

        // 3. Snapshot before-ratings
        int team1Rating = EloCalculator.sideRating(team1.stream().map(id -> ratings.get(id).getRating()).toList());
        int team2Rating = EloCalculator.sideRating(team2.stream().map(id -> ratings.get(id).getRating()).toList());

        // 4. Ledger row first, then the rating itself
        List<RatingHistory> rows = new ArrayList<>();
        for (UUID userId : everyone) {
            MatchTeam side = team1.contains(userId) ? MatchTeam.TEAM1 : MatchTeam.TEAM2;
            boolean won = side == match.getOutcome();
            int opponentRating = side == MatchTeam.TEAM1 ? team2Rating : team1Rating;

            PlayerRating rating = ratings.get(userId);
            int before = rating.getRating();
            int deviationBefore = rating.getRatingDeviation();
            int after = EloCalculator.calculateNewRating(before, opponentRating, won, rating.getMatchesPlayed());
            int deviationAfter = EloCalculator.nextDeviation(deviationBefore);

            RatingHistory row = new RatingHistory(rating.getId(), userId, match.getId(),
                    before, after, deviationBefore, deviationAfter,
                    EloCalculator.getKFactor(rating.getMatchesPlayed()), reasonFor(match, won));
            ratingHistoryRepository.save(row);
            rating.applyChange(after, deviationAfter);
            rows.add(row);
        }

        log.info("Rated match {}: {} ledger rows", match.getId(), rows.size());
        return rows;
    }

    private Map<UUID, PlayerRating> lockRatings(List<UUID> userIds, UUID seasonId) {
        Map<UUID, PlayerRating> byUser = playerRatingRepository.findAllForSeasonWithLock(userIds, seasonId)
                .stream()
                .collect(Collectors.toMap(PlayerRating::getUserId, Function.identity()));
        for (UUID userId : userIds) {
            byUser.computeIfAbsent(userId, id -> {
                PlayerRating created = new PlayerRating(id, seasonId);
                playerRatingRepository.save(created);
                return created;
            });
        }
        return byUser;
    }

    private static RatingChangeReason reasonFor(Match match, boolean won) {
        if (match.isWalkover()) {
            return won ? RatingChangeReason.WALKOVER_WIN : RatingChangeReason.WALKOVER_LOSS;
        }
        return won ? RatingChangeReason.MATCH_WIN : RatingChangeReason.MATCH_LOSS;
    }
}
