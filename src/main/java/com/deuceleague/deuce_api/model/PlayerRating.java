package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-season rating for one player. Only changed through a {@link RatingHistory}
 * row (apply) or by restoring from one (reverse).
 */
@Getter
@Entity
@Table(name = "player_ratings",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "season_id"}))
public class PlayerRating {

    public static final int DEFAULT_RATING = 1200;
    public static final int DEFAULT_DEVIATION = 350;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "season_id", nullable = false)
    private UUID seasonId;

    @Column(nullable = false)
    private int rating = DEFAULT_RATING;

    @Column(name = "rating_deviation", nullable = false)
    private int ratingDeviation = DEFAULT_DEVIATION;

    @Column(name = "matches_played", nullable = false)
    private int matchesPlayed = 0;

    @Column(name = "peak_rating", nullable = false)
    private int peakRating = DEFAULT_RATING;

    @Column(name = "lowest_rating", nullable = false)
    private int lowestRating = DEFAULT_RATING;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public PlayerRating() {}

    public PlayerRating(UUID userId, UUID seasonId) {
        this.userId = userId;
        this.seasonId = seasonId;
    }

    public void applyChange(int newRating, int newDeviation) {
        this.rating = newRating;
        this.ratingDeviation = newDeviation;
        this.matchesPlayed++;
        if (newRating > peakRating) peakRating = newRating;
        if (newRating < lowestRating) lowestRating = newRating;
    }

    /** Peak and trough are kept: they record history, not the current value. */
    public void restore(int ratingBefore, int deviationBefore) {
        this.rating = ratingBefore;
        this.ratingDeviation = deviationBefore;
        this.matchesPlayed = Math.max(0, matchesPlayed - 1);
    }
}
