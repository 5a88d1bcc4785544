package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only ledger row: one per (player, match) rating change.
 */
@Getter
@Entity
@Table(name = "rating_history")
public class RatingHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "player_rating_id", nullable = false)
    private UUID playerRatingId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "match_id", nullable = false)
    private UUID matchId;

    @Column(name = "rating_before", nullable = false)
    private int ratingBefore;

    @Column(name = "rating_after", nullable = false)
    private int ratingAfter;

    @Column(name = "deviation_before", nullable = false)
    private int deviationBefore;

    @Column(name = "deviation_after", nullable = false)
    private int deviationAfter;

    @Column(name = "k_factor", nullable = false)
    private int kFactor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RatingChangeReason reason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public RatingHistory() {}

    public RatingHistory(UUID playerRatingId, UUID userId, UUID matchId,
                         int ratingBefore, int ratingAfter, int deviationBefore, int deviationAfter,
                         int kFactor, RatingChangeReason reason) {
        this.playerRatingId = playerRatingId;
        this.userId = userId;
        this.matchId = matchId;
        this.ratingBefore = ratingBefore;
        this.ratingAfter = ratingAfter;
        this.deviationBefore = deviationBefore;
        this.deviationAfter = deviationAfter;
        this.kFactor = kFactor;
        this.reason = reason;
    }

    public int getDelta() {
        return ratingAfter - ratingBefore;
    }
}
