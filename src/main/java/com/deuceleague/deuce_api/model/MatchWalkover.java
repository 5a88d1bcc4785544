package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Entity
@Table(name = "match_walkovers")
public class MatchWalkover {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "match_id", nullable = false)
    private UUID matchId;

    @Column(name = "reported_by_id", nullable = false)
    private UUID reportedById;

    @Column(name = "defaulting_user_id", nullable = false)
    private UUID defaultingUserId;

    @Column(name = "winning_user_id", nullable = false)
    private UUID winningUserId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private WalkoverReason reason;

    @Column(name = "reason_detail", length = 1000)
    private String reasonDetail;

    @Setter
    @Column(name = "admin_verified", nullable = false)
    private boolean adminVerified;

    @Setter
    @Column(name = "verified_by_id")
    private UUID verifiedById;

    @Setter
    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public MatchWalkover() {}

    public MatchWalkover(UUID matchId, UUID reportedById, UUID defaultingUserId, UUID winningUserId,
                         WalkoverReason reason, String reasonDetail) {
        this.matchId = matchId;
        this.reportedById = reportedById;
        this.defaultingUserId = defaultingUserId;
        this.winningUserId = winningUserId;
        this.reason = reason;
        this.reasonDetail = reasonDetail;
    }
}
