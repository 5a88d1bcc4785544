package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "player_penalties")
public class Penalty {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "penalty_type", nullable = false, length = 20)
    private PenaltyType penaltyType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PenaltySeverity severity;

    @Column(name = "related_match_id")
    private UUID relatedMatchId;

    @Column(name = "related_dispute_id")
    private UUID relatedDisputeId;

    @Column(name = "points_deducted")
    private Integer pointsDeducted;

    @Column(name = "suspension_days")
    private Integer suspensionDays;

    @Column(name = "suspension_start")
    private LocalDateTime suspensionStart;

    @Column(name = "suspension_end")
    private LocalDateTime suspensionEnd;

    // Null when issued automatically (e.g. a no-show walkover).
    @Column(name = "issued_by_admin_id")
    private UUID issuedByAdminId;

    @Column(nullable = false, length = 1000)
    private String reason;

    @Column(name = "evidence_url")
    private String evidenceUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PenaltyStatus status = PenaltyStatus.ACTIVE;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    // =========================================================================
    // Appeal
    // =========================================================================
    @Column(name = "appeal_submitted_at")
    private LocalDateTime appealSubmittedAt;

    @Column(name = "appeal_reason", length = 2000)
    private String appealReason;

    @Column(name = "appeal_resolved_by")
    private UUID appealResolvedBy;

    @Column(name = "appeal_resolved_at")
    private LocalDateTime appealResolvedAt;

    @Column(name = "appeal_resolution_notes", length = 2000)
    private String appealResolutionNotes;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public Penalty() {}

    public Penalty(UUID userId, PenaltyType penaltyType, PenaltySeverity severity, String reason) {
        this.userId = userId;
        this.penaltyType = penaltyType;
        this.severity = severity;
        this.reason = reason;
    }

    /** ACTIVE or APPEALED penalties whose expiry has passed read as EXPIRED. */
    public PenaltyStatus effectiveStatus(LocalDateTime now) {
        boolean live = status == PenaltyStatus.ACTIVE || status == PenaltyStatus.APPEALED;
        if (live && expiresAt != null && !now.isBefore(expiresAt)) {
            return PenaltyStatus.EXPIRED;
        }
        return status;
    }
}
