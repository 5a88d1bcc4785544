package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * A participant's objection to a submitted result. At most one dispute per
 * match may be OPEN or UNDER_REVIEW at any time.
 */
@Getter
@Setter
@Entity
@Table(name = "match_disputes")
public class MatchDispute {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "match_id", nullable = false)
    private UUID matchId;

    @Column(name = "raised_by_id", nullable = false)
    private UUID raisedById;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DisputeCategory category;

    @Column(name = "dispute_comment", nullable = false, length = 1000)
    private String comment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DisputePriority priority = DisputePriority.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DisputeStatus status = DisputeStatus.OPEN;

    // Result as submitted when the dispute was raised.
    @Convert(converter = SetScoreListConverter.class)
    @Column(name = "disputed_score", columnDefinition = "text")
    private List<SetScore> disputedScore;

    @Convert(converter = SetScoreListConverter.class)
    @Column(name = "disputer_score", columnDefinition = "text")
    private List<SetScore> disputerScore;

    @Column(name = "evidence_url")
    private String evidenceUrl;

    @Column(name = "reviewed_by_id")
    private UUID reviewedById;

    @Column(name = "review_started_at")
    private LocalDateTime reviewStartedAt;

    @Column(name = "resolved_by_id")
    private UUID resolvedById;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_action", length = 30)
    private ResolutionAction resolutionAction;

    @Column(name = "admin_resolution", length = 2000)
    private String adminResolution;

    @Convert(converter = SetScoreListConverter.class)
    @Column(name = "final_score", columnDefinition = "text")
    private List<SetScore> finalScore;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public MatchDispute() {}

    public MatchDispute(UUID matchId, UUID raisedById, DisputeCategory category, String comment) {
        this.matchId = matchId;
        this.raisedById = raisedById;
        this.category = category;
        this.comment = comment;
    }
}
