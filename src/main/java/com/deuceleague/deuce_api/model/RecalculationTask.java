package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A derived-data step that failed after its edit committed, kept for retry.
 */
@Getter
@Setter
@Entity
@Table(name = "recalculation_tasks")
public class RecalculationTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "match_id", nullable = false)
    private UUID matchId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RecalculationStep step;

    // Set for BEST_RESULTS, which runs per player.
    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "division_id", nullable = false)
    private UUID divisionId;

    @Column(name = "season_id", nullable = false)
    private UUID seasonId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RecalculationTaskStatus status = RecalculationTaskStatus.PENDING;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "next_attempt_at", nullable = false)
    private LocalDateTime nextAttemptAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public RecalculationTask() {}

    public RecalculationTask(UUID matchId, RecalculationStep step, UUID userId,
                             UUID divisionId, UUID seasonId, LocalDateTime nextAttemptAt) {
        this.matchId = matchId;
        this.step = step;
        this.userId = userId;
        this.divisionId = divisionId;
        this.seasonId = seasonId;
        this.nextAttemptAt = nextAttemptAt;
    }
}
