package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable audit row for an administrative change to a match. Written in the
 * same transaction as the change itself.
 */
@Getter
@Entity
@Table(name = "match_admin_actions")
public class AdminAction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "match_id", nullable = false)
    private UUID matchId;

    @Column(name = "admin_id", nullable = false)
    private UUID adminId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 40)
    private AdminActionType actionType;

    @Column(name = "old_value", columnDefinition = "text")
    private String oldValue;

    @Column(name = "new_value", columnDefinition = "text")
    private String newValue;

    @Column(length = 2000)
    private String reason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "match_admin_action_users", joinColumns = @JoinColumn(name = "admin_action_id"))
    @Column(name = "user_id", nullable = false)
    private List<UUID> affectedUserIds = new ArrayList<>();

    @Column(name = "triggered_recalculation", nullable = false)
    private boolean triggeredRecalculation;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public AdminAction() {}

    public AdminAction(UUID matchId, UUID adminId, AdminActionType actionType,
                       String oldValue, String newValue, String reason,
                       List<UUID> affectedUserIds, boolean triggeredRecalculation) {
        this.matchId = matchId;
        this.adminId = adminId;
        this.actionType = actionType;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.reason = reason;
        this.affectedUserIds = new ArrayList<>(affectedUserIds);
        this.triggeredRecalculation = triggeredRecalculation;
    }
}
