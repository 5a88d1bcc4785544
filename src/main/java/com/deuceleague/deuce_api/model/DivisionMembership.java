package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Entity
@Table(name = "division_memberships",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "division_id"}))
public class DivisionMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "division_id", nullable = false)
    private UUID divisionId;

    @Column(name = "season_id")
    private UUID seasonId;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MembershipStatus status = MembershipStatus.ACTIVE;

    @CreationTimestamp
    @Column(name = "joined_at", updatable = false)
    private LocalDateTime joinedAt;

    public DivisionMembership() {}

    public DivisionMembership(UUID userId, UUID divisionId, UUID seasonId) {
        this.userId = userId;
        this.divisionId = divisionId;
        this.seasonId = seasonId;
    }
}
