package com.deuceleague.deuce_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Entity
@Table(name = "match_invitations")
public class MatchInvitation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "match_id", nullable = false)
    private Match match;

    @Column(name = "inviter_id", nullable = false)
    private UUID inviterId;

    @Column(name = "invitee_id", nullable = false)
    private UUID inviteeId;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvitationStatus status = InvitationStatus.PENDING;

    @Setter
    @Column(name = "responded_at")
    private LocalDateTime respondedAt;

    @Setter
    @Column(name = "decline_reason", length = 500)
    private String declineReason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public MatchInvitation() {}

    MatchInvitation(Match match, UUID inviterId, UUID inviteeId, LocalDateTime expiresAt) {
        this.match = match;
        this.inviterId = inviterId;
        this.inviteeId = inviteeId;
        this.expiresAt = expiresAt;
    }

    /**
     * The single expiry rule, shared by the respond path and the background sweep.
     */
    public boolean isExpired(LocalDateTime now) {
        return status == InvitationStatus.PENDING && !now.isBefore(expiresAt);
    }
}
