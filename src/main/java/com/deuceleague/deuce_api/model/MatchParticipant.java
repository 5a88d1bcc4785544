package com.deuceleague.deuce_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Entity
@Table(name = "match_participants")
public class MatchParticipant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "match_id", nullable = false)
    private Match match;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ParticipantRole role;

    // Null until a side is assigned.
    @Setter
    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private MatchTeam team;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(name = "invitation_status", nullable = false, length = 20)
    private InvitationStatus invitationStatus;

    @Setter
    @Column(name = "accepted_at")
    private LocalDateTime acceptedAt;

    public MatchParticipant() {}

    MatchParticipant(Match match, UUID userId, ParticipantRole role, MatchTeam team,
                     InvitationStatus invitationStatus) {
        this.match = match;
        this.userId = userId;
        this.role = role;
        this.team = team;
        this.invitationStatus = invitationStatus;
    }

    public boolean isAccepted() {
        return invitationStatus == InvitationStatus.ACCEPTED;
    }
}
