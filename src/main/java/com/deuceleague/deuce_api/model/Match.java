package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A league match and its owned children (participants, set scores, time slots
 * and invitations). Status changes go through {@code MatchStateMachine} only.
 */
@Getter
@Entity
@Table(name = "matches")
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "division_id", nullable = false)
    private UUID divisionId;

    @Column(name = "season_id", nullable = false)
    private UUID seasonId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SportType sport;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_type", nullable = false, length = 20)
    private MatchType matchType;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(name = "set3_format", length = 20)
    private Set3Format set3Format = Set3Format.MATCH_TIEBREAK;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MatchStatus status;

    @Column(name = "created_by_id", nullable = false)
    private UUID createdById;

    @Setter
    @Column(name = "scheduled_time")
    private LocalDateTime scheduledTime;

    @Setter
    private String location;

    // =========================================================================
    // Result: sets won per side plus the winning side
    // =========================================================================
    @Setter
    @Column(name = "team1_score")
    private Integer team1Score;

    @Setter
    @Column(name = "team2_score")
    private Integer team2Score;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private MatchTeam outcome;

    @Setter
    @Column(name = "result_submitted_by_id")
    private UUID resultSubmittedById;

    @Setter
    @Column(name = "result_submitted_at")
    private LocalDateTime resultSubmittedAt;

    @Setter
    @Column(name = "result_confirmed_by_id")
    private UUID resultConfirmedById;

    @Setter
    @Column(name = "result_confirmed_at")
    private LocalDateTime resultConfirmedAt;

    @Setter
    @Column(name = "requires_confirmation", nullable = false)
    private boolean requiresConfirmation = true;

    @Setter
    @Column(name = "auto_approved", nullable = false)
    private boolean autoApproved;

    // =========================================================================
    // Flags
    // =========================================================================
    @Setter
    @Column(name = "is_disputed", nullable = false)
    private boolean disputed;

    @Setter
    @Column(name = "is_walkover", nullable = false)
    private boolean walkover;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(name = "walkover_reason", length = 30)
    private WalkoverReason walkoverReason;

    @Setter
    @Column(name = "is_late_cancellation", nullable = false)
    private boolean lateCancellation;

    @Setter
    @Column(name = "requires_admin_review", nullable = false)
    private boolean requiresAdminReview;

    @Setter
    @Column(name = "cancelled_by_id")
    private UUID cancelledById;

    @Setter
    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Setter
    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "reschedule_count", nullable = false, columnDefinition = "integer not null default 0")
    private int rescheduleCount;

    @Setter
    @Column(name = "admin_notes", length = 1000)
    private String adminNotes;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    // =========================================================================
    // Owned children
    // =========================================================================
    @OneToMany(mappedBy = "match", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<MatchParticipant> participants = new ArrayList<>();

    @OneToMany(mappedBy = "match", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("setNumber ASC")
    private List<MatchScore> scores = new ArrayList<>();

    @OneToMany(mappedBy = "match", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("proposedTime ASC")
    private List<TimeSlot> timeSlots = new ArrayList<>();

    @OneToMany(mappedBy = "match", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<MatchInvitation> invitations = new ArrayList<>();

    // Constructors
    public Match() {}

    public Match(UUID divisionId, UUID seasonId, SportType sport, MatchType matchType,
                 UUID createdById, MatchStatus status) {
        this.divisionId = divisionId;
        this.seasonId = seasonId;
        this.sport = sport;
        this.matchType = matchType;
        this.createdById = createdById;
        this.status = status;
    }

    // =========================================================================
    // Roster helpers
    // =========================================================================

    public MatchParticipant addParticipant(UUID userId, ParticipantRole role, MatchTeam team,
                                           InvitationStatus invitationStatus) {
        MatchParticipant participant = new MatchParticipant(this, userId, role, team, invitationStatus);
        participants.add(participant);
        return participant;
    }

    public Optional<MatchParticipant> findParticipant(UUID userId) {
        return participants.stream().filter(p -> p.getUserId().equals(userId)).findFirst();
    }

    public boolean isParticipant(UUID userId) {
        return findParticipant(userId).isPresent();
    }

    public boolean isAcceptedParticipant(UUID userId) {
        return findParticipant(userId).map(MatchParticipant::isAccepted).orElse(false);
    }

    public List<MatchParticipant> getAcceptedParticipants() {
        return participants.stream().filter(MatchParticipant::isAccepted).toList();
    }

    public List<UUID> getAcceptedUserIds() {
        return getAcceptedParticipants().stream().map(MatchParticipant::getUserId).toList();
    }

    public Set<UUID> getParticipantUserIds() {
        return participants.stream().map(MatchParticipant::getUserId).collect(Collectors.toSet());
    }

    public List<UUID> getTeamUserIds(MatchTeam team) {
        return getAcceptedParticipants().stream()
                .filter(p -> p.getTeam() == team)
                .map(MatchParticipant::getUserId)
                .toList();
    }

    public MatchTeam teamOf(UUID userId) {
        return findParticipant(userId).map(MatchParticipant::getTeam).orElse(null);
    }

    /** Singles: one accepted player per side. Doubles: two accepted per side. */
    public boolean isRosterComplete() {
        int perTeam = matchType.rosterSize() / 2;
        return getAcceptedParticipants().size() == matchType.rosterSize()
                && getTeamUserIds(MatchTeam.TEAM1).size() == perTeam
                && getTeamUserIds(MatchTeam.TEAM2).size() == perTeam;
    }

    // =========================================================================
    // Scores
    // =========================================================================

    /** Delete-then-insert of every set row. */
    public void replaceScores(List<SetScore> newScores) {
        scores.clear();
        for (SetScore s : newScores) {
            scores.add(new MatchScore(this, s, tiebreakTypeFor(s)));
        }
    }

    private TiebreakType tiebreakTypeFor(SetScore s) {
        if (sport == SportType.PICKLEBALL || !s.hasTiebreak()) return null;
        boolean deciderTiebreak = s.setNumber() == 3
                && (set3Format == Set3Format.MATCH_TIEBREAK || s.team1Games() == s.team2Games());
        return deciderTiebreak ? TiebreakType.MATCH_10PT : TiebreakType.STANDARD_7PT;
    }

    public List<SetScore> getSetScores() {
        return scores.stream()
                .sorted(Comparator.comparingInt(MatchScore::getSetNumber))
                .map(MatchScore::toSetScore)
                .toList();
    }

    public boolean hasPendingResult() {
        return status == MatchStatus.ONGOING && resultSubmittedById != null;
    }

    public void clearPendingResult() {
        this.resultSubmittedById = null;
        this.resultSubmittedAt = null;
    }

    // =========================================================================
    // Time slots & invitations
    // =========================================================================

    /**
     * Drops the agreed time and rejects every earlier slot so a fresh set of
     * proposals can be voted on.
     */
    public void reopenScheduling(List<LocalDateTime> proposedTimes, String slotLocation, UUID proposedBy) {
        timeSlots.forEach(slot -> slot.setStatus(TimeSlotStatus.REJECTED));
        scheduledTime = null;
        for (LocalDateTime time : proposedTimes) {
            addTimeSlot(time, slotLocation, proposedBy);
        }
    }

    public void recordReschedule() {
        rescheduleCount++;
    }

    public Optional<TimeSlot> findTimeSlot(UUID slotId) {
        return timeSlots.stream().filter(s -> slotId.equals(s.getId())).findFirst();
    }

    public Optional<TimeSlot> getConfirmedSlot() {
        return timeSlots.stream().filter(s -> s.getStatus() == TimeSlotStatus.CONFIRMED).findFirst();
    }

    public TimeSlot addTimeSlot(LocalDateTime proposedTime, String slotLocation, UUID proposedBy) {
        TimeSlot slot = new TimeSlot(this, proposedTime, slotLocation, proposedBy);
        timeSlots.add(slot);
        return slot;
    }

    public MatchInvitation addInvitation(UUID inviterId, UUID inviteeId, LocalDateTime expiresAt) {
        MatchInvitation invitation = new MatchInvitation(this, inviterId, inviteeId, expiresAt);
        invitations.add(invitation);
        return invitation;
    }

    public Optional<MatchInvitation> findInvitation(UUID invitationId) {
        return invitations.stream().filter(i -> invitationId.equals(i.getId())).findFirst();
    }

    public List<MatchInvitation> cancelOpenInvitations(LocalDateTime now) {
        return cancelOpenInvitations(invitee -> true, now);
    }

    /**
     * Withdraws the PENDING invitations whose invitee matches, together with
     * the seats still waiting on them.
     *
     * @return the invitations that were withdrawn
     */
    public List<MatchInvitation> cancelOpenInvitations(Predicate<UUID> invitee, LocalDateTime now) {
        List<MatchInvitation> withdrawn = new ArrayList<>();
        for (MatchInvitation invitation : invitations) {
            if (invitation.getStatus() != InvitationStatus.PENDING || !invitee.test(invitation.getInviteeId())) continue;
            invitation.setStatus(InvitationStatus.CANCELLED);
            invitation.setRespondedAt(now);
            findParticipant(invitation.getInviteeId())
                    .filter(p -> p.getInvitationStatus() == InvitationStatus.PENDING)
                    .ifPresent(p -> p.setInvitationStatus(InvitationStatus.CANCELLED));
            withdrawn.add(invitation);
        }
        return withdrawn;
    }

    /**
     * The time the match is expected to be played: the agreed time, else the
     * confirmed slot, else the earliest proposal.
     */
    public Optional<LocalDateTime> getEffectiveTime() {
        if (scheduledTime != null) return Optional.of(scheduledTime);
        return getConfirmedSlot().map(TimeSlot::getProposedTime)
                .or(() -> timeSlots.stream()
                        .filter(s -> s.getStatus() == TimeSlotStatus.PROPOSED)
                        .map(TimeSlot::getProposedTime)
                        .min(Comparator.naturalOrder()));
    }

    /** Drops roster, invitations and slots ahead of a re-send from DRAFT. */
    public void resetSetup() {
        participants.clear();
        invitations.clear();
        timeSlots.clear();
        scheduledTime = null;
    }
}
