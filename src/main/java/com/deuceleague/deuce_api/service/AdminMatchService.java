package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.event.EventBatch;
import com.deuceleague.deuce_api.event.MatchEvent;
import com.deuceleague.deuce_api.event.MatchEventDispatcher;
import com.deuceleague.deuce_api.event.MatchEventType;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.NotFoundException;
import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.MatchDisputeRepository;
import com.deuceleague.deuce_api.repository.MatchRepository;
import com.deuceleague.deuce_api.repository.MatchWalkoverRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Admin corrections to matches. Every operation writes its {@link AdminAction}
 * in the same transaction as the change it documents.
 */
@Service
public class AdminMatchService {

    private static final Logger log = LoggerFactory.getLogger(AdminMatchService.class);

    private final MatchRepository matchRepository;
    private final MatchWalkoverRepository walkoverRepository;
    private final MatchDisputeRepository disputeRepository;
    private final MatchStateMachine stateMachine;
    private final ScoreValidator scoreValidator;
    private final RecalculationCascade cascade;
    private final PenaltyService penaltyService;
    private final AdminAuditLog auditLog;
    private final MatchEventDispatcher eventDispatcher;
    private final TransactionTemplate transactionTemplate;
    private final DeuceProperties properties;
    private final Clock clock;

    public AdminMatchService(MatchRepository matchRepository,
                             MatchWalkoverRepository walkoverRepository,
                             MatchDisputeRepository disputeRepository,
                             MatchStateMachine stateMachine,
                             ScoreValidator scoreValidator,
                             RecalculationCascade cascade,
                             PenaltyService penaltyService,
                             AdminAuditLog auditLog,
                             MatchEventDispatcher eventDispatcher,
                             TransactionTemplate transactionTemplate,
                             DeuceProperties properties,
                             Clock clock) {
        this.matchRepository = matchRepository;
        this.walkoverRepository = walkoverRepository;
        this.disputeRepository = disputeRepository;
        this.stateMachine = stateMachine;
        this.scoreValidator = scoreValidator;
        this.cascade = cascade;
        this.penaltyService = penaltyService;
        this.auditLog = auditLog;
        this.eventDispatcher = eventDispatcher;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Result edits
    // =========================================================================

    public EditOutcome editResult(UUID matchId, EditResultCommand cmd) {
        requireReason(cmd.adminId(), cmd.reason());
        if (cmd.scores() == null || cmd.scores().isEmpty()) throw ValidationException.missingField("scores");
        EventBatch events = new EventBatch();

        EditOutcome outcome = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            if (match.getStatus() != MatchStatus.COMPLETED) {
                throw ConflictException.illegalTransition(matchId, match.getStatus(), MatchTransition.ADMIN_EDIT);
            }
            scoreValidator.validateStructure(cmd.scores());

            Map<String, Object> before = AdminAuditLog.resultSnapshot(match);
            int reversed = cascade.reverseRatings(match);
            MatchResultService.writeScore(match, cmd.scores());
            stateMachine.apply(match, MatchTransition.ADMIN_EDIT);
            cascade.rebuildResults(match);

            auditLog.record(matchId, cmd.adminId(), AdminActionType.EDIT_RESULT, before,
                    AdminAuditLog.resultSnapshot(match), cmd.reason(), match.getAcceptedUserIds(), true);
            events.add(MatchEvent.of(MatchEventType.MATCH_EDITED, matchId, match.getParticipantUserIds()));
            return new EditOutcome(match, reversed > 0, ParticipantChanges.none(), null);
        });

        eventDispatcher.dispatch(events);
        return rederive(outcome, outcome.match().getAcceptedUserIds());
    }

    /**
     * Replaces the roster. DRAFT and SCHEDULED matches are edited in place;
     * a COMPLETED match has its ratings reversed and everything derived from
     * it rebuilt for the new roster.
     */
    public EditOutcome editParticipants(UUID matchId, EditParticipantsCommand cmd) {
        requireReason(cmd.adminId(), cmd.reason());
        EventBatch events = new EventBatch();
        Set<UUID> previousRoster = new HashSet<>();

        EditOutcome outcome = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            MatchStatus current = match.getStatus();
            if (current != MatchStatus.DRAFT && current != MatchStatus.SCHEDULED && current != MatchStatus.COMPLETED) {
                throw ConflictException.invalidState("Participants of a " + current + " match cannot be edited");
            }
            validateRoster(match.getMatchType(), cmd.participants());

            // 1. Diff against the current roster
            Map<UUID, MatchParticipant> existing = new LinkedHashMap<>();
            match.getParticipants().forEach(p -> existing.put(p.getUserId(), p));
            previousRoster.addAll(existing.keySet());
            ParticipantChanges changes = diff(existing, cmd.participants());

            Map<String, Object> before = Map.of("participants", describe(match.getParticipants()));
            boolean completed = current == MatchStatus.COMPLETED;
            int reversed = completed ? cascade.reverseRatings(match) : 0;

            // 2. Delete and recreate every seat
            LocalDateTime now = now();
            UUID creatorId = cmd.participants().stream()
                    .filter(a -> a.role() == ParticipantRole.CREATOR)
                    .findFirst().orElseThrow().userId();
            match.getParticipants().clear();
            withdrawInvitations(match, changes.removed(), creatorId, now);

            for (ParticipantAssignment a : cmd.participants()) {
                MatchParticipant old = existing.get(a.userId());
                InvitationStatus invitationStatus;
                if (completed || a.role() == ParticipantRole.CREATOR) {
                    invitationStatus = InvitationStatus.ACCEPTED;
                } else if (old == null) {
                    invitationStatus = InvitationStatus.PENDING;
                } else {
                    invitationStatus = old.getInvitationStatus();
                }
                MatchParticipant seat = match.addParticipant(a.userId(), a.role(), a.team(), invitationStatus);
                if (invitationStatus == InvitationStatus.ACCEPTED) {
                    seat.setAcceptedAt(old != null && old.getAcceptedAt() != null ? old.getAcceptedAt() : now);
                }
                if (old == null && a.role() != ParticipantRole.CREATOR) {
                    invite(match, creatorId, a.userId(), completed, now, events);
                }
            }
            if (current == MatchStatus.DRAFT && match.getInvitations().stream()
                    .anyMatch(i -> i.getStatus() == InvitationStatus.PENDING)) {
                stateMachine.apply(match, MatchTransition.SEND_INVITATIONS);
            }

            if (completed) {
                stateMachine.apply(match, MatchTransition.ADMIN_EDIT);
                cascade.rebuildResults(match);
            }

            Set<UUID> affected = new LinkedHashSet<>(previousRoster);
            affected.addAll(match.getParticipantUserIds());
            auditLog.record(matchId, cmd.adminId(), AdminActionType.EDIT_PARTICIPANTS, before,
                    Map.of("participants", describe(match.getParticipants())), cmd.reason(), affected, completed);
            events.add(MatchEvent.of(MatchEventType.MATCH_EDITED, matchId, affected));
            log.info("Participants of match {} edited by admin {}: +{} -{} ~{}", matchId, cmd.adminId(),
                    changes.added().size(), changes.removed().size(), changes.modified().size());
            return new EditOutcome(match, reversed > 0, changes, null);
        });

        eventDispatcher.dispatch(events);
        if (outcome.match().getStatus() != MatchStatus.COMPLETED) return outcome;

        // Removed players need their best results recomputed too
        Set<UUID> affected = new LinkedHashSet<>(previousRoster);
        affected.addAll(outcome.match().getAcceptedUserIds());
        return rederive(outcome, affected);
    }

    // =========================================================================
    // Void / reinstate
    // =========================================================================

    public EditOutcome voidMatch(UUID matchId, UUID adminId, String reason) {
        requireReason(adminId, reason);
        EventBatch events = new EventBatch();

        EditOutcome outcome = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            MatchStatus from = match.getStatus();
            stateMachine.apply(match, MatchTransition.VOID);
            int reversed = cascade.reverseRatings(match);
            cascade.rebuildResults(match);
            match.setAdminNotes(reason);
            LocalDateTime now = now();
            match.cancelOpenInvitations(now);
            closeDisputes(match, adminId, reason, now, events);

            auditLog.record(matchId, adminId, AdminActionType.VOID_MATCH, Map.of("status", from),
                    Map.of("status", match.getStatus()), reason, match.getParticipantUserIds(), true);
            events.add(MatchEvent.of(MatchEventType.MATCH_VOIDED, matchId, match.getParticipantUserIds(),
                    Map.of("reason", reason)));
            return new EditOutcome(match, reversed > 0, ParticipantChanges.none(), null);
        });

        eventDispatcher.dispatch(events);
        log.info("Match {} voided by admin {}", matchId, adminId);
        return rederive(outcome, outcome.match().getAcceptedUserIds());
    }

    /** CANCELLED or VOID back to SCHEDULED with the result cleared. */
    public Match reinstateMatch(UUID matchId, UUID adminId, String reason) {
        requireReason(adminId, reason);
        EventBatch events = new EventBatch();

        Match result = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            MatchStatus from = match.getStatus();
            stateMachine.apply(match, MatchTransition.ADMIN_REINSTATE);

            match.replaceScores(List.of());
            match.setTeam1Score(null);
            match.setTeam2Score(null);
            match.setOutcome(null);
            match.clearPendingResult();
            match.setResultConfirmedById(null);
            match.setResultConfirmedAt(null);
            match.setAutoApproved(false);
            match.setWalkover(false);
            match.setWalkoverReason(null);
            match.setCancelledById(null);
            match.setCancelledAt(null);
            match.setCancellationReason(null);
            match.setLateCancellation(false);
            match.setRequiresAdminReview(false);

            auditLog.record(matchId, adminId, AdminActionType.REINSTATE_MATCH, Map.of("status", from),
                    Map.of("status", match.getStatus()), reason, match.getParticipantUserIds(), false);
            events.add(MatchEvent.of(MatchEventType.MATCH_REINSTATED, matchId, match.getParticipantUserIds()));
            return match;
        });

        eventDispatcher.dispatch(events);
        log.info("Match {} reinstated by admin {}", matchId, adminId);
        return result;
    }

    // =========================================================================
    // Late cancellations & walkovers
    // =========================================================================

    public List<Match> pendingLateCancellations() {
        return matchRepository.findByStatusAndLateCancellationTrueAndRequiresAdminReviewTrueOrderByCancelledAtAsc(
                MatchStatus.CANCELLED);
    }

    /**
     * Approves or denies a late cancellation. A denial may carry a penalty for
     * the canceller: a warning with points deducted, or a suspension.
     */
    public LateCancellationDecision reviewLateCancellation(UUID matchId, LateCancellationReview review) {
        if (review.adminId() == null) throw ValidationException.missingField("adminId");
        EventBatch events = new EventBatch();

        LateCancellationDecision decision = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            if (match.getCancelledById() == null || !match.isLateCancellation()) {
                throw ConflictException.invalidState("Match " + matchId + " has no late cancellation to review");
            }
            if (!match.isRequiresAdminReview()) {
                throw ConflictException.invalidState("Late cancellation of match " + matchId + " was already reviewed");
            }

            String reason = review.reason() != null && !review.reason().isBlank()
                    ? review.reason()
                    : (review.approved() ? "Approved" : "Denied");
            match.setRequiresAdminReview(false);
            auditLog.record(matchId, review.adminId(),
                    review.approved() ? AdminActionType.APPROVE_LATE_CANCELLATION : AdminActionType.DENY_LATE_CANCELLATION,
                    null, null, reason, List.of(match.getCancelledById()), false);

            Penalty penalty = null;
            if (!review.approved() && review.applyPenalty() && review.severity() != null) {
                penalty = penaltyService.issue(lateCancellationPenalty(match, review, reason), events);
            }
            return new LateCancellationDecision(match, review.approved(), penalty);
        });

        eventDispatcher.dispatch(events);
        log.info("Late cancellation for match {} {} by admin {}", matchId,
                decision.approved() ? "approved" : "denied", review.adminId());
        return decision;
    }

    private PenaltyService.PenaltyCommand lateCancellationPenalty(Match match, LateCancellationReview review,
                                                                 String reason) {
        DeuceProperties.Penalties config = properties.getPenalties();
        Integer points = review.severity() == PenaltySeverity.POINTS_DEDUCTION
                ? config.getLateCancellationPoints() : null;
        Integer days = review.severity() == PenaltySeverity.SUSPENSION
                ? config.getLateCancellationSuspensionDays() : null;
        return new PenaltyService.PenaltyCommand(match.getCancelledById(), review.adminId(), PenaltyType.WARNING,
                review.severity(), match.getId(), null, points, days, reason, null);
    }

    public MatchWalkover verifyWalkover(UUID matchId, UUID adminId, String notes) {
        if (adminId == null) throw ValidationException.missingField("adminId");
        return transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            MatchWalkover walkover = walkoverRepository.findByMatchId(matchId)
                    .orElseThrow(() -> new NotFoundException("Walkover", matchId));
            if (walkover.isAdminVerified()) return walkover;

            walkover.setAdminVerified(true);
            walkover.setVerifiedById(adminId);
            walkover.setVerifiedAt(now());
            walkoverRepository.save(walkover);
            auditLog.record(matchId, adminId, AdminActionType.VERIFY_WALKOVER, null,
                    Map.of("defaultingUserId", walkover.getDefaultingUserId()),
                    notes, match.getParticipantUserIds(), false);
            return walkover;
        });
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private EditOutcome rederive(EditOutcome outcome, Collection<UUID> affected) {
        Match match = outcome.match();
        RecalculationReport report = cascade.rederive(match.getId(), match.getDivisionId(), match.getSeasonId(),
                affected, outcome.ratingsReversed());
        return outcome.withReport(report);
    }

    /**
     * Closes the invitations of players leaving the roster, accepted ones
     * included, and any still open to the incoming creator.
     */
    private static void withdrawInvitations(Match match, Collection<UUID> removed, UUID creatorId, LocalDateTime now) {
        for (MatchInvitation invitation : match.getInvitations()) {
            UUID invitee = invitation.getInviteeId();
            boolean leaving = removed.contains(invitee) && invitation.getStatus() == InvitationStatus.ACCEPTED;
            boolean open = invitation.getStatus() == InvitationStatus.PENDING
                    && (removed.contains(invitee) || invitee.equals(creatorId));
            if (leaving || open) {
                invitation.setStatus(InvitationStatus.CANCELLED);
                invitation.setRespondedAt(now);
            }
        }
    }

    /**
     * Invites a player the admin added. On a completed match the seat is
     * already accepted, so the invitation is recorded as accepted too.
     */
    private void invite(Match match, UUID inviterId, UUID inviteeId, boolean accepted, LocalDateTime now,
                        EventBatch events) {
        MatchInvitation invitation = match.addInvitation(inviterId, inviteeId,
                now.plusHours(properties.getInvitations().getExpiryHours()));
        if (accepted) {
            invitation.setStatus(InvitationStatus.ACCEPTED);
            invitation.setRespondedAt(now);
            return;
        }
        events.add(MatchEvent.of(MatchEventType.INVITATION_SENT, match.getId(), List.of(inviteeId),
                Map.of("inviterId", inviterId, "expiresAt", invitation.getExpiresAt().toString())));
    }

    /** A voided match has nothing left to dispute: unresolved disputes close as VOID_MATCH. */
    private void closeDisputes(Match match, UUID adminId, String reason, LocalDateTime now, EventBatch events) {
        List<MatchDispute> open = disputeRepository.findByMatchIdAndStatusIn(match.getId(), MatchResultService.UNRESOLVED);
        for (MatchDispute dispute : open) {
            dispute.setStatus(DisputeStatus.RESOLVED);
            dispute.setResolutionAction(ResolutionAction.VOID_MATCH);
            dispute.setResolvedById(adminId);
            dispute.setResolvedAt(now);
            dispute.setAdminResolution(reason);
            disputeRepository.save(dispute);
            events.add(MatchEvent.of(MatchEventType.DISPUTE_RESOLVED, match.getId(), match.getParticipantUserIds(),
                    Map.of("disputeId", dispute.getId(), "action", ResolutionAction.VOID_MATCH.name())));
        }
        match.setDisputed(false);
        match.setRequiresAdminReview(false);
    }

    static void validateRoster(MatchType type, List<ParticipantAssignment> roster) {
        if (roster == null || roster.isEmpty()) throw ValidationException.missingField("participants");
        if (roster.size() != type.rosterSize()) {
            throw ValidationException.invalidRoster(type + " needs exactly " + type.rosterSize() + " participants");
        }
        Set<UUID> seen = new HashSet<>();
        int creators = 0;
        int team1 = 0;
        for (ParticipantAssignment a : roster) {
            if (a.userId() == null || a.role() == null || a.team() == null) {
                throw ValidationException.invalidRoster("Each participant needs userId, role and team");
            }
            if (!seen.add(a.userId())) {
                throw ValidationException.invalidRoster("User " + a.userId() + " is listed twice");
            }
            if (a.role() == ParticipantRole.CREATOR) creators++;
            if (a.team() == MatchTeam.TEAM1) team1++;
        }
        if (creators != 1) throw ValidationException.invalidRoster("Exactly one CREATOR is required");
        if (team1 != type.rosterSize() / 2) {
            throw ValidationException.invalidRoster("Both teams need " + type.rosterSize() / 2 + " player(s)");
        }
    }

    private static ParticipantChanges diff(Map<UUID, MatchParticipant> existing, List<ParticipantAssignment> roster) {
        List<UUID> added = new ArrayList<>();
        List<UUID> modified = new ArrayList<>();
        Set<UUID> kept = new HashSet<>();
        for (ParticipantAssignment a : roster) {
            MatchParticipant old = existing.get(a.userId());
            if (old == null) {
                added.add(a.userId());
            } else {
                kept.add(a.userId());
                if (old.getRole() != a.role() || old.getTeam() != a.team()) modified.add(a.userId());
            }
        }
        List<UUID> removed = existing.keySet().stream().filter(id -> !kept.contains(id)).toList();
        return new ParticipantChanges(added, removed, modified);
    }

    private static List<String> describe(List<MatchParticipant> participants) {
        return participants.stream()
                .map(p -> p.getUserId() + ":" + p.getRole() + ":" + p.getTeam())
                .toList();
    }

    private static void requireReason(UUID adminId, String reason) {
        if (adminId == null) throw ValidationException.missingField("adminId");
        if (reason == null || reason.isBlank()) throw ValidationException.missingField("reason");
    }

    private Match lockMatch(UUID matchId) {
        return matchRepository.findByIdForUpdate(matchId).orElseThrow(() -> new NotFoundException("Match", matchId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    // =========================================================================
    // Commands / results
    // =========================================================================

    public record EditResultCommand(UUID adminId, List<SetScore> scores, String reason) {}

    public record ParticipantAssignment(UUID userId, ParticipantRole role, MatchTeam team) {}

    public record EditParticipantsCommand(UUID adminId, List<ParticipantAssignment> participants, String reason) {}

    public record LateCancellationReview(
            UUID adminId,
            boolean approved,
            boolean applyPenalty,
            PenaltySeverity severity,
            String reason
    ) {}

    public record LateCancellationDecision(Match match, boolean approved, Penalty penalty) {}

    public record ParticipantChanges(List<UUID> added, List<UUID> removed, List<UUID> modified) {
        static ParticipantChanges none() {
            return new ParticipantChanges(List.of(), List.of(), List.of());
        }
    }

    public record EditOutcome(
            Match match,
            boolean ratingsReversed,
            ParticipantChanges changes,
            RecalculationReport report
    ) {
        EditOutcome withReport(RecalculationReport report) {
            return new EditOutcome(match, ratingsReversed, changes, report);
        }
    }
}
