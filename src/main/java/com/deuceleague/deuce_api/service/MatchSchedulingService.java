package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.engine.DivisionMembershipOracle;
import com.deuceleague.deuce_api.event.EventBatch;
import com.deuceleague.deuce_api.event.MatchEvent;
import com.deuceleague.deuce_api.event.MatchEventDispatcher;
import com.deuceleague.deuce_api.event.MatchEventType;
import com.deuceleague.deuce_api.exception.AuthorizationException;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.NotFoundException;
import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.MatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Match creation, invitation re-sends, open sign-up, time-slot voting and
 * cancellation.
 */
@Service
public class MatchSchedulingService {

    private static final Logger log = LoggerFactory.getLogger(MatchSchedulingService.class);

    private final MatchRepository matchRepository;
    private final MatchStateMachine stateMachine;
    private final ConflictDetector conflictDetector;
    private final DivisionMembershipOracle membershipOracle;
    private final MatchEventDispatcher eventDispatcher;
    private final TransactionTemplate transactionTemplate;
    private final DeuceProperties properties;
    private final Clock clock;

    public MatchSchedulingService(MatchRepository matchRepository,
                                  MatchStateMachine stateMachine,
                                  ConflictDetector conflictDetector,
                                  DivisionMembershipOracle membershipOracle,
                                  MatchEventDispatcher eventDispatcher,
                                  TransactionTemplate transactionTemplate,
                                  DeuceProperties properties,
                                  Clock clock) {
        this.matchRepository = matchRepository;
        this.stateMachine = stateMachine;
        this.conflictDetector = conflictDetector;
        this.membershipOracle = membershipOracle;
        this.eventDispatcher = eventDispatcher;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Create
    // =========================================================================

    public Match createMatch(CreateMatchCommand cmd) {
        if (cmd.creatorId() == null) throw ValidationException.missingField("creatorId");
        if (cmd.divisionId() == null) throw ValidationException.missingField("divisionId");
        if (cmd.seasonId() == null) throw ValidationException.missingField("seasonId");
        if (cmd.sport() == null) throw ValidationException.missingField("sport");
        if (cmd.matchType() == null) throw ValidationException.missingField("matchType");

        InvitationSetup setup = cmd.setup() == null ? InvitationSetup.none() : cmd.setup();

        // 1. Membership and roster shape
        if (!membershipOracle.isActiveMember(cmd.creatorId(), cmd.divisionId())) {
            throw AuthorizationException.notMember(cmd.creatorId());
        }
        validateSetup(cmd.creatorId(), cmd.divisionId(), cmd.matchType(), setup);

        // 2. Advisory conflict check against the first proposed time
        checkCreationConflicts(cmd.creatorId(), cmd.matchType(), setup, null);

        // 3. Persist with roster, invitations and slots
        EventBatch events = new EventBatch();
        Match created = transactionTemplate.execute(status -> {
            Match match = new Match(cmd.divisionId(), cmd.seasonId(), cmd.sport(), cmd.matchType(),
                    cmd.creatorId(), MatchStatus.SCHEDULED);
            if (cmd.set3Format() != null) match.setSet3Format(cmd.set3Format());
            match.setRequiresConfirmation(cmd.requiresConfirmation() != null
                    ? cmd.requiresConfirmation()
                    : properties.getMatches().isRequiresConfirmation());
            match.setLocation(setup.location());

            populate(match, cmd.creatorId(), setup);
            matchRepository.save(match);
            queueInvitationEvents(match, events);
            return match;
        });

        eventDispatcher.dispatch(events);
        log.info("Match {} created by {} ({} {}, {} invitation(s))", created.getId(), cmd.creatorId(),
                cmd.sport(), cmd.matchType(), created.getInvitations().size());
        return created;
    }

    /**
     * DRAFT → SCHEDULED. The previous roster, invitations and slots are
     * discarded and rebuilt from {@code setup}.
     */
    public Match resendInvitations(UUID matchId, UUID creatorId, InvitationSetup setup) {
        InvitationSetup effective = setup == null ? InvitationSetup.none() : setup;
        EventBatch events = new EventBatch();

        Match result = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            if (!match.getCreatedById().equals(creatorId)) {
                throw AuthorizationException.notAllowed("Only the creator can re-send invitations");
            }
            validateSetup(creatorId, match.getDivisionId(), match.getMatchType(), effective);
            checkCreationConflicts(creatorId, match.getMatchType(), effective, matchId);

            stateMachine.apply(match, MatchTransition.SEND_INVITATIONS);
            match.resetSetup();
            if (effective.location() != null) match.setLocation(effective.location());
            populate(match, creatorId, effective);
            queueInvitationEvents(match, events);
            return match;
        });

        eventDispatcher.dispatch(events);
        return result;
    }

    // =========================================================================
    // Open sign-up
    // =========================================================================

    public Match joinMatch(UUID matchId, UUID userId, boolean asPartner) {
        EventBatch events = new EventBatch();

        Match result = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            if (match.getStatus() != MatchStatus.SCHEDULED) {
                throw ConflictException.invalidState("Only scheduled matches can be joined");
            }
            if (!membershipOracle.isActiveMember(userId, match.getDivisionId())) {
                throw AuthorizationException.notMember(userId);
            }
            if (match.isParticipant(userId)) {
                throw new ConflictException("already_participant", "Already a participant in this match");
            }
            match.getEffectiveTime().ifPresent(time -> conflictDetector
                    .findConflict(userId, time, matchId, acceptanceWindow())
                    .ifPresent(c -> { throw ConflictException.scheduleConflict(userId, c.getId()); }));

            MatchParticipant seat = seatJoiner(match, userId, asPartner);
            seat.setAcceptedAt(now());
            events.add(MatchEvent.of(MatchEventType.PLAYER_JOINED, matchId, match.getAcceptedUserIds(),
                    Map.of("userId", userId, "team", seat.getTeam().name())));
            return match;
        });

        eventDispatcher.dispatch(events);
        log.info("User {} joined match {}", userId, matchId);
        return result;
    }

    private MatchParticipant seatJoiner(Match match, UUID userId, boolean asPartner) {
        long team1 = seatedOn(match, MatchTeam.TEAM1);
        long team2 = seatedOn(match, MatchTeam.TEAM2);

        if (match.getMatchType() == MatchType.SINGLES) {
            if (team2 > 0) throw ConflictException.matchFull(match.getId());
            return match.addParticipant(userId, ParticipantRole.OPPONENT, MatchTeam.TEAM2, InvitationStatus.ACCEPTED);
        }
        if (asPartner && team1 < 2) {
            return match.addParticipant(userId, ParticipantRole.PARTNER, MatchTeam.TEAM1, InvitationStatus.ACCEPTED);
        }
        if (team2 < 2) {
            ParticipantRole role = team2 == 0 ? ParticipantRole.OPPONENT : ParticipantRole.PARTNER;
            return match.addParticipant(userId, role, MatchTeam.TEAM2, InvitationStatus.ACCEPTED);
        }
        throw ConflictException.matchFull(match.getId());
    }

    // A seat counts while its holder is invited or accepted.
    private static long seatedOn(Match match, MatchTeam team) {
        return match.getParticipants().stream()
                .filter(p -> p.getTeam() == team)
                .filter(p -> p.getInvitationStatus() == InvitationStatus.PENDING || p.isAccepted())
                .count();
    }

    // =========================================================================
    // Time slots
    // =========================================================================

    public TimeSlot proposeTimeSlot(UUID matchId, UUID userId, LocalDateTime time, String location) {
        if (time == null) throw ValidationException.missingField("proposedTime");
        return transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            requireSchedulable(match);
            stateMachine.requireAcceptedParticipant(match, userId);
            return match.addTimeSlot(time, location, userId);
        });
    }

    /**
     * Records a vote; once every accepted participant has voted for the slot it
     * is confirmed automatically.
     */
    public TimeSlot voteForTimeSlot(UUID matchId, UUID slotId, UUID userId) {
        EventBatch events = new EventBatch();

        TimeSlot result = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            requireSchedulable(match);
            stateMachine.requireAcceptedParticipant(match, userId);
            TimeSlot slot = match.findTimeSlot(slotId).orElseThrow(() -> new NotFoundException("Time slot", slotId));

            if (slot.hasVoted(userId)) {
                throw ConflictException.alreadyVoted(slotId);
            }
            if (slot.getStatus() != TimeSlotStatus.PROPOSED) {
                throw ConflictException.invalidState("Time slot " + slotId + " is " + slot.getStatus());
            }
            slot.addVote(userId);

            long acceptedVotes = slot.getVotes().stream().filter(match::isAcceptedParticipant).count();
            if (acceptedVotes >= match.getAcceptedParticipants().size()) {
                confirmSlot(match, slot, events);
            }
            return slot;
        });

        eventDispatcher.dispatch(events);
        return result;
    }

    /** Confirming a slot that is already CONFIRMED changes nothing. */
    public TimeSlot confirmTimeSlot(UUID matchId, UUID slotId, UUID userId) {
        EventBatch events = new EventBatch();

        TimeSlot result = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            stateMachine.requireAcceptedParticipant(match, userId);
            TimeSlot slot = match.findTimeSlot(slotId).orElseThrow(() -> new NotFoundException("Time slot", slotId));

            if (slot.getStatus() == TimeSlotStatus.CONFIRMED) {
                return slot;
            }
            requireSchedulable(match);
            if (slot.getStatus() == TimeSlotStatus.REJECTED) {
                throw ConflictException.invalidState("Time slot " + slotId + " was rejected");
            }
            confirmSlot(match, slot, events);
            return slot;
        });

        eventDispatcher.dispatch(events);
        return result;
    }

    private void confirmSlot(Match match, TimeSlot slot, EventBatch events) {
        slot.setStatus(TimeSlotStatus.CONFIRMED);
        slot.setConfirmedAt(now());
        for (TimeSlot sibling : match.getTimeSlots()) {
            if (sibling != slot) sibling.setStatus(TimeSlotStatus.REJECTED);
        }
        match.setScheduledTime(slot.getProposedTime());
        if (slot.getLocation() != null) match.setLocation(slot.getLocation());

        events.add(MatchEvent.of(MatchEventType.TIME_SLOT_CONFIRMED, match.getId(), match.getAcceptedUserIds(),
                Map.of("scheduledTime", slot.getProposedTime().toString())));
        log.info("Match {} time confirmed for {}", match.getId(), slot.getProposedTime());
    }

    // =========================================================================
    // Reschedule / continue
    // =========================================================================

    /**
     * Puts new times to the vote for a SCHEDULED match. The agreed time is
     * dropped and every earlier slot rejected; each match may be rescheduled
     * at most {@code deuce.matches.max-reschedules} times.
     */
    public Match requestReschedule(UUID matchId, UUID userId, List<LocalDateTime> proposedTimes, String reason) {
        requireProposals(proposedTimes);
        int limit = properties.getMatches().getMaxReschedules();
        EventBatch events = new EventBatch();

        Match result = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            stateMachine.requireAcceptedParticipant(match, userId);
            requireSchedulable(match);
            if (match.getRescheduleCount() >= limit) {
                throw ConflictException.rescheduleLimitReached(matchId, limit);
            }
            match.reopenScheduling(proposedTimes, match.getLocation(), userId);
            match.recordReschedule();
            queueRescheduleEvent(match, userId, reason, false, events);
            return match;
        });

        eventDispatcher.dispatch(events);
        log.info("Reschedule {} of match {} requested by {}", result.getRescheduleCount(), matchId, userId);
        return result;
    }

    /** UNFINISHED back to SCHEDULED with new proposals to finish the match. */
    public Match continueUnfinishedMatch(UUID matchId, UUID userId, List<LocalDateTime> proposedTimes, String notes) {
        requireProposals(proposedTimes);
        EventBatch events = new EventBatch();

        Match result = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            stateMachine.requireAcceptedParticipant(match, userId);
            stateMachine.apply(match, MatchTransition.CONTINUE);
            match.reopenScheduling(proposedTimes, match.getLocation(), userId);
            queueRescheduleEvent(match, userId, notes, true, events);
            return match;
        });

        eventDispatcher.dispatch(events);
        log.info("Unfinished match {} continuation requested by {}", matchId, userId);
        return result;
    }

    private static void requireProposals(List<LocalDateTime> proposedTimes) {
        if (proposedTimes == null || proposedTimes.isEmpty()) throw ValidationException.missingField("proposedTimes");
        if (proposedTimes.stream().anyMatch(Objects::isNull)) throw ValidationException.missingField("proposedTime");
    }

    private static void queueRescheduleEvent(Match match, UUID requestedBy, String reason, boolean continuation,
                                             EventBatch events) {
        List<UUID> others = match.getAcceptedUserIds().stream().filter(id -> !id.equals(requestedBy)).toList();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestedBy", requestedBy);
        payload.put("continuation", continuation);
        if (reason != null && !reason.isBlank()) payload.put("reason", reason);
        events.add(MatchEvent.of(MatchEventType.RESCHEDULE_REQUESTED, match.getId(), others, payload));
    }

    // =========================================================================
    // Cancel
    // =========================================================================

    public Match cancelMatch(UUID matchId, UUID userId, String reason) {
        EventBatch events = new EventBatch();

        Match result = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            stateMachine.requireAcceptedParticipant(match, userId);
            stateMachine.apply(match, MatchTransition.CANCEL);

            LocalDateTime now = now();
            match.setCancelledById(userId);
            match.setCancelledAt(now);
            match.setCancellationReason(reason);
            match.cancelOpenInvitations(now);

            LocalDateTime lateThreshold = now.plusHours(properties.getMatches().getLateCancellationHours());
            boolean late = match.getEffectiveTime().map(t -> t.isBefore(lateThreshold)).orElse(false);
            if (late) {
                match.setLateCancellation(true);
                match.setRequiresAdminReview(true);
                events.add(MatchEvent.of(MatchEventType.LATE_CANCELLATION_REVIEW, matchId, List.of(),
                        Map.of("cancelledBy", userId)));
            }
            events.add(MatchEvent.of(MatchEventType.MATCH_CANCELLED, matchId, match.getParticipantUserIds(),
                    Map.of("cancelledBy", userId, "late", late)));
            return match;
        });

        eventDispatcher.dispatch(events);
        log.info("Match {} cancelled by {} (late={})", matchId, userId, result.isLateCancellation());
        return result;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void populate(Match match, UUID creatorId, InvitationSetup setup) {
        LocalDateTime now = now();
        int hours = setup.expiresInHours() != null ? setup.expiresInHours() : properties.getInvitations().getExpiryHours();
        LocalDateTime expiresAt = now.plusHours(hours);

        match.addParticipant(creatorId, ParticipantRole.CREATOR, MatchTeam.TEAM1, InvitationStatus.ACCEPTED)
                .setAcceptedAt(now);
        invite(match, creatorId, setup.partnerId(), ParticipantRole.PARTNER, MatchTeam.TEAM1, expiresAt);
        invite(match, creatorId, setup.opponentId(), ParticipantRole.OPPONENT, MatchTeam.TEAM2, expiresAt);
        invite(match, creatorId, setup.opponentPartnerId(), ParticipantRole.PARTNER, MatchTeam.TEAM2, expiresAt);

        for (LocalDateTime time : setup.proposedTimes()) {
            match.addTimeSlot(time, setup.location(), creatorId);
        }
    }

    private static void invite(Match match, UUID inviterId, UUID inviteeId, ParticipantRole role,
                               MatchTeam team, LocalDateTime expiresAt) {
        if (inviteeId == null) return;
        match.addParticipant(inviteeId, role, team, InvitationStatus.PENDING);
        match.addInvitation(inviterId, inviteeId, expiresAt);
    }

    private void validateSetup(UUID creatorId, UUID divisionId, MatchType type, InvitationSetup setup) {
        if (type == MatchType.DOUBLES && setup.partnerId() == null) {
            throw ValidationException.missingField("partnerId");
        }
        if (type == MatchType.SINGLES && (setup.partnerId() != null || setup.opponentPartnerId() != null)) {
            throw ValidationException.invalidRoster("Singles matches have no partners");
        }
        List<UUID> invitees = setup.invitees();
        Set<UUID> distinct = new HashSet<>(invitees);
        if (distinct.size() != invitees.size() || distinct.contains(creatorId)) {
            throw ValidationException.invalidRoster("Each player may hold only one seat");
        }
        if (setup.opponentId() != null && !membershipOracle.isActiveMember(setup.opponentId(), divisionId)) {
            throw AuthorizationException.notMember(setup.opponentId());
        }
    }

    private void checkCreationConflicts(UUID creatorId, MatchType type, InvitationSetup setup, UUID excludeMatchId) {
        if (setup.proposedTimes().isEmpty()) return;
        LocalDateTime first = setup.proposedTimes().get(0);
        Duration window = Duration.ofHours(properties.getConflicts().getCreationWindowHours());

        List<UUID> toCheck = new ArrayList<>();
        toCheck.add(creatorId);
        if (type == MatchType.DOUBLES && setup.partnerId() != null) toCheck.add(setup.partnerId());

        for (UUID userId : toCheck) {
            conflictDetector.findConflict(userId, first, excludeMatchId, window).ifPresent(c -> {
                log.warn("Match creation rejected: user {} already plays match {} near {}", userId, c.getId(), first);
                throw ConflictException.scheduleConflict(userId, c.getId());
            });
        }
    }

    private static void queueInvitationEvents(Match match, EventBatch events) {
        for (MatchInvitation invitation : match.getInvitations()) {
            events.add(MatchEvent.of(MatchEventType.INVITATION_SENT, match.getId(), List.of(invitation.getInviteeId()),
                    Map.of("inviterId", invitation.getInviterId(), "expiresAt", invitation.getExpiresAt().toString())));
        }
    }

    private static void requireSchedulable(Match match) {
        if (match.getStatus() != MatchStatus.SCHEDULED) {
            throw ConflictException.invalidState("Match " + match.getId() + " is " + match.getStatus());
        }
    }

    private Duration acceptanceWindow() {
        return Duration.ofHours(properties.getConflicts().getAcceptanceWindowHours());
    }

    private Match lockMatch(UUID matchId) {
        return matchRepository.findByIdForUpdate(matchId).orElseThrow(() -> new NotFoundException("Match", matchId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    // =========================================================================
    // Commands
    // =========================================================================

    public record CreateMatchCommand(
            UUID creatorId,
            UUID divisionId,
            UUID seasonId,
            SportType sport,
            MatchType matchType,
            Set3Format set3Format,
            Boolean requiresConfirmation,
            InvitationSetup setup
    ) {}

    /** Who to invite and when to play; the part of a match rebuilt on re-send. */
    public record InvitationSetup(
            UUID partnerId,
            UUID opponentId,
            UUID opponentPartnerId,
            List<LocalDateTime> proposedTimes,
            String location,
            Integer expiresInHours
    ) {
        public InvitationSetup {
            proposedTimes = proposedTimes == null ? List.of() : List.copyOf(proposedTimes);
        }

        public static InvitationSetup none() {
            return new InvitationSetup(null, null, null, List.of(), null, null);
        }

        List<UUID> invitees() {
            List<UUID> ids = new ArrayList<>();
            if (partnerId != null) ids.add(partnerId);
            if (opponentId != null) ids.add(opponentId);
            if (opponentPartnerId != null) ids.add(opponentPartnerId);
            return ids;
        }
    }
}
