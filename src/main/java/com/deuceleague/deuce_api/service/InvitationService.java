package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.event.EventBatch;
import com.deuceleague.deuce_api.event.MatchEvent;
import com.deuceleague.deuce_api.event.MatchEventDispatcher;
import com.deuceleague.deuce_api.event.MatchEventType;
import com.deuceleague.deuce_api.exception.AuthorizationException;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.NotFoundException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.MatchInvitationRepository;
import com.deuceleague.deuce_api.repository.MatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Invitation responses, cancellation and expiry.
 *
 * Expiry is enforced twice with one rule ({@link MatchInvitation#isExpired}):
 * lazily when the invitee responds, and eagerly by {@link #expireOverdueInvitations()}.
 * When the last open invitation on a SCHEDULED match closes without anyone
 * accepting, the match falls back to DRAFT.
 */
@Service
public class InvitationService {

    private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

    private final MatchRepository matchRepository;
    private final MatchInvitationRepository invitationRepository;
    private final MatchStateMachine stateMachine;
    private final ConflictDetector conflictDetector;
    private final MatchEventDispatcher eventDispatcher;
    private final TransactionTemplate transactionTemplate;
    private final DeuceProperties properties;
    private final Clock clock;

    public InvitationService(MatchRepository matchRepository,
                             MatchInvitationRepository invitationRepository,
                             MatchStateMachine stateMachine,
                             ConflictDetector conflictDetector,
                             MatchEventDispatcher eventDispatcher,
                             TransactionTemplate transactionTemplate,
                             DeuceProperties properties,
                             Clock clock) {
        this.matchRepository = matchRepository;
        this.invitationRepository = invitationRepository;
        this.stateMachine = stateMachine;
        this.conflictDetector = conflictDetector;
        this.eventDispatcher = eventDispatcher;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Respond
    // =========================================================================

    public MatchInvitation respond(UUID invitationId, UUID userId, boolean accept, String declineReason) {
        UUID matchId = invitationRepository.findMatchIdById(invitationId)
                .orElseThrow(() -> new NotFoundException("Invitation", invitationId));
        EventBatch events = new EventBatch();

        RespondOutcome outcome = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            MatchInvitation invitation = match.findInvitation(invitationId)
                    .orElseThrow(() -> new NotFoundException("Invitation", invitationId));

            if (!invitation.getInviteeId().equals(userId)) {
                throw AuthorizationException.notAllowed("Only the invitee can respond to this invitation");
            }
            if (invitation.getStatus() != InvitationStatus.PENDING) {
                throw ConflictException.alreadyResponded(invitationId);
            }
            if (match.getStatus() != MatchStatus.SCHEDULED && match.getStatus() != MatchStatus.DRAFT) {
                throw ConflictException.invalidState("Match " + matchId + " is " + match.getStatus()
                        + " and no longer takes invitation responses");
            }

            LocalDateTime now = now();
            // The expiry is committed even though the caller gets an error.
            if (invitation.isExpired(now)) {
                close(match, invitation, InvitationStatus.EXPIRED, now, events);
                revertIfLapsed(match, events);
                return new RespondOutcome(invitation, true);
            }

            if (accept) {
                MatchParticipant seat = match.findParticipant(userId)
                        .orElseThrow(() -> ConflictException.invalidState(
                                "Invitation " + invitationId + " has no seat on match " + matchId));
                match.getEffectiveTime().ifPresent(time -> conflictDetector
                        .findConflict(userId, time, matchId,
                                Duration.ofHours(properties.getConflicts().getAcceptanceWindowHours()))
                        .ifPresent(c -> { throw ConflictException.scheduleConflict(userId, c.getId()); }));

                invitation.setStatus(InvitationStatus.ACCEPTED);
                invitation.setRespondedAt(now);
                seat.setInvitationStatus(InvitationStatus.ACCEPTED);
                seat.setAcceptedAt(now);
                events.add(MatchEvent.of(MatchEventType.INVITATION_ACCEPTED, matchId,
                        List.of(invitation.getInviterId()), Map.of("userId", userId)));
            } else {
                invitation.setDeclineReason(declineReason);
                close(match, invitation, InvitationStatus.DECLINED, now, events);
                revertIfLapsed(match, events);
            }
            return new RespondOutcome(invitation, false);
        });

        eventDispatcher.dispatch(events);
        if (outcome.expired()) {
            log.warn("User {} responded to expired invitation {}", userId, invitationId);
            throw ConflictException.invitationExpired(invitationId);
        }
        log.info("Invitation {} {} by {}", invitationId, outcome.invitation().getStatus(), userId);
        return outcome.invitation();
    }

    /** The inviter (or the match creator) withdraws a pending invitation. */
    public MatchInvitation cancel(UUID invitationId, UUID actorId) {
        UUID matchId = invitationRepository.findMatchIdById(invitationId)
                .orElseThrow(() -> new NotFoundException("Invitation", invitationId));
        EventBatch events = new EventBatch();

        MatchInvitation result = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            MatchInvitation invitation = match.findInvitation(invitationId)
                    .orElseThrow(() -> new NotFoundException("Invitation", invitationId));
            if (!actorId.equals(invitation.getInviterId()) && !actorId.equals(match.getCreatedById())) {
                throw AuthorizationException.notAllowed("Only the inviter can cancel this invitation");
            }
            if (invitation.getStatus() != InvitationStatus.PENDING) {
                throw ConflictException.alreadyResponded(invitationId);
            }
            close(match, invitation, InvitationStatus.CANCELLED, now(), events);
            revertIfLapsed(match, events);
            return invitation;
        });

        eventDispatcher.dispatch(events);
        return result;
    }

    // =========================================================================
    // Sweep
    // =========================================================================

    /**
     * Expires every overdue PENDING invitation, one match per transaction.
     *
     * @return number of invitations expired
     */
    public int expireOverdueInvitations() {
        LocalDateTime now = now();
        List<UUID> matchIds = invitationRepository.findMatchIdsWithExpiredInvitations(now);
        int expired = 0;

        for (UUID matchId : matchIds) {
            EventBatch events = new EventBatch();
            try {
                Integer count = transactionTemplate.execute(status -> {
                    Match match = lockMatch(matchId);
                    int n = 0;
                    for (MatchInvitation invitation : match.getInvitations()) {
                        if (invitation.isExpired(now)) {
                            close(match, invitation, InvitationStatus.EXPIRED, now, events);
                            n++;
                        }
                    }
                    revertIfLapsed(match, events);
                    return n;
                });
                expired += count == null ? 0 : count;
                eventDispatcher.dispatch(events);
            } catch (RuntimeException e) {
                log.error("Invitation sweep failed for match {}: {}", matchId, e.getMessage(), e);
            }
        }
        return expired;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void close(Match match, MatchInvitation invitation, InvitationStatus terminal,
                       LocalDateTime now, EventBatch events) {
        invitation.setStatus(terminal);
        invitation.setRespondedAt(now);
        match.findParticipant(invitation.getInviteeId())
                .ifPresent(p -> p.setInvitationStatus(terminal));

        MatchEventType type = terminal == InvitationStatus.EXPIRED
                ? MatchEventType.INVITATION_EXPIRED
                : MatchEventType.INVITATION_DECLINED;
        events.add(MatchEvent.of(type, match.getId(), List.of(invitation.getInviterId()),
                Map.of("userId", invitation.getInviteeId(), "status", terminal.name())));
    }

    /** SCHEDULED → DRAFT once no invitation is open and none was accepted. */
    private void revertIfLapsed(Match match, EventBatch events) {
        if (match.getStatus() != MatchStatus.SCHEDULED || match.getInvitations().isEmpty()) return;

        boolean allClosed = match.getInvitations().stream().allMatch(i -> i.getStatus().isTerminal());
        boolean anyAccepted = match.getInvitations().stream()
                .anyMatch(i -> i.getStatus() == InvitationStatus.ACCEPTED);
        if (allClosed && !anyAccepted) {
            stateMachine.apply(match, MatchTransition.INVITATIONS_LAPSED);
            events.add(MatchEvent.of(MatchEventType.INVITATIONS_LAPSED, match.getId(), List.of(match.getCreatedById())));
        }
    }

    private Match lockMatch(UUID matchId) {
        return matchRepository.findByIdForUpdate(matchId).orElseThrow(() -> new NotFoundException("Match", matchId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private record RespondOutcome(MatchInvitation invitation, boolean expired) {}
}
