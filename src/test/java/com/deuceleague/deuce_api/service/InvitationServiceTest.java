package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.event.EventBatch;
import com.deuceleague.deuce_api.event.MatchEvent;
import com.deuceleague.deuce_api.event.MatchEventDispatcher;
import com.deuceleague.deuce_api.event.MatchEventType;
import com.deuceleague.deuce_api.exception.AuthorizationException;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.MatchInvitationRepository;
import com.deuceleague.deuce_api.repository.MatchRepository;
import com.deuceleague.util.TestFixtures;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.deuceleague.util.TestFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InvitationServiceTest {

    @Mock private MatchRepository matchRepository;
    @Mock private MatchInvitationRepository invitationRepository;
    @Mock private MatchEventDispatcher eventDispatcher;

    private InvitationService service;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    private Match match;
    private MatchInvitation invitation;

    @BeforeEach
    void setUp() {
        service = new InvitationService(matchRepository, invitationRepository, new MatchStateMachine(),
                new ConflictDetector(matchRepository, mock(PlatformTransactionManager.class)), eventDispatcher, TestFixtures.transactionTemplate(),
                new DeuceProperties(), TestFixtures.FIXED_CLOCK);

        // Alice created a singles match and invited Bob
        match = TestFixtures.buildSinglesMatch(alice, null, MatchStatus.SCHEDULED);
        match.addParticipant(bob, ParticipantRole.OPPONENT, MatchTeam.TEAM2, InvitationStatus.PENDING);
        invitation = TestFixtures.addInvitation(match, bob, NOW.plusHours(48));

        lenient().when(invitationRepository.findMatchIdById(invitation.getId())).thenReturn(Optional.of(match.getId()));
        lenient().when(matchRepository.findByIdForUpdate(match.getId())).thenReturn(Optional.of(match));
    }

    private List<MatchEventType> dispatchedTypes() {
        ArgumentCaptor<EventBatch> captor = ArgumentCaptor.forClass(EventBatch.class);
        verify(eventDispatcher, atLeastOnce()).dispatch(captor.capture());
        return captor.getAllValues().stream()
                .flatMap(batch -> batch.events().stream())
                .map(MatchEvent::type)
                .toList();
    }

    // =========================================================================
    // 1.1 Respond
    // =========================================================================

    @Nested
    @DisplayName("1.1 Respond")
    class Respond {

        @Test
        @DisplayName("accept_seatsInviteeAsAccepted")
        void accept_seatsInviteeAsAccepted() {
            MatchInvitation result = service.respond(invitation.getId(), bob, true, null);

            assertEquals(InvitationStatus.ACCEPTED, result.getStatus());
            assertEquals(NOW, result.getRespondedAt());
            assertTrue(match.isAcceptedParticipant(bob));
            assertEquals(MatchStatus.SCHEDULED, match.getStatus());
            assertEquals(List.of(MatchEventType.INVITATION_ACCEPTED), dispatchedTypes());
        }

        @Test
        @DisplayName("respond_byAnotherUser_rejected")
        void respond_byAnotherUser_rejected() {
            assertThrows(AuthorizationException.class, () -> service.respond(invitation.getId(), alice, true, null));
            assertEquals(InvitationStatus.PENDING, invitation.getStatus());
        }

        @Test
        @DisplayName("respond_twice_rejected")
        void respond_twice_rejected() {
            service.respond(invitation.getId(), bob, true, null);

            ConflictException ex = assertThrows(ConflictException.class,
                    () -> service.respond(invitation.getId(), bob, false, null));
            assertEquals("invitation_already_responded", ex.getCode());
        }

        @Test
        @DisplayName("accept_onCancelledMatch_rejectedAndInvitationUntouched")
        void accept_onCancelledMatch_rejectedAndInvitationUntouched() {
            ReflectionTestUtils.setField(match, "status", MatchStatus.CANCELLED);

            ConflictException ex = assertThrows(ConflictException.class,
                    () -> service.respond(invitation.getId(), bob, true, null));

            assertEquals("invalid_state", ex.getCode());
            assertEquals(InvitationStatus.PENDING, invitation.getStatus());
            assertEquals(InvitationStatus.PENDING, match.findParticipant(bob).orElseThrow().getInvitationStatus());
            verify(eventDispatcher, never()).dispatch(any());
        }

        @Test
        @DisplayName("accept_withoutSeat_rejected")
        void accept_withoutSeat_rejected() {
            match.getParticipants().removeIf(p -> p.getUserId().equals(bob));

            ConflictException ex = assertThrows(ConflictException.class,
                    () -> service.respond(invitation.getId(), bob, true, null));

            assertEquals("invalid_state", ex.getCode());
            assertEquals(InvitationStatus.PENDING, invitation.getStatus());
        }

        @Test
        @DisplayName("decline_lastInvitation_revertsMatchToDraft")
        void decline_lastInvitation_revertsMatchToDraft() {
            service.respond(invitation.getId(), bob, false, "Away that week");

            assertEquals(InvitationStatus.DECLINED, invitation.getStatus());
            assertEquals("Away that week", invitation.getDeclineReason());
            assertEquals(MatchStatus.DRAFT, match.getStatus());
            assertEquals(List.of(MatchEventType.INVITATION_DECLINED, MatchEventType.INVITATIONS_LAPSED),
                    dispatchedTypes());
        }
    }

    // =========================================================================
    // 1.2 Expiry
    // =========================================================================

    @Nested
    @DisplayName("1.2 Expiry")
    class Expiry {

        @Test
        @DisplayName("accept_afterExpiry_throwsButPersistsExpiredStatus")
        void accept_afterExpiry_throwsButPersistsExpiredStatus() {
            expire(invitation);

            ConflictException ex = assertThrows(ConflictException.class,
                    () -> service.respond(invitation.getId(), bob, true, null));

            assertEquals("invitation_expired", ex.getCode());
            assertEquals(InvitationStatus.EXPIRED, invitation.getStatus());
            assertEquals(InvitationStatus.EXPIRED, match.findParticipant(bob).orElseThrow().getInvitationStatus());
            assertEquals(MatchStatus.DRAFT, match.getStatus());
            assertTrue(dispatchedTypes().contains(MatchEventType.INVITATION_EXPIRED));
        }

        @Test
        @DisplayName("sweep_expiresOverdueInvitations")
        void sweep_expiresOverdueInvitations() {
            expire(invitation);
            when(invitationRepository.findMatchIdsWithExpiredInvitations(NOW)).thenReturn(List.of(match.getId()));

            int expired = service.expireOverdueInvitations();

            assertEquals(1, expired);
            assertEquals(InvitationStatus.EXPIRED, invitation.getStatus());
            assertEquals(MatchStatus.DRAFT, match.getStatus());
        }

        @Test
        @DisplayName("sweep_failureOnOneMatch_continuesWithOthers")
        void sweep_failureOnOneMatch_continuesWithOthers() {
            expire(invitation);
            UUID broken = UUID.randomUUID();
            when(invitationRepository.findMatchIdsWithExpiredInvitations(NOW)).thenReturn(List.of(broken, match.getId()));
            when(matchRepository.findByIdForUpdate(broken)).thenThrow(new IllegalStateException("lock timeout"));

            int expired = service.expireOverdueInvitations();

            assertEquals(1, expired);
            assertEquals(InvitationStatus.EXPIRED, invitation.getStatus());
        }
    }

    private static void expire(MatchInvitation invitation) {
        ReflectionTestUtils.setField(invitation, "expiresAt", NOW.minusMinutes(1));
    }
}
