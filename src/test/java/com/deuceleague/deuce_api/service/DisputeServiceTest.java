package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.event.EventBatch;
import com.deuceleague.deuce_api.event.MatchEvent;
import com.deuceleague.deuce_api.event.MatchEventDispatcher;
import com.deuceleague.deuce_api.event.MatchEventType;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.AdminActionRepository;
import com.deuceleague.deuce_api.repository.MatchDisputeRepository;
import com.deuceleague.deuce_api.repository.MatchRepository;
import com.deuceleague.deuce_api.service.DisputeService.DisputeResolution;
import com.deuceleague.deuce_api.service.DisputeService.ResolveDisputeCommand;
import com.deuceleague.util.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.deuceleague.util.TestFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DisputeServiceTest {

    @Mock private MatchRepository matchRepository;
    @Mock private MatchDisputeRepository disputeRepository;
    @Mock private AdminActionRepository adminActionRepository;
    @Mock private RecalculationCascade cascade;
    @Mock private MatchEventDispatcher eventDispatcher;

    private DisputeService service;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final UUID admin = UUID.randomUUID();

    private Match match;
    private MatchDispute dispute;

    @BeforeEach
    void setUp() {
        AdminAuditLog auditLog = new AdminAuditLog(adminActionRepository, new ObjectMapper());
        service = new DisputeService(matchRepository, disputeRepository, new MatchStateMachine(),
                new ScoreValidator(), cascade, auditLog, eventDispatcher, TestFixtures.transactionTemplate(),
                new DeuceProperties(), TestFixtures.FIXED_CLOCK);

        // Alice reported 6-3 6-4, Bob disputed it: the match is back to SCHEDULED
        match = TestFixtures.buildSinglesMatch(alice, bob, MatchStatus.SCHEDULED);
        MatchResultService.writeScore(match, TestFixtures.straightSets());
        match.setDisputed(true);
        match.setRequiresAdminReview(true);

        dispute = TestFixtures.withId(new MatchDispute(match.getId(), bob, DisputeCategory.WRONG_SCORE, "Third set was played"));
        dispute.setPriority(DisputePriority.HIGH);
        dispute.setDisputedScore(TestFixtures.straightSets());

        lenient().when(disputeRepository.findById(dispute.getId())).thenReturn(Optional.of(dispute));
        lenient().when(matchRepository.findByIdForUpdate(match.getId())).thenReturn(Optional.of(match));
    }

    private AdminAction recordedAction() {
        ArgumentCaptor<AdminAction> captor = ArgumentCaptor.forClass(AdminAction.class);
        verify(adminActionRepository).save(captor.capture());
        return captor.getValue();
    }

    // =========================================================================
    // 1.1 Score-deciding resolutions
    // =========================================================================

    @Nested
    @DisplayName("1.1 Score-deciding resolutions")
    class Deciding {

        @Test
        @DisplayName("customScore_completesWithAdjudicatedScore")
        void customScore_completesWithAdjudicatedScore() {
            DisputeResolution result = service.resolveDispute(dispute.getId(), new ResolveDisputeCommand(
                    admin, ResolutionAction.CUSTOM_SCORE, TestFixtures.adjudicatedThreeSetter(), "Three sets confirmed"));

            assertEquals(MatchStatus.COMPLETED, match.getStatus());
            assertEquals(MatchTeam.TEAM1, match.getOutcome());
            assertEquals(3, match.getScores().size());
            assertEquals(2, match.getTeam1Score());
            assertEquals(1, match.getTeam2Score());
            assertFalse(match.isDisputed());
            assertFalse(match.isRequiresAdminReview());

            assertEquals(DisputeStatus.RESOLVED, dispute.getStatus());
            assertEquals(ResolutionAction.CUSTOM_SCORE, dispute.getResolutionAction());
            assertEquals(admin, dispute.getResolvedById());
            assertEquals(NOW, dispute.getResolvedAt());
            assertEquals(TestFixtures.adjudicatedThreeSetter(), dispute.getFinalScore());

            AdminAction action = recordedAction();
            assertEquals(AdminActionType.OVERRIDE_DISPUTE, action.getActionType());
            assertTrue(action.isTriggeredRecalculation());
            assertTrue(action.getOldValue().contains("6-4"));
            assertTrue(action.getNewValue().contains("7-6"));

            assertTrue(result.rederive());
            assertFalse(result.ratingsReversed());
            verify(cascade, never()).reverseRatings(any());
            verify(cascade).rebuildResults(match);
            verify(cascade).rederive(eq(match.getId()), eq(TestFixtures.DIVISION_ID), eq(TestFixtures.SEASON_ID),
                    anyCollection(), eq(false));
        }

        @Test
        @DisplayName("upholdDisputer_onCompletedMatch_reversesRatingsFirst")
        void upholdDisputer_onCompletedMatch_reversesRatingsFirst() {
            match.setStatus(MatchStatus.COMPLETED);
            dispute.setDisputerScore(List.of(SetScore.of(1, 4, 6), SetScore.of(2, 4, 6)));
            when(cascade.reverseRatings(match)).thenReturn(2);

            DisputeResolution result = service.resolveDispute(dispute.getId(), new ResolveDisputeCommand(
                    admin, ResolutionAction.UPHOLD_DISPUTER, null, "Opponent's card is right"));

            assertEquals(MatchStatus.COMPLETED, match.getStatus());
            assertEquals(MatchTeam.TEAM2, match.getOutcome());
            assertTrue(result.ratingsReversed());
            verify(cascade).reverseRatings(match);
            verify(cascade).rederive(eq(match.getId()), any(), any(), anyCollection(), eq(true));
        }

        @Test
        @DisplayName("upholdDisputer_withoutAnyScore_rejected")
        void upholdDisputer_withoutAnyScore_rejected() {
            ValidationException ex = assertThrows(ValidationException.class, () -> service.resolveDispute(
                    dispute.getId(), new ResolveDisputeCommand(admin, ResolutionAction.UPHOLD_DISPUTER, null, "x")));

            assertEquals("missing_field", ex.getCode());
            assertEquals(DisputeStatus.OPEN, dispute.getStatus());
            verifyNoInteractions(adminActionRepository);
        }

        @Test
        @DisplayName("upholdOriginal_completesWithSubmittedScore")
        void upholdOriginal_completesWithSubmittedScore() {
            service.resolveDispute(dispute.getId(),
                    new ResolveDisputeCommand(admin, ResolutionAction.UPHOLD_ORIGINAL, null, "Submitted card stands"));

            assertEquals(MatchStatus.COMPLETED, match.getStatus());
            assertEquals(TestFixtures.straightSets(), match.getSetScores());
            assertFalse(recordedAction().isTriggeredRecalculation());
            verify(cascade).rebuildResults(match);
            verify(cascade).rederive(eq(match.getId()), any(), any(), anyCollection(), eq(false));
        }

        @Test
        @DisplayName("voidMatch_onCompletedMatch_voidsAndReverses")
        void voidMatch_onCompletedMatch_voidsAndReverses() {
            match.setStatus(MatchStatus.COMPLETED);
            when(cascade.reverseRatings(match)).thenReturn(2);

            service.resolveDispute(dispute.getId(),
                    new ResolveDisputeCommand(admin, ResolutionAction.VOID_MATCH, null, "Never played"));

            assertEquals(MatchStatus.VOID, match.getStatus());
            assertEquals(DisputeStatus.RESOLVED, dispute.getStatus());
            verify(cascade).rebuildResults(match);
            verify(cascade).rederive(eq(match.getId()), any(), any(), anyCollection(), eq(true));
        }
    }

    // =========================================================================
    // 1.2 Non-deciding resolutions
    // =========================================================================

    @Nested
    @DisplayName("1.2 Non-deciding resolutions")
    class NonDeciding {

        @Test
        @DisplayName("reject_closesDisputeAndClearsFlags")
        void reject_closesDisputeAndClearsFlags() {
            DisputeResolution result = service.resolveDispute(dispute.getId(),
                    new ResolveDisputeCommand(admin, ResolutionAction.REJECT, null, "No evidence"));

            assertEquals(DisputeStatus.REJECTED, dispute.getStatus());
            assertEquals(MatchStatus.SCHEDULED, match.getStatus());
            assertFalse(match.isDisputed());
            assertFalse(match.isRequiresAdminReview());
            assertFalse(result.rederive());
            assertFalse(recordedAction().isTriggeredRecalculation());
            verifyNoInteractions(cascade);
        }

        @Test
        @DisplayName("requestMoreInfo_movesToUnderReview")
        void requestMoreInfo_movesToUnderReview() {
            service.resolveDispute(dispute.getId(),
                    new ResolveDisputeCommand(admin, ResolutionAction.REQUEST_MORE_INFO, null, "Send a photo"));

            assertEquals(DisputeStatus.UNDER_REVIEW, dispute.getStatus());
            assertEquals(admin, dispute.getReviewedById());
            assertTrue(match.isDisputed());

            ArgumentCaptor<EventBatch> captor = ArgumentCaptor.forClass(EventBatch.class);
            verify(eventDispatcher).dispatch(captor.capture());
            assertTrue(captor.getValue().isEmpty());
        }

        @Test
        @DisplayName("resolve_closedDispute_rejected")
        void resolve_closedDispute_rejected() {
            dispute.setStatus(DisputeStatus.RESOLVED);

            ConflictException ex = assertThrows(ConflictException.class, () -> service.resolveDispute(
                    dispute.getId(), new ResolveDisputeCommand(admin, ResolutionAction.REJECT, null, "again")));

            assertEquals("dispute_closed", ex.getCode());
            verifyNoInteractions(adminActionRepository);
        }

        @Test
        @DisplayName("claim_openDispute_startsReview")
        void claim_openDispute_startsReview() {
            MatchDispute claimed = service.claimDispute(dispute.getId(), admin);

            assertEquals(DisputeStatus.UNDER_REVIEW, claimed.getStatus());
            assertEquals(NOW, claimed.getReviewStartedAt());
        }
    }

    // =========================================================================
    // 1.3 Escalation
    // =========================================================================

    @Nested
    @DisplayName("1.3 Escalation")
    class Escalation {

        @Test
        @DisplayName("staleOpenDispute_escalatedToUrgent")
        void staleOpenDispute_escalatedToUrgent() {
            ReflectionTestUtils.setField(dispute, "createdAt", NOW.minusHours(72));
            when(disputeRepository.findByStatusAndCreatedAtBefore(DisputeStatus.OPEN, NOW.minusHours(48)))
                    .thenReturn(List.of(dispute));

            int escalated = service.escalateStaleDisputes();

            assertEquals(1, escalated);
            assertEquals(DisputePriority.URGENT, dispute.getPriority());
            verify(disputeRepository).save(dispute);

            ArgumentCaptor<EventBatch> captor = ArgumentCaptor.forClass(EventBatch.class);
            verify(eventDispatcher).dispatch(captor.capture());
            assertEquals(List.of(MatchEventType.DISPUTE_ESCALATED),
                    captor.getValue().events().stream().map(MatchEvent::type).toList());
        }

        @Test
        @DisplayName("disputeResolvedSinceScan_isLeftAlone")
        void disputeResolvedSinceScan_isLeftAlone() {
            // The scan saw the dispute OPEN; an admin resolved it before the sweep took the lock
            MatchDispute scanned = new MatchDispute(match.getId(), bob, DisputeCategory.WRONG_SCORE, "Third set was played");
            ReflectionTestUtils.setField(scanned, "id", dispute.getId());
            ReflectionTestUtils.setField(scanned, "createdAt", NOW.minusHours(72));
            scanned.setPriority(DisputePriority.HIGH);
            when(disputeRepository.findByStatusAndCreatedAtBefore(DisputeStatus.OPEN, NOW.minusHours(48)))
                    .thenReturn(List.of(scanned));
            dispute.setStatus(DisputeStatus.RESOLVED);

            assertEquals(0, service.escalateStaleDisputes());

            verify(matchRepository).findByIdForUpdate(match.getId());
            assertEquals(DisputePriority.HIGH, dispute.getPriority());
            verify(disputeRepository, never()).save(any());
            verifyNoInteractions(eventDispatcher);
        }

        @Test
        @DisplayName("alreadyUrgent_isSkipped")
        void alreadyUrgent_isSkipped() {
            dispute.setPriority(DisputePriority.URGENT);
            when(disputeRepository.findByStatusAndCreatedAtBefore(eq(DisputeStatus.OPEN), any()))
                    .thenReturn(List.of(dispute));

            assertEquals(0, service.escalateStaleDisputes());
            verifyNoInteractions(eventDispatcher);
        }
    }
}
