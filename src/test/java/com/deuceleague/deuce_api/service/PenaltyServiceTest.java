package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.event.EventBatch;
import com.deuceleague.deuce_api.event.MatchEvent;
import com.deuceleague.deuce_api.event.MatchEventDispatcher;
import com.deuceleague.deuce_api.event.MatchEventType;
import com.deuceleague.deuce_api.exception.AuthorizationException;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.AdminActionRepository;
import com.deuceleague.deuce_api.repository.PenaltyRepository;
import com.deuceleague.deuce_api.service.PenaltyService.PenaltyCommand;
import com.deuceleague.util.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.deuceleague.util.TestFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PenaltyServiceTest {

    @Mock private PenaltyRepository penaltyRepository;
    @Mock private AdminActionRepository adminActionRepository;
    @Mock private MatchEventDispatcher eventDispatcher;

    private PenaltyService service;

    private final UUID player = UUID.randomUUID();
    private final UUID admin = UUID.randomUUID();
    private final UUID matchId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new PenaltyService(penaltyRepository, new AdminAuditLog(adminActionRepository, new ObjectMapper()),
                eventDispatcher, TestFixtures.transactionTemplate(), TestFixtures.FIXED_CLOCK);
    }

    private static PenaltyCommand command(UUID userId, UUID adminId, PenaltyType type, UUID matchId,
                                          Integer points, Integer days) {
        return new PenaltyCommand(userId, adminId, type, null, matchId, null, points, days, "Repeated no-shows", null);
    }

    private Penalty stored(PenaltyStatus status) {
        Penalty penalty = TestFixtures.withId(new Penalty(player, PenaltyType.WARNING, PenaltySeverity.WARNING, "Late"));
        penalty.setStatus(status);
        when(penaltyRepository.findById(penalty.getId())).thenReturn(Optional.of(penalty));
        return penalty;
    }

    // =========================================================================
    // 1.1 Apply
    // =========================================================================

    @Nested
    @DisplayName("1.1 Apply")
    class Apply {

        @Test
        @DisplayName("suspension_setsWindowAndAudits")
        void suspension_setsWindowAndAudits() {
            Penalty penalty = service.applyPenalty(command(player, admin, PenaltyType.SUSPENSION, matchId, null, 7));

            assertEquals(PenaltySeverity.SUSPENSION, penalty.getSeverity());
            assertEquals(NOW, penalty.getSuspensionStart());
            assertEquals(NOW.plusDays(7), penalty.getSuspensionEnd());
            assertEquals(NOW.plusDays(7), penalty.getExpiresAt());
            assertEquals(admin, penalty.getIssuedByAdminId());
            verify(penaltyRepository).save(penalty);

            ArgumentCaptor<AdminAction> audit = ArgumentCaptor.forClass(AdminAction.class);
            verify(adminActionRepository).save(audit.capture());
            assertEquals(AdminActionType.APPLY_PENALTY, audit.getValue().getActionType());

            ArgumentCaptor<EventBatch> events = ArgumentCaptor.forClass(EventBatch.class);
            verify(eventDispatcher).dispatch(events.capture());
            assertEquals(List.of(MatchEventType.PENALTY_APPLIED),
                    events.getValue().events().stream().map(MatchEvent::type).toList());
        }

        @Test
        @DisplayName("pointsDeduction_withoutPoints_rejected")
        void pointsDeduction_withoutPoints_rejected() {
            ValidationException ex = assertThrows(ValidationException.class,
                    () -> service.applyPenalty(command(player, admin, PenaltyType.POINTS_DEDUCTION, null, null, null)));

            assertEquals("missing_field", ex.getCode());
            verifyNoInteractions(penaltyRepository);
        }

        @Test
        @DisplayName("negativePoints_rejected")
        void negativePoints_rejected() {
            assertThrows(ValidationException.class,
                    () -> service.applyPenalty(command(player, admin, PenaltyType.POINTS_DEDUCTION, null, -2, null)));
        }

        @Test
        @DisplayName("penaltyWithoutMatch_isNotAudited")
        void penaltyWithoutMatch_isNotAudited() {
            service.applyPenalty(command(player, admin, PenaltyType.WARNING, null, null, null));

            verifyNoInteractions(adminActionRepository);
        }

        @Test
        @DisplayName("systemWarning_emitsDisciplinaryWarning")
        void systemWarning_emitsDisciplinaryWarning() {
            EventBatch events = new EventBatch();

            Penalty penalty = service.issue(PenaltyCommand.systemWarning(player, matchId, "No-show"), events);

            assertNull(penalty.getIssuedByAdminId());
            assertEquals(matchId, penalty.getRelatedMatchId());
            assertEquals(MatchEventType.DISCIPLINARY_WARNING_ISSUED, events.events().get(0).type());
            assertEquals(Set.of(player), events.events().get(0).recipients());
        }
    }

    // =========================================================================
    // 1.2 Appeals and expiry
    // =========================================================================

    @Nested
    @DisplayName("1.2 Appeals and expiry")
    class Appeals {

        @Test
        @DisplayName("appeal_byPenalisedPlayer_movesToAppealed")
        void appeal_byPenalisedPlayer_movesToAppealed() {
            Penalty penalty = stored(PenaltyStatus.ACTIVE);

            service.submitAppeal(penalty.getId(), player, "I was injured");

            assertEquals(PenaltyStatus.APPEALED, penalty.getStatus());
            assertEquals(NOW, penalty.getAppealSubmittedAt());
        }

        @Test
        @DisplayName("appeal_bySomeoneElse_rejected")
        void appeal_bySomeoneElse_rejected() {
            Penalty penalty = stored(PenaltyStatus.ACTIVE);

            assertThrows(AuthorizationException.class,
                    () -> service.submitAppeal(penalty.getId(), UUID.randomUUID(), "Not fair"));
        }

        @Test
        @DisplayName("appeal_onExpiredPenalty_rejected")
        void appeal_onExpiredPenalty_rejected() {
            Penalty penalty = stored(PenaltyStatus.ACTIVE);
            penalty.setExpiresAt(NOW.minusDays(1));

            assertThrows(ConflictException.class, () -> service.submitAppeal(penalty.getId(), player, "Too late"));
        }

        @Test
        @DisplayName("overturn_voidsPenaltyAndNotifies")
        void overturn_voidsPenaltyAndNotifies() {
            Penalty penalty = stored(PenaltyStatus.APPEALED);

            service.resolveAppeal(penalty.getId(), admin, true, "Medical note provided");

            assertEquals(PenaltyStatus.OVERTURNED, penalty.getStatus());
            assertEquals(admin, penalty.getAppealResolvedBy());
            verify(eventDispatcher).dispatch(argThat(batch -> batch.events().size() == 1
                    && batch.events().get(0).type() == MatchEventType.APPEAL_RESOLVED));
        }

        @Test
        @DisplayName("resolve_withoutPendingAppeal_rejected")
        void resolve_withoutPendingAppeal_rejected() {
            Penalty penalty = stored(PenaltyStatus.ACTIVE);

            assertThrows(ConflictException.class, () -> service.resolveAppeal(penalty.getId(), admin, false, null));
        }

        @Test
        @DisplayName("sweep_expiresDuePenalties")
        void sweep_expiresDuePenalties() {
            Penalty due = TestFixtures.withId(new Penalty(player, PenaltyType.SUSPENSION, PenaltySeverity.SUSPENSION, "x"));
            when(penaltyRepository.findByStatusInAndExpiresAtLessThanEqual(anyCollection(), eq(NOW)))
                    .thenReturn(List.of(due));

            assertEquals(1, service.expirePenalties());
            assertEquals(PenaltyStatus.EXPIRED, due.getStatus());
        }
    }
}
