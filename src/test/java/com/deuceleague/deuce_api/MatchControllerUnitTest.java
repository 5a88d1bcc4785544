package com.deuceleague.deuce_api;

import com.deuceleague.deuce_api.controller.MatchController;
import com.deuceleague.deuce_api.controller.MatchController.*;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.service.DisputeService;
import com.deuceleague.deuce_api.service.MatchQueryService;
import com.deuceleague.deuce_api.service.MatchQueryService.MatchView;
import com.deuceleague.deuce_api.service.MatchResultService;
import com.deuceleague.deuce_api.service.MatchSchedulingService;
import com.deuceleague.deuce_api.service.MatchSchedulingService.CreateMatchCommand;
import com.deuceleague.util.TestFixtures;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Request mapping of MatchController in isolation:
 * no HTTP, no WebSocket, no DB.
 */
@ExtendWith(MockitoExtension.class)
class MatchControllerUnitTest {

    @Mock private MatchSchedulingService schedulingService;
    @Mock private MatchResultService resultService;
    @Mock private DisputeService disputeService;
    @Mock private MatchQueryService queryService;

    private MatchController controller;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private Match match;

    @BeforeEach
    void setUp() {
        controller = new MatchController(schedulingService, resultService, disputeService, queryService);
        match = TestFixtures.buildSinglesMatch(alice, bob, MatchStatus.SCHEDULED);
        lenient().when(queryService.view(match.getId())).thenReturn(MatchView.from(match));
    }

    // =========================================================================
    // 1.1 Setup
    // =========================================================================

    @Nested
    @DisplayName("1.1 Setup")
    class Setup {

        @Test
        @DisplayName("createMatch_withoutSetup_usesEmptySetupAndReturns201")
        void createMatch_withoutSetup_usesEmptySetupAndReturns201() {
            when(schedulingService.createMatch(any())).thenReturn(match);

            ResponseEntity<MatchView> response = controller.createMatch(new CreateMatchRequest(alice,
                    TestFixtures.DIVISION_ID, TestFixtures.SEASON_ID, SportType.TENNIS, MatchType.SINGLES,
                    null, null, null));

            assertEquals(HttpStatus.CREATED, response.getStatusCode());
            assertEquals(match.getId(), response.getBody().id());

            ArgumentCaptor<CreateMatchCommand> captor = ArgumentCaptor.forClass(CreateMatchCommand.class);
            verify(schedulingService).createMatch(captor.capture());
            assertEquals(MatchSchedulingService.InvitationSetup.none(), captor.getValue().setup());
            assertEquals(alice, captor.getValue().creatorId());
        }

        @Test
        @DisplayName("join_delegatesAndReturnsFreshView")
        void join_delegatesAndReturnsFreshView() {
            ResponseEntity<MatchView> response = controller.joinMatch(match.getId(), new JoinRequest(bob, false));

            assertEquals(HttpStatus.OK, response.getStatusCode());
            verify(schedulingService).joinMatch(match.getId(), bob, false);
            verify(queryService).view(match.getId());
        }
    }

    // =========================================================================
    // 1.2 Results
    // =========================================================================

    @Nested
    @DisplayName("1.2 Results")
    class Results {

        @Test
        @DisplayName("submitResult_passesScoresThrough")
        void submitResult_passesScoresThrough() {
            controller.submitResult(match.getId(),
                    new SubmitResultRequest(alice, TestFixtures.straightSets(), false));

            verify(resultService).submitResult(eq(match.getId()), argThat(cmd -> cmd.submitterId().equals(alice)
                    && cmd.scores().equals(TestFixtures.straightSets())
                    && !cmd.unfinished()));
        }

        @Test
        @DisplayName("deny_carriesDisputeFields")
        void deny_carriesDisputeFields() {
            controller.confirmResult(match.getId(), new ConfirmResultRequest(bob, false, "Wrong score",
                    DisputeCategory.WRONG_SCORE, null, "https://img.example/scorecard.jpg"));

            verify(resultService).confirmResult(eq(match.getId()), argThat(cmd -> !cmd.confirmed()
                    && cmd.category() == DisputeCategory.WRONG_SCORE
                    && cmd.evidenceUrl().endsWith("scorecard.jpg")));
        }

        @Test
        @DisplayName("raiseDispute_returns201WithDispute")
        void raiseDispute_returns201WithDispute() {
            MatchDispute dispute = new MatchDispute(match.getId(), bob, DisputeCategory.BEHAVIOR, "Abusive");
            when(resultService.raiseDispute(eq(match.getId()), any())).thenReturn(dispute);

            ResponseEntity<MatchDispute> response = controller.raiseDispute(match.getId(),
                    new RaiseDisputeRequest(bob, DisputeCategory.BEHAVIOR, "Abusive", null, null));

            assertEquals(HttpStatus.CREATED, response.getStatusCode());
            assertSame(dispute, response.getBody());
        }

        @Test
        @DisplayName("walkover_delegates")
        void walkover_delegates() {
            controller.submitWalkover(match.getId(), new WalkoverRequest(alice, bob, WalkoverReason.NO_SHOW, null));

            verify(resultService).submitWalkover(eq(match.getId()),
                    argThat(cmd -> cmd.defaultingUserId().equals(bob) && cmd.reason() == WalkoverReason.NO_SHOW));
        }
    }
}
