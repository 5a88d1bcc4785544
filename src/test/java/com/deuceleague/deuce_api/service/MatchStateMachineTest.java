package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.exception.AuthorizationException;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.util.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MatchStateMachineTest {

    private final MatchStateMachine stateMachine = new MatchStateMachine();

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final UUID carol = UUID.randomUUID();
    private final UUID dave = UUID.randomUUID();

    @Test
    @DisplayName("apply_legalTransition_movesToTarget")
    void apply_legalTransition_movesToTarget() {
        Match match = TestFixtures.buildSinglesMatch(alice, bob, MatchStatus.SCHEDULED);

        stateMachine.apply(match, MatchTransition.SUBMIT_FOR_CONFIRMATION);

        assertEquals(MatchStatus.ONGOING, match.getStatus());
    }

    @Test
    @DisplayName("apply_illegalTransition_throwsAndKeepsStatus")
    void apply_illegalTransition_throwsAndKeepsStatus() {
        Match match = TestFixtures.buildSinglesMatch(alice, bob, MatchStatus.DRAFT);

        ConflictException ex = assertThrows(ConflictException.class,
                () -> stateMachine.apply(match, MatchTransition.CONFIRM));

        assertEquals("illegal_transition", ex.getCode());
        assertEquals(MatchStatus.DRAFT, match.getStatus());
    }

    @Test
    @DisplayName("apply_doublesWithThreeAccepted_cannotComplete")
    void apply_doublesWithThreeAccepted_cannotComplete() {
        Match match = TestFixtures.buildDoublesMatch(List.of(alice, bob), List.of(carol, dave), MatchStatus.ONGOING);
        match.findParticipant(dave).orElseThrow().setInvitationStatus(InvitationStatus.PENDING);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> stateMachine.apply(match, MatchTransition.CONFIRM));

        assertEquals("invalid_roster", ex.getCode());
        assertEquals(MatchStatus.ONGOING, match.getStatus());
    }

    @Test
    @DisplayName("apply_doublesWithFullRoster_completes")
    void apply_doublesWithFullRoster_completes() {
        Match match = TestFixtures.buildDoublesMatch(List.of(alice, bob), List.of(carol, dave), MatchStatus.ONGOING);

        stateMachine.apply(match, MatchTransition.CONFIRM);

        assertEquals(MatchStatus.COMPLETED, match.getStatus());
    }

    @Test
    @DisplayName("apply_nonCompletingTransition_ignoresRoster")
    void apply_nonCompletingTransition_ignoresRoster() {
        Match match = TestFixtures.buildSinglesMatch(alice, null, MatchStatus.SCHEDULED);

        stateMachine.apply(match, MatchTransition.CANCEL);

        assertEquals(MatchStatus.CANCELLED, match.getStatus());
    }

    @Test
    @DisplayName("requireAcceptedParticipant_rejectsPendingInvitee")
    void requireAcceptedParticipant_rejectsPendingInvitee() {
        Match match = TestFixtures.buildSinglesMatch(alice, bob, MatchStatus.SCHEDULED);
        match.findParticipant(bob).orElseThrow().setInvitationStatus(InvitationStatus.PENDING);

        assertThrows(AuthorizationException.class, () -> stateMachine.requireAcceptedParticipant(match, bob));
        assertDoesNotThrow(() -> stateMachine.requireAcceptedParticipant(match, alice));
    }
}
