package com.deuceleague.deuce_api.event;

import com.deuceleague.deuce_api.engine.NotificationSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MatchEventDispatcherTest {

    @Mock private NotificationSink notificationSink;

    private MatchEventDispatcher dispatcher;

    private final UUID matchId = UUID.randomUUID();
    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        dispatcher = new MatchEventDispatcher(notificationSink);
    }

    @Test
    @DisplayName("playerEvent_goesToRecipientsOnly")
    void playerEvent_goesToRecipientsOnly() {
        EventBatch batch = new EventBatch();
        batch.add(MatchEvent.of(MatchEventType.RESULT_SUBMITTED, matchId, List.of(bob), Map.of("submittedBy", alice)));

        dispatcher.dispatch(batch);

        verify(notificationSink).notifyUsers(eq(Set.of(bob)), eq("RESULT_SUBMITTED"),
                argThat(body -> body.get("matchId").equals(matchId) && body.get("submittedBy").equals(alice)));
        verify(notificationSink, never()).notifyAdmins(any(), any());
    }

    @Test
    @DisplayName("disputeOpened_reachesPlayersAndAdmins")
    void disputeOpened_reachesPlayersAndAdmins() {
        EventBatch batch = new EventBatch();
        batch.add(MatchEvent.of(MatchEventType.DISPUTE_OPENED, matchId, List.of(alice, bob)));

        dispatcher.dispatch(batch);

        verify(notificationSink).notifyUsers(eq(Set.of(alice, bob)), eq("DISPUTE_OPENED"), anyMap());
        verify(notificationSink).notifyAdmins(eq("DISPUTE_OPENED"), anyMap());
    }

    @Test
    @DisplayName("adminEvent_skipsPlayers")
    void adminEvent_skipsPlayers() {
        EventBatch batch = new EventBatch();
        batch.add(MatchEvent.of(MatchEventType.LATE_CANCELLATION_REVIEW, matchId, List.of(alice)));

        dispatcher.dispatch(batch);

        verify(notificationSink, never()).notifyUsers(any(), any(), any());
        verify(notificationSink).notifyAdmins(eq("LATE_CANCELLATION_REVIEW"), anyMap());
    }

    @Test
    @DisplayName("failedDelivery_doesNotBlockLaterEvents")
    void failedDelivery_doesNotBlockLaterEvents() {
        doThrow(new IllegalStateException("broker down"))
                .when(notificationSink).notifyUsers(eq(Set.of(alice)), eq("INVITATION_SENT"), anyMap());
        EventBatch batch = new EventBatch();
        batch.add(MatchEvent.of(MatchEventType.INVITATION_SENT, matchId, List.of(alice)));
        batch.add(MatchEvent.of(MatchEventType.INVITATION_ACCEPTED, matchId, List.of(bob)));

        assertDoesNotThrow(() -> dispatcher.dispatch(batch));

        verify(notificationSink).notifyUsers(eq(Set.of(bob)), eq("INVITATION_ACCEPTED"), anyMap());
    }

    @Test
    @DisplayName("emptyBatch_sendsNothing")
    void emptyBatch_sendsNothing() {
        dispatcher.dispatch(new EventBatch());

        verifyNoInteractions(notificationSink);
    }
}
