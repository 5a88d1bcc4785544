package com.deuceleague.deuce_api.event;

import com.deuceleague.deuce_api.engine.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Delivers committed events to the notification sink. Delivery is
 * fire-and-forget: one failed event never blocks the rest or the caller.
 */
@Component
public class MatchEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MatchEventDispatcher.class);

    private final NotificationSink notificationSink;

    public MatchEventDispatcher(NotificationSink notificationSink) {
        this.notificationSink = notificationSink;
    }

    public void dispatch(EventBatch batch) {
        for (MatchEvent event : batch.events()) {
            try {
                if (event.type().reachesPlayers() && !event.recipients().isEmpty()) {
                    notificationSink.notifyUsers(event.recipients(), event.type().name(), event.body());
                }
                if (event.type().reachesAdmins()) {
                    notificationSink.notifyAdmins(event.type().name(), event.body());
                }
            } catch (RuntimeException e) {
                log.warn("Delivery of {} for match {} failed: {}", event.type(), event.matchId(), e.getMessage());
            }
        }
    }
}
