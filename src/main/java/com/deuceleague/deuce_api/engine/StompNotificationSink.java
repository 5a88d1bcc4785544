package com.deuceleague.deuce_api.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Pushes match events over STOMP: players on their user queue, league
 * administrators on a shared topic.
 */
@Component
public class StompNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(StompNotificationSink.class);

    static final String USER_QUEUE = "/queue/match-updates";
    static final String ADMIN_TOPIC = "/topic/admin/match-reviews";

    private final SimpMessagingTemplate messagingTemplate;

    public StompNotificationSink(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void notifyUsers(Set<UUID> userIds, String kind, Map<String, Object> payload) {
        for (UUID userId : userIds) {
            messagingTemplate.convertAndSendToUser(userId.toString(), USER_QUEUE, payload);
        }
        log.debug("Sent {} to {} user(s)", kind, userIds.size());
    }

    @Override
    public void notifyAdmins(String kind, Map<String, Object> payload) {
        messagingTemplate.convertAndSend(ADMIN_TOPIC, payload);
        log.debug("Sent {} to admin topic", kind);
    }
}
