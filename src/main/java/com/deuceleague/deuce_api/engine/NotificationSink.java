package com.deuceleague.deuce_api.engine;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Outbound notification channel. Implementations may fail; callers treat
 * delivery as best-effort.
 */
public interface NotificationSink {

    void notifyUsers(Set<UUID> userIds, String kind, Map<String, Object> payload);

    void notifyAdmins(String kind, Map<String, Object> payload);
}
