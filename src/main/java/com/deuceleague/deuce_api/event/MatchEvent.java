package com.deuceleague.deuce_api.event;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Something that happened to a match, delivered only after its transaction commits.
 */
public record MatchEvent(
        MatchEventType type,
        UUID matchId,
        Set<UUID> recipients,
        Map<String, Object> payload
) {
    public static MatchEvent of(MatchEventType type, UUID matchId, Collection<UUID> recipients) {
        return new MatchEvent(type, matchId, Set.copyOf(recipients), Map.of());
    }

    public static MatchEvent of(MatchEventType type, UUID matchId, Collection<UUID> recipients,
                                Map<String, Object> payload) {
        return new MatchEvent(type, matchId, Set.copyOf(recipients), payload);
    }

    /** Payload as sent over the wire: type and match id included. */
    public Map<String, Object> body() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type.name());
        body.put("matchId", matchId);
        body.putAll(payload);
        return body;
    }
}
