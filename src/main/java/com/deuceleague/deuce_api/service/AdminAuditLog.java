package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.model.AdminAction;
import com.deuceleague.deuce_api.model.AdminActionType;
import com.deuceleague.deuce_api.model.Match;
import com.deuceleague.deuce_api.model.SetScore;
import com.deuceleague.deuce_api.repository.AdminActionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes {@link AdminAction} rows. Must be called inside the transaction of the
 * change being documented so the two commit or roll back together.
 */
@Component
public class AdminAuditLog {

    private static final Logger log = LoggerFactory.getLogger(AdminAuditLog.class);

    private final AdminActionRepository adminActionRepository;
    private final ObjectMapper objectMapper;

    public AdminAuditLog(AdminActionRepository adminActionRepository, ObjectMapper objectMapper) {
        this.adminActionRepository = adminActionRepository;
        this.objectMapper = objectMapper;
    }

    public AdminAction record(UUID matchId, UUID adminId, AdminActionType type,
                              Map<String, Object> oldValue, Map<String, Object> newValue,
                              String reason, Collection<UUID> affectedUserIds,
                              boolean triggeredRecalculation) {
        AdminAction action = new AdminAction(matchId, adminId, type,
                toJson(oldValue), toJson(newValue), reason,
                List.copyOf(affectedUserIds), triggeredRecalculation);
        adminActionRepository.save(action);
        log.info("Admin {} performed {} on match {} (recalculation={})", adminId, type, matchId, triggeredRecalculation);
        return action;
    }

    /** Score-bearing fields of a match, for the old/new value columns. */
    public static Map<String, Object> resultSnapshot(Match match) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("status", match.getStatus());
        snapshot.put("scores", match.getSetScores().stream().map(SetScore::toString).toList());
        snapshot.put("team1Score", match.getTeam1Score());
        snapshot.put("team2Score", match.getTeam2Score());
        snapshot.put("outcome", match.getOutcome());
        snapshot.put("walkover", match.isWalkover());
        return snapshot;
    }

    public List<AdminAction> historyFor(UUID matchId) {
        return adminActionRepository.findByMatchIdOrderByCreatedAtDesc(matchId);
    }

    private String toJson(Map<String, Object> snapshot) {
        if (snapshot == null) return null;
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit snapshot could not be serialized", e);
        }
    }
}
