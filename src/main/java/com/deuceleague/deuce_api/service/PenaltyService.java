package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.event.EventBatch;
import com.deuceleague.deuce_api.event.MatchEvent;
import com.deuceleague.deuce_api.event.MatchEventDispatcher;
import com.deuceleague.deuce_api.event.MatchEventType;
import com.deuceleague.deuce_api.exception.AuthorizationException;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.NotFoundException;
import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.PenaltyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class PenaltyService {

    private static final Logger log = LoggerFactory.getLogger(PenaltyService.class);

    private final PenaltyRepository penaltyRepository;
    private final AdminAuditLog auditLog;
    private final MatchEventDispatcher eventDispatcher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public PenaltyService(PenaltyRepository penaltyRepository,
                          AdminAuditLog auditLog,
                          MatchEventDispatcher eventDispatcher,
                          TransactionTemplate transactionTemplate,
                          Clock clock) {
        this.penaltyRepository = penaltyRepository;
        this.auditLog = auditLog;
        this.eventDispatcher = eventDispatcher;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    // =========================================================================
    // Apply
    // =========================================================================

    public Penalty applyPenalty(PenaltyCommand cmd) {
        EventBatch events = new EventBatch();
        Penalty penalty = transactionTemplate.execute(status -> {
            Penalty p = issue(cmd, events);
            if (cmd.relatedMatchId() != null && cmd.adminId() != null) {
                Map<String, Object> snapshot = new HashMap<>();
                snapshot.put("penaltyType", p.getPenaltyType().name());
                snapshot.put("severity", p.getSeverity().name());
                auditLog.record(cmd.relatedMatchId(), cmd.adminId(), AdminActionType.APPLY_PENALTY,
                        null, snapshot, cmd.reason(), List.of(cmd.userId()), false);
            }
            return p;
        });
        eventDispatcher.dispatch(events);
        return penalty;
    }

    /**
     * Creates the penalty inside the caller's transaction. The notification is
     * queued on {@code events} for delivery after commit.
     */
    Penalty issue(PenaltyCommand cmd, EventBatch events) {
        if (cmd.userId() == null) throw ValidationException.missingField("userId");
        if (cmd.penaltyType() == null) throw ValidationException.missingField("penaltyType");
        if (cmd.reason() == null || cmd.reason().isBlank()) throw ValidationException.missingField("reason");

        PenaltySeverity severity = cmd.severity() != null ? cmd.severity() : defaultSeverity(cmd.penaltyType());
        Penalty penalty = new Penalty(cmd.userId(), cmd.penaltyType(), severity, cmd.reason());
        penalty.setRelatedMatchId(cmd.relatedMatchId());
        penalty.setRelatedDisputeId(cmd.relatedDisputeId());
        penalty.setIssuedByAdminId(cmd.adminId());
        penalty.setEvidenceUrl(cmd.evidenceUrl());

        if (cmd.pointsDeducted() != null) {
            if (cmd.pointsDeducted() <= 0) {
                throw new ValidationException("invalid_penalty", "pointsDeducted must be positive");
            }
            penalty.setPointsDeducted(cmd.pointsDeducted());
        } else if (cmd.penaltyType() == PenaltyType.POINTS_DEDUCTION) {
            throw ValidationException.missingField("pointsDeducted");
        }

        if (cmd.suspensionDays() != null) {
            if (cmd.suspensionDays() <= 0) {
                throw new ValidationException("invalid_penalty", "suspensionDays must be positive");
            }
            LocalDateTime now = now();
            penalty.setSuspensionDays(cmd.suspensionDays());
            penalty.setSuspensionStart(now);
            penalty.setSuspensionEnd(now.plusDays(cmd.suspensionDays()));
            penalty.setExpiresAt(penalty.getSuspensionEnd());
        } else if (cmd.penaltyType() == PenaltyType.SUSPENSION) {
            throw ValidationException.missingField("suspensionDays");
        }

        penaltyRepository.save(penalty);
        MatchEventType type = cmd.adminId() == null && cmd.penaltyType() == PenaltyType.WARNING
                ? MatchEventType.DISCIPLINARY_WARNING_ISSUED
                : MatchEventType.PENALTY_APPLIED;
        events.add(MatchEvent.of(type, cmd.relatedMatchId(), List.of(cmd.userId()),
                Map.of("penaltyType", penalty.getPenaltyType().name(), "reason", penalty.getReason())));

        log.info("Penalty {} ({}/{}) issued to {}", penalty.getId(), penalty.getPenaltyType(), severity, cmd.userId());
        return penalty;
    }

    private static PenaltySeverity defaultSeverity(PenaltyType type) {
        return switch (type) {
            case WARNING -> PenaltySeverity.WARNING;
            case POINTS_DEDUCTION -> PenaltySeverity.POINTS_DEDUCTION;
            case SUSPENSION -> PenaltySeverity.SUSPENSION;
        };
    }

    // =========================================================================
    // Appeals
    // =========================================================================

    public Penalty submitAppeal(UUID penaltyId, UUID userId, String reason) {
        if (reason == null || reason.isBlank()) throw ValidationException.missingField("reason");

        return transactionTemplate.execute(status -> {
            Penalty penalty = load(penaltyId);
            if (!penalty.getUserId().equals(userId)) {
                throw AuthorizationException.notAllowed("Only the penalised player can appeal");
            }
            if (penalty.effectiveStatus(now()) != PenaltyStatus.ACTIVE) {
                throw ConflictException.invalidState("Penalty " + penaltyId + " cannot be appealed");
            }
            penalty.setStatus(PenaltyStatus.APPEALED);
            penalty.setAppealSubmittedAt(now());
            penalty.setAppealReason(reason);
            log.info("Penalty {} appealed by {}", penaltyId, userId);
            return penalty;
        });
    }

    /**
     * @param overturn true voids the penalty; false upholds it and returns it to ACTIVE
     */
    public Penalty resolveAppeal(UUID penaltyId, UUID adminId, boolean overturn, String notes) {
        EventBatch events = new EventBatch();
        Penalty result = transactionTemplate.execute(status -> {
            Penalty penalty = load(penaltyId);
            if (penalty.getStatus() != PenaltyStatus.APPEALED) {
                throw ConflictException.invalidState("Penalty " + penaltyId + " has no pending appeal");
            }
            penalty.setStatus(overturn ? PenaltyStatus.OVERTURNED : PenaltyStatus.ACTIVE);
            penalty.setAppealResolvedBy(adminId);
            penalty.setAppealResolvedAt(now());
            penalty.setAppealResolutionNotes(notes);
            events.add(MatchEvent.of(MatchEventType.APPEAL_RESOLVED, penalty.getRelatedMatchId(),
                    List.of(penalty.getUserId()), Map.of("overturned", overturn)));
            return penalty;
        });
        eventDispatcher.dispatch(events);
        log.info("Appeal on penalty {} {} by {}", penaltyId, overturn ? "overturned" : "upheld", adminId);
        return result;
    }

    // =========================================================================
    // Queries & sweep
    // =========================================================================

    public List<Penalty> penaltiesFor(UUID userId) {
        return penaltyRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /** @return number of penalties moved to EXPIRED */
    public int expirePenalties() {
        Integer count = transactionTemplate.execute(status -> {
            List<Penalty> due = penaltyRepository.findByStatusInAndExpiresAtLessThanEqual(
                    EnumSet.of(PenaltyStatus.ACTIVE, PenaltyStatus.APPEALED), now());
            due.forEach(p -> p.setStatus(PenaltyStatus.EXPIRED));
            return due.size();
        });
        return count == null ? 0 : count;
    }

    private Penalty load(UUID penaltyId) {
        return penaltyRepository.findById(penaltyId).orElseThrow(() -> new NotFoundException("Penalty", penaltyId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public record PenaltyCommand(
            UUID userId,
            UUID adminId,
            PenaltyType penaltyType,
            PenaltySeverity severity,
            UUID relatedMatchId,
            UUID relatedDisputeId,
            Integer pointsDeducted,
            Integer suspensionDays,
            String reason,
            String evidenceUrl
    ) {
        public static PenaltyCommand systemWarning(UUID userId, UUID matchId, String reason) {
            return new PenaltyCommand(userId, null, PenaltyType.WARNING, PenaltySeverity.WARNING,
                    matchId, null, null, null, reason, null);
        }
    }
}
