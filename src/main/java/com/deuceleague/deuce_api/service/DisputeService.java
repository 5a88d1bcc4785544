package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.event.EventBatch;
import com.deuceleague.deuce_api.event.MatchEvent;
import com.deuceleague.deuce_api.event.MatchEventDispatcher;
import com.deuceleague.deuce_api.event.MatchEventType;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.NotFoundException;
import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.MatchDisputeRepository;
import com.deuceleague.deuce_api.repository.MatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin review of disputed results.
 *
 * A resolution that decides the score completes a match still waiting on its
 * result (ADJUDICATE). On a match that is already COMPLETED the old ratings are
 * reversed first and the status stays COMPLETED (ADMIN_EDIT).
 */
@Service
public class DisputeService {

    private static final Logger log = LoggerFactory.getLogger(DisputeService.class);

    private final MatchRepository matchRepository;
    private final MatchDisputeRepository disputeRepository;
    private final MatchStateMachine stateMachine;
    private final ScoreValidator scoreValidator;
    private final RecalculationCascade cascade;
    private final AdminAuditLog auditLog;
    private final MatchEventDispatcher eventDispatcher;
    private final TransactionTemplate transactionTemplate;
    private final DeuceProperties properties;
    private final Clock clock;

    public DisputeService(MatchRepository matchRepository,
                          MatchDisputeRepository disputeRepository,
                          MatchStateMachine stateMachine,
                          ScoreValidator scoreValidator,
                          RecalculationCascade cascade,
                          AdminAuditLog auditLog,
                          MatchEventDispatcher eventDispatcher,
                          TransactionTemplate transactionTemplate,
                          DeuceProperties properties,
                          Clock clock) {
        this.matchRepository = matchRepository;
        this.disputeRepository = disputeRepository;
        this.stateMachine = stateMachine;
        this.scoreValidator = scoreValidator;
        this.cascade = cascade;
        this.auditLog = auditLog;
        this.eventDispatcher = eventDispatcher;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public MatchDispute get(UUID disputeId) {
        return disputeRepository.findById(disputeId).orElseThrow(() -> new NotFoundException("Dispute", disputeId));
    }

    /** Review queue, oldest first. */
    public List<MatchDispute> listOpen() {
        return disputeRepository.findByStatusInOrderByCreatedAtAsc(MatchResultService.UNRESOLVED);
    }

    public List<MatchDispute> disputesFor(UUID matchId) {
        return disputeRepository.findByMatchIdOrderByCreatedAtDesc(matchId);
    }

    // =========================================================================
    // Claim
    // =========================================================================

    /** OPEN → UNDER_REVIEW. Any other status is returned unchanged. */
    public MatchDispute claimDispute(UUID disputeId, UUID adminId) {
        UUID matchId = get(disputeId).getMatchId();
        return transactionTemplate.execute(status -> {
            lockMatch(matchId);
            MatchDispute dispute = get(disputeId);
            if (dispute.getStatus() == DisputeStatus.OPEN) {
                startReview(dispute, adminId);
                log.info("Dispute {} claimed by admin {}", disputeId, adminId);
            }
            return dispute;
        });
    }

    // =========================================================================
    // Resolve
    // =========================================================================

    public DisputeResolution resolveDispute(UUID disputeId, ResolveDisputeCommand cmd) {
        if (cmd.action() == null) throw ValidationException.missingField("action");
        if (cmd.adminId() == null) throw ValidationException.missingField("adminId");

        UUID matchId = get(disputeId).getMatchId();
        EventBatch events = new EventBatch();

        DisputeResolution resolution = transactionTemplate.execute(status -> {
            Match match = lockMatch(matchId);
            MatchDispute dispute = get(disputeId);
            if (dispute.getStatus().isClosed()) {
                throw ConflictException.disputeClosed(disputeId);
            }

            DisputeStatus oldStatus = dispute.getStatus();
            Map<String, Object> before = AdminAuditLog.resultSnapshot(match);
            before.put("disputeStatus", oldStatus);
            boolean wasCompleted = match.getStatus() == MatchStatus.COMPLETED;
            int reversed = 0;

            switch (cmd.action()) {
                case REQUEST_MORE_INFO -> {
                    if (oldStatus == DisputeStatus.OPEN) startReview(dispute, cmd.adminId());
                    dispute.setAdminResolution(cmd.reason());
                }
                case REJECT -> {
                    close(dispute, DisputeStatus.REJECTED, cmd);
                    clearDisputeFlags(match);
                }
                case UPHOLD_ORIGINAL -> {
                    if (!wasCompleted) {
                        List<SetScore> original = dispute.getDisputedScore();
                        if (original != null && !original.isEmpty()) {
                            MatchResultService.writeScore(match, original);
                        }
                        stateMachine.apply(match, MatchTransition.ADJUDICATE);
                    }
                    close(dispute, DisputeStatus.RESOLVED, cmd);
                    clearDisputeFlags(match);
                }
                case UPHOLD_DISPUTER, CUSTOM_SCORE -> {
                    List<SetScore> score = decidedScore(dispute, cmd);
                    scoreValidator.validateStructure(score);
                    if (wasCompleted) reversed = cascade.reverseRatings(match);
                    MatchResultService.writeScore(match, score);
                    match.setWalkover(false);
                    match.setWalkoverReason(null);
                    stateMachine.apply(match, wasCompleted ? MatchTransition.ADMIN_EDIT : MatchTransition.ADJUDICATE);
                    close(dispute, DisputeStatus.RESOLVED, cmd);
                    dispute.setFinalScore(match.getSetScores());
                    clearDisputeFlags(match);
                }
                case AWARD_WALKOVER -> {
                    MatchTeam winner = cmd.finalScore() != null && !cmd.finalScore().isEmpty()
                            ? ScoreSummary.of(cmd.finalScore()).winner()
                            : match.teamOf(dispute.getRaisedById());
                    if (winner == null) {
                        throw ValidationException.invalidRoster("Cannot tell which side the walkover is awarded to");
                    }
                    if (wasCompleted) reversed = cascade.reverseRatings(match);
                    MatchResultService.writeScore(match, ScoreSummary.walkoverScore(match.getSport(), winner));
                    match.setWalkover(true);
                    match.setWalkoverReason(WalkoverReason.OTHER);
                    stateMachine.apply(match, wasCompleted ? MatchTransition.ADMIN_EDIT : MatchTransition.ADJUDICATE);
                    close(dispute, DisputeStatus.RESOLVED, cmd);
                    dispute.setFinalScore(match.getSetScores());
                    clearDisputeFlags(match);
                }
                case VOID_MATCH -> {
                    if (wasCompleted) reversed = cascade.reverseRatings(match);
                    match.clearPendingResult();
                    match.cancelOpenInvitations(now());
                    stateMachine.apply(match, MatchTransition.DISPUTE_VOID);
                    close(dispute, DisputeStatus.RESOLVED, cmd);
                    clearDisputeFlags(match);
                }
            }

            boolean rederive = cmd.action().changesResult()
                    || (!wasCompleted && match.getStatus() == MatchStatus.COMPLETED);
            if (rederive) {
                cascade.rebuildResults(match);
            }

            Map<String, Object> after = AdminAuditLog.resultSnapshot(match);
            after.put("disputeStatus", dispute.getStatus());
            after.put("action", cmd.action());
            auditLog.record(matchId, cmd.adminId(), AdminActionType.OVERRIDE_DISPUTE, before, after,
                    cmd.reason(), match.getAcceptedUserIds(), cmd.action().changesResult());

            if (dispute.getStatus().isClosed()) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("disputeId", disputeId);
                payload.put("action", cmd.action().name());
                events.add(MatchEvent.of(MatchEventType.DISPUTE_RESOLVED, matchId, match.getParticipantUserIds(), payload));
            }
            return new DisputeResolution(dispute, match, rederive, reversed > 0, null);
        });

        eventDispatcher.dispatch(events);
        log.info("Dispute {} on match {}: {} by admin {}", disputeId, matchId, cmd.action(), cmd.adminId());

        if (!resolution.rederive()) return resolution;
        Match match = resolution.match();
        RecalculationReport report = cascade.rederive(matchId, match.getDivisionId(), match.getSeasonId(),
                match.getAcceptedUserIds(), resolution.ratingsReversed());
        return resolution.withReport(report);
    }

    // =========================================================================
    // Escalation
    // =========================================================================

    /**
     * Raises every OPEN dispute older than the escalation window to URGENT.
     * Each candidate is re-read under its match lock, so a dispute claimed or
     * resolved since the scan is left alone.
     *
     * @return number of disputes escalated
     */
    public int escalateStaleDisputes() {
        LocalDateTime cutoff = now().minusHours(properties.getDisputes().getEscalationHours());
        int escalated = 0;

        for (MatchDispute candidate : disputeRepository.findByStatusAndCreatedAtBefore(DisputeStatus.OPEN, cutoff)) {
            if (candidate.getPriority() == DisputePriority.URGENT) continue;
            UUID disputeId = candidate.getId();
            EventBatch events = new EventBatch();
            try {
                Boolean raised = transactionTemplate.execute(status -> {
                    lockMatch(candidate.getMatchId());
                    MatchDispute dispute = get(disputeId);
                    if (dispute.getStatus() != DisputeStatus.OPEN || dispute.getPriority() == DisputePriority.URGENT) {
                        return false;
                    }
                    dispute.setPriority(DisputePriority.URGENT);
                    disputeRepository.save(dispute);
                    events.add(MatchEvent.of(MatchEventType.DISPUTE_ESCALATED, dispute.getMatchId(), List.of(),
                            Map.of("disputeId", disputeId, "openedAt", String.valueOf(dispute.getCreatedAt()))));
                    return true;
                });
                if (Boolean.TRUE.equals(raised)) {
                    eventDispatcher.dispatch(events);
                    escalated++;
                } else {
                    log.debug("Dispute {} changed since the escalation scan, skipped", disputeId);
                }
            } catch (RuntimeException e) {
                log.error("Escalation failed for dispute {}: {}", disputeId, e.getMessage(), e);
            }
        }
        if (escalated > 0) {
            log.warn("Escalated {} dispute(s) open for more than {}h", escalated,
                    properties.getDisputes().getEscalationHours());
        }
        return escalated;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private List<SetScore> decidedScore(MatchDispute dispute, ResolveDisputeCommand cmd) {
        if (cmd.finalScore() != null && !cmd.finalScore().isEmpty()) return cmd.finalScore();
        if (cmd.action() == ResolutionAction.UPHOLD_DISPUTER
                && dispute.getDisputerScore() != null && !dispute.getDisputerScore().isEmpty()) {
            return dispute.getDisputerScore();
        }
        throw ValidationException.missingField("finalScore");
    }

    private void startReview(MatchDispute dispute, UUID adminId) {
        dispute.setStatus(DisputeStatus.UNDER_REVIEW);
        dispute.setReviewedById(adminId);
        dispute.setReviewStartedAt(now());
    }

    private void close(MatchDispute dispute, DisputeStatus terminal, ResolveDisputeCommand cmd) {
        dispute.setStatus(terminal);
        dispute.setResolutionAction(cmd.action());
        dispute.setResolvedById(cmd.adminId());
        dispute.setResolvedAt(now());
        dispute.setAdminResolution(cmd.reason());
    }

    private static void clearDisputeFlags(Match match) {
        match.setDisputed(false);
        match.setRequiresAdminReview(false);
    }

    private Match lockMatch(UUID matchId) {
        return matchRepository.findByIdForUpdate(matchId).orElseThrow(() -> new NotFoundException("Match", matchId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    // =========================================================================
    // Commands / results
    // =========================================================================

    public record ResolveDisputeCommand(UUID adminId, ResolutionAction action, List<SetScore> finalScore, String reason) {}

    public record DisputeResolution(
            MatchDispute dispute,
            Match match,
            boolean rederive,
            boolean ratingsReversed,
            RecalculationReport report
    ) {
        DisputeResolution withReport(RecalculationReport report) {
            return new DisputeResolution(dispute, match, rederive, ratingsReversed, report);
        }
    }
}
