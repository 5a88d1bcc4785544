package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Background sweeps. Each sweep works one match (or task) per transaction, so a
 * failure in one leaves the rest of the batch to commit.
 */
@Service
public class LeagueMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(LeagueMaintenanceScheduler.class);

    private final DeuceProperties properties;
    private final InvitationService invitationService;
    private final DisputeService disputeService;
    private final MatchResultService matchResultService;
    private final RecalculationCascade recalculationCascade;
    private final PenaltyService penaltyService;

    public LeagueMaintenanceScheduler(DeuceProperties properties,
                                      InvitationService invitationService,
                                      DisputeService disputeService,
                                      MatchResultService matchResultService,
                                      RecalculationCascade recalculationCascade,
                                      PenaltyService penaltyService) {
        this.properties = properties;
        this.invitationService = invitationService;
        this.disputeService = disputeService;
        this.matchResultService = matchResultService;
        this.recalculationCascade = recalculationCascade;
        this.penaltyService = penaltyService;
    }

    @Scheduled(
            fixedDelayString = "${deuce.worker.invitation-sweep-ms:60000}",
            initialDelayString = "${deuce.worker.initial-delay-ms:30000}"
    )
    public void expireInvitations() {
        if (!properties.getWorker().isEnabled()) return;
        int expired = invitationService.expireOverdueInvitations();
        report("invitation sweep", "expired", expired);
    }

    @Scheduled(
            fixedDelayString = "${deuce.worker.dispute-escalation-ms:600000}",
            initialDelayString = "${deuce.worker.initial-delay-ms:30000}"
    )
    public void escalateDisputes() {
        if (!properties.getWorker().isEnabled()) return;
        int escalated = disputeService.escalateStaleDisputes();
        report("dispute escalation", "escalated", escalated);
    }

    @Scheduled(
            fixedDelayString = "${deuce.worker.auto-approve-ms:300000}",
            initialDelayString = "${deuce.worker.initial-delay-ms:30000}"
    )
    public void autoApproveResults() {
        if (!properties.getWorker().isEnabled()) return;
        int approved = matchResultService.autoApproveResults();
        report("result auto-approval", "approved", approved);
    }

    @Scheduled(
            fixedDelayString = "${deuce.worker.recalculation-retry-ms:60000}",
            initialDelayString = "${deuce.worker.initial-delay-ms:30000}"
    )
    public void retryRecalculations() {
        if (!properties.getWorker().isEnabled()) return;
        int recovered = recalculationCascade.retryDueTasks();
        report("recalculation retry", "recovered", recovered);
    }

    @Scheduled(
            fixedDelayString = "${deuce.worker.penalty-sweep-ms:3600000}",
            initialDelayString = "${deuce.worker.initial-delay-ms:30000}"
    )
    public void expirePenalties() {
        if (!properties.getWorker().isEnabled()) return;
        int expired = penaltyService.expirePenalties();
        report("penalty sweep", "expired", expired);
    }

    private static void report(String sweep, String verb, int count) {
        if (count > 0) {
            log.info("Worker tick ({}): {}={}", sweep, verb, count);
        } else {
            log.debug("Worker tick ({}) completed with no changes", sweep);
        }
    }
}
