package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.config.DeuceProperties;
import com.deuceleague.deuce_api.event.EventBatch;
import com.deuceleague.deuce_api.event.MatchEvent;
import com.deuceleague.deuce_api.event.MatchEventDispatcher;
import com.deuceleague.deuce_api.event.MatchEventType;
import com.deuceleague.deuce_api.exception.AuthorizationException;
import com.deuceleague.deuce_api.exception.ConflictException;
import com.deuceleague.deuce_api.exception.NotFoundException;
import com.deuceleague.deuce_api.exception.ValidationException;
import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.repository.MatchDisputeRepository;
import com.deuceleague.deuce_api.repository.MatchRepository;
import com.deuceleague.deuce_api.repository.MatchWalkoverRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Result consensus: one side submits, the other confirms or disputes.
 * Walkovers skip confirmation.
 *
 * Every completion records the per-player results in the same transaction and
 * hands ratings, standings and best results to the cascade after commit.
 */
@Service
public class MatchResultService {

    private static final Logger log = LoggerFactory.getLogger(MatchResultService.class);

    static final EnumSet<DisputeStatus> UNRESOLVED = EnumSet.of(DisputeStatus.OPEN, DisputeStatus.UNDER_REVIEW);

    private final MatchRepository matchRepository;
    private final MatchDisputeRepository disputeRepository;
    private final MatchWalkoverRepository walkoverRepository;
    private final MatchStateMachine stateMachine;
    private final ScoreValidator scoreValidator;
    private final PenaltyService penaltyService;
    private final RecalculationCascade cascade;
    private final MatchEventDispatcher eventDispatcher;
    private final TransactionTemplate transactionTemplate;
    private final DeuceProperties properties;
    private final Clock clock;

    public MatchResultService(MatchRepository matchRepository,
                              MatchDisputeRepository disputeRepository,
                              MatchWalkoverRepository walkoverRepository,
                              MatchStateMachine stateMachine,
                              ScoreValidator scoreValidator,
                              PenaltyService penaltyService,
                              RecalculationCascade cascade,
                              MatchEventDispatcher eventDispatcher,
                              TransactionTemplate transactionTemplate,
                              DeuceProperties properties,
                              Clock clock) {
        this.matchRepository = matchRepository;
        this.disputeRepository = disputeRepository;
        this.walkoverRepository = walkoverRepository;
        this.stateMachine = stateMachine;
        this.scoreValidator = scoreValidator;
        this.penaltyService = penaltyService;
        this.cascade = cascade;
        this.eventDispatcher = eventDispatcher;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    // =========================================================================
    // Submit
    // =========================================================================

    public Match submitResult(UUID matchId, SubmitResultCommand cmd) {
        EventBatch events = new EventBatch();

        Match match = transactionTemplate.execute(status -> {
            Match m = lockMatch(matchId);

            // 1. Who and when
            stateMachine.requireAcceptedParticipant(m, cmd.submitterId());
            switch (m.getStatus()) {
                case COMPLETED, CANCELLED, VOID, DRAFT ->
                        throw ConflictException.invalidState("Cannot submit a result for a " + m.getStatus() + " match");
                case ONGOING -> throw ConflictException.resultPending(matchId);
                default -> { }
            }
            if (disputeRepository.existsByMatchIdAndStatusIn(matchId, UNRESOLVED)) {
                throw new ConflictException("dispute_pending", "Match " + matchId + " has a dispute awaiting review");
            }
            if (!m.isRosterComplete()) {
                throw ValidationException.invalidRoster("Every seat must be accepted before a result is submitted");
            }

            // 2. Grammar (partial scores of an unfinished match are not checked)
            if (!cmd.unfinished()) {
                scoreValidator.validate(m.getSport(), m.getSet3Format(), cmd.scores());
            }

            // 3. Scores, outcome and submitter
            writeScore(m, cmd.scores() == null ? List.of() : cmd.scores());
            m.setResultSubmittedById(cmd.submitterId());
            m.setResultSubmittedAt(now());
            m.setRequiresAdminReview(false);

            if (cmd.unfinished()) {
                stateMachine.apply(m, MatchTransition.MARK_UNFINISHED);
            } else if (m.isRequiresConfirmation()) {
                stateMachine.apply(m, MatchTransition.SUBMIT_FOR_CONFIRMATION);
                MatchTeam otherSide = m.teamOf(cmd.submitterId()).opposite();
                events.add(MatchEvent.of(MatchEventType.RESULT_SUBMITTED, matchId, m.getTeamUserIds(otherSide),
                        Map.of("submittedBy", cmd.submitterId(), "score", m.getSetScores().toString())));
            } else {
                m.setAutoApproved(true);
                stateMachine.apply(m, MatchTransition.SUBMIT_FINAL);
                cascade.rebuildResults(m);
                events.add(MatchEvent.of(MatchEventType.RESULT_CONFIRMED, matchId, m.getAcceptedUserIds()));
            }
            return m;
        });

        eventDispatcher.dispatch(events);
        log.info("Result submitted for match {} by {}: {} -> {}", matchId, cmd.submitterId(),
                match.getSetScores(), match.getStatus());
        afterCompletion(match);
        return match;
    }

    // =========================================================================
    // Confirm / dispute
    // =========================================================================

    public Match confirmResult(UUID matchId, ConfirmResultCommand cmd) {
        EventBatch events = new EventBatch();

        Match match = transactionTemplate.execute(status -> {
            Match m = lockMatch(matchId);
            stateMachine.requireAcceptedParticipant(m, cmd.confirmerId());

            if (!cmd.confirmed() && disputeRepository.existsByMatchIdAndStatusIn(matchId, UNRESOLVED)) {
                throw ConflictException.disputeAlreadyOpen(matchId);
            }
            if (!m.hasPendingResult()) {
                throw ConflictException.noPendingResult(matchId);
            }
            if (cmd.confirmerId().equals(m.getResultSubmittedById())) {
                throw AuthorizationException.notAllowed("The submitter cannot confirm their own result");
            }
            if (m.teamOf(cmd.confirmerId()) == m.teamOf(m.getResultSubmittedById())) {
                throw AuthorizationException.notAllowed("The result must be confirmed by the opposing side");
            }

            if (cmd.confirmed()) {
                m.setResultConfirmedById(cmd.confirmerId());
                m.setResultConfirmedAt(now());
                stateMachine.apply(m, MatchTransition.CONFIRM);
                cascade.rebuildResults(m);
                events.add(MatchEvent.of(MatchEventType.RESULT_CONFIRMED, matchId, m.getAcceptedUserIds()));
            } else {
                MatchDispute dispute = openDispute(m, cmd.confirmerId(), cmd.category(), cmd.reason(),
                        cmd.counterScore(), cmd.evidenceUrl(), events);
                m.clearPendingResult();
                stateMachine.apply(m, MatchTransition.DISPUTE);
                log.info("Match {} result disputed by {} (dispute {})", matchId, cmd.confirmerId(), dispute.getId());
            }
            return m;
        });

        eventDispatcher.dispatch(events);
        afterCompletion(match);
        return match;
    }

    /**
     * Approves every result left unconfirmed past the auto-approval window,
     * one match per transaction. A match is re-checked under its lock: one
     * confirmed, disputed or resubmitted since the scan is skipped.
     *
     * @return number of results approved
     */
    public int autoApproveResults() {
        LocalDateTime cutoff = now().minusHours(properties.getMatches().getAutoApproveHours());
        List<Match> candidates = matchRepository
                .findByStatusAndResultSubmittedByIdIsNotNullAndResultSubmittedAtBefore(MatchStatus.ONGOING, cutoff);
        int approved = 0;

        for (Match candidate : candidates) {
            UUID matchId = candidate.getId();
            EventBatch events = new EventBatch();
            try {
                Match match = transactionTemplate.execute(status -> {
                    Match m = lockMatch(matchId);
                    if (!m.hasPendingResult()
                            || m.getResultSubmittedAt() == null
                            || !m.getResultSubmittedAt().isBefore(cutoff)
                            || disputeRepository.existsByMatchIdAndStatusIn(matchId, UNRESOLVED)) {
                        return null;
                    }
                    m.setAutoApproved(true);
                    m.setResultConfirmedAt(now());
                    stateMachine.apply(m, MatchTransition.CONFIRM);
                    cascade.rebuildResults(m);
                    events.add(MatchEvent.of(MatchEventType.RESULT_AUTO_APPROVED, matchId, m.getAcceptedUserIds(),
                            Map.of("submittedBy", m.getResultSubmittedById())));
                    return m;
                });
                if (match == null) {
                    log.debug("Match {} changed since the auto-approval scan, skipped", matchId);
                    continue;
                }
                eventDispatcher.dispatch(events);
                afterCompletion(match);
                approved++;
                log.info("Result of match {} auto-approved after {}h", matchId,
                        properties.getMatches().getAutoApproveHours());
            } catch (RuntimeException e) {
                log.error("Auto-approval failed for match {}: {}", matchId, e.getMessage(), e);
            }
        }
        return approved;
    }

    /**
     * Disputes a result that is already final (no confirmation step). The match
     * stays COMPLETED and is flagged for review.
     */
    public MatchDispute raiseDispute(UUID matchId, RaiseDisputeCommand cmd) {
        EventBatch events = new EventBatch();

        MatchDispute dispute = transactionTemplate.execute(status -> {
            Match m = lockMatch(matchId);
            stateMachine.requireAcceptedParticipant(m, cmd.userId());
            if (m.getStatus() != MatchStatus.COMPLETED) {
                throw ConflictException.invalidState("Only completed results can be disputed directly; "
                        + "a pending result is disputed by declining to confirm it");
            }
            if (disputeRepository.existsByMatchIdAndStatusIn(matchId, UNRESOLVED)) {
                throw ConflictException.disputeAlreadyOpen(matchId);
            }
            return openDispute(m, cmd.userId(), cmd.category(), cmd.reason(), cmd.counterScore(),
                    cmd.evidenceUrl(), events);
        });

        eventDispatcher.dispatch(events);
        return dispute;
    }

    private MatchDispute openDispute(Match m, UUID userId, DisputeCategory category, String reason,
                                     List<SetScore> counterScore, String evidenceUrl, EventBatch events) {
        if (reason == null || reason.isBlank()) throw ValidationException.missingField("reason");
        if (category == null) throw ValidationException.missingField("category");
        if (counterScore != null && !counterScore.isEmpty()) {
            scoreValidator.validate(m.getSport(), m.getSet3Format(), counterScore);
        }

        MatchDispute dispute = new MatchDispute(m.getId(), userId, category, reason);
        dispute.setPriority(DisputePriority.HIGH);
        dispute.setDisputedScore(m.getSetScores());
        dispute.setDisputerScore(counterScore == null || counterScore.isEmpty() ? null : List.copyOf(counterScore));
        dispute.setEvidenceUrl(evidenceUrl);
        disputeRepository.save(dispute);

        m.setDisputed(true);
        m.setRequiresAdminReview(true);
        events.add(MatchEvent.of(MatchEventType.DISPUTE_OPENED, m.getId(), m.getAcceptedUserIds(),
                Map.of("raisedBy", userId, "category", category.name())));
        return dispute;
    }

    // =========================================================================
    // Walkover
    // =========================================================================

    public Match submitWalkover(UUID matchId, WalkoverCommand cmd) {
        if (cmd.reason() == null) throw ValidationException.missingField("reason");
        EventBatch events = new EventBatch();

        Match match = transactionTemplate.execute(status -> {
            Match m = lockMatch(matchId);
            stateMachine.requireAcceptedParticipant(m, cmd.reporterId());
            if (!m.isParticipant(cmd.defaultingUserId())) {
                throw ValidationException.invalidRoster("User " + cmd.defaultingUserId() + " is not in this match");
            }
            MatchTeam winner = m.teamOf(cmd.reporterId());
            if (winner == null || winner == m.teamOf(cmd.defaultingUserId())) {
                throw ValidationException.invalidRoster("Walkover must name a player from the other side");
            }

            // Fixed full score for the reporting side
            writeScore(m, ScoreSummary.walkoverScore(m.getSport(), winner));
            m.setWalkover(true);
            m.setWalkoverReason(cmd.reason());
            m.setResultSubmittedById(cmd.reporterId());
            m.setResultSubmittedAt(now());
            stateMachine.apply(m, MatchTransition.WALKOVER);

            walkoverRepository.save(new MatchWalkover(matchId, cmd.reporterId(), cmd.defaultingUserId(),
                    cmd.reporterId(), cmd.reason(), cmd.detail()));
            cascade.rebuildResults(m);

            if (cmd.reason() == WalkoverReason.NO_SHOW) {
                penaltyService.issue(PenaltyService.PenaltyCommand.systemWarning(cmd.defaultingUserId(), matchId,
                        "No-show reported for match " + matchId), events);
            }
            events.add(MatchEvent.of(MatchEventType.WALKOVER_RECORDED, matchId, m.getParticipantUserIds(),
                    Map.of("defaultingUserId", cmd.defaultingUserId(), "reason", cmd.reason().name())));
            return m;
        });

        eventDispatcher.dispatch(events);
        log.info("Walkover recorded on match {}: {} defaulted ({})", matchId, cmd.defaultingUserId(), cmd.reason());
        afterCompletion(match);
        return match;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    public static void writeScore(Match match, List<SetScore> scores) {
        match.replaceScores(scores);
        ScoreSummary summary = ScoreSummary.of(scores);
        match.setTeam1Score(summary.team1Sets());
        match.setTeam2Score(summary.team2Sets());
        match.setOutcome(summary.winner());
    }

    private void afterCompletion(Match match) {
        if (match.getStatus() != MatchStatus.COMPLETED) return;
        cascade.rederive(match.getId(), match.getDivisionId(), match.getSeasonId(), match.getAcceptedUserIds(), false);
    }

    private Match lockMatch(UUID matchId) {
        return matchRepository.findByIdForUpdate(matchId).orElseThrow(() -> new NotFoundException("Match", matchId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    // =========================================================================
    // Commands
    // =========================================================================

    public record SubmitResultCommand(UUID submitterId, List<SetScore> scores, boolean unfinished) {}

    public record ConfirmResultCommand(
            UUID confirmerId,
            boolean confirmed,
            String reason,
            DisputeCategory category,
            List<SetScore> counterScore,
            String evidenceUrl
    ) {
        public static ConfirmResultCommand confirm(UUID confirmerId) {
            return new ConfirmResultCommand(confirmerId, true, null, null, null, null);
        }

        public static ConfirmResultCommand dispute(UUID confirmerId, DisputeCategory category, String reason) {
            return new ConfirmResultCommand(confirmerId, false, reason, category, null, null);
        }
    }

    public record RaiseDisputeCommand(
            UUID userId,
            DisputeCategory category,
            String reason,
            List<SetScore> counterScore,
            String evidenceUrl
    ) {}

    public record WalkoverCommand(UUID reporterId, UUID defaultingUserId, WalkoverReason reason, String detail) {}
}
