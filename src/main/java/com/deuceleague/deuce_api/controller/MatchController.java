package com.deuceleague.deuce_api.controller;

import com.deuceleague.deuce_api.model.*;
import com.deuceleague.deuce_api.service.DisputeService;
import com.deuceleague.deuce_api.service.MatchQueryService;
import com.deuceleague.deuce_api.service.MatchQueryService.MatchView;
import com.deuceleague.deuce_api.service.MatchResultService;
import com.deuceleague.deuce_api.service.MatchSchedulingService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/matches")
@CrossOrigin(origins = "*")
public class MatchController {
    private static final Logger log = LoggerFactory.getLogger(MatchController.class);

    private final MatchSchedulingService schedulingService;
    private final MatchResultService resultService;
    private final DisputeService disputeService;
    private final MatchQueryService queryService;

    public MatchController(MatchSchedulingService schedulingService,
                           MatchResultService resultService,
                           DisputeService disputeService,
                           MatchQueryService queryService) {
        this.schedulingService = schedulingService;
        this.resultService = resultService;
        this.disputeService = disputeService;
        this.queryService = queryService;
    }

    // =========================================================================
    // Setup
    // =========================================================================

    @PostMapping
    public ResponseEntity<MatchView> createMatch(@Valid @RequestBody CreateMatchRequest request) {
        log.info("Create {} {} match requested by {}", request.sport(), request.matchType(), request.creatorId());
        Match match = schedulingService.createMatch(new MatchSchedulingService.CreateMatchCommand(
                request.creatorId(), request.divisionId(), request.seasonId(), request.sport(),
                request.matchType(), request.set3Format(), request.requiresConfirmation(),
                request.setup() != null ? request.setup() : MatchSchedulingService.InvitationSetup.none()));
        return ResponseEntity.status(HttpStatus.CREATED).body(queryService.view(match.getId()));
    }

    @GetMapping("/{matchId}")
    public ResponseEntity<MatchView> getMatch(@PathVariable UUID matchId) {
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @PostMapping("/{matchId}/invitations")
    public ResponseEntity<MatchView> resendInvitations(@PathVariable UUID matchId,
                                                       @Valid @RequestBody ResendRequest request) {
        log.info("Re-sending invitations for match {} by {}", matchId, request.creatorId());
        schedulingService.resendInvitations(matchId, request.creatorId(), request.setup());
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @PostMapping("/{matchId}/join")
    public ResponseEntity<MatchView> joinMatch(@PathVariable UUID matchId, @Valid @RequestBody JoinRequest request) {
        log.info("User {} joining match {} (partner={})", request.userId(), matchId, request.asPartner());
        schedulingService.joinMatch(matchId, request.userId(), request.asPartner());
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @PostMapping("/{matchId}/cancel")
    public ResponseEntity<MatchView> cancelMatch(@PathVariable UUID matchId, @Valid @RequestBody CancelRequest request) {
        log.info("User {} cancelling match {}", request.userId(), matchId);
        schedulingService.cancelMatch(matchId, request.userId(), request.reason());
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @PostMapping("/{matchId}/reschedule")
    public ResponseEntity<MatchView> requestReschedule(@PathVariable UUID matchId,
                                                       @Valid @RequestBody RescheduleRequest request) {
        log.info("User {} requesting reschedule of match {}", request.userId(), matchId);
        schedulingService.requestReschedule(matchId, request.userId(), request.proposedTimes(), request.reason());
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @PostMapping("/{matchId}/continue")
    public ResponseEntity<MatchView> continueUnfinishedMatch(@PathVariable UUID matchId,
                                                             @Valid @RequestBody RescheduleRequest request) {
        log.info("User {} continuing unfinished match {}", request.userId(), matchId);
        schedulingService.continueUnfinishedMatch(matchId, request.userId(), request.proposedTimes(), request.reason());
        return ResponseEntity.ok(queryService.view(matchId));
    }

    // =========================================================================
    // Time slots
    // =========================================================================

    @PostMapping("/{matchId}/time-slots")
    public ResponseEntity<MatchView> proposeTimeSlot(@PathVariable UUID matchId,
                                                     @Valid @RequestBody ProposeSlotRequest request) {
        schedulingService.proposeTimeSlot(matchId, request.userId(), request.proposedTime(), request.location());
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @PostMapping("/{matchId}/time-slots/{slotId}/vote")
    public ResponseEntity<MatchView> voteForTimeSlot(@PathVariable UUID matchId, @PathVariable UUID slotId,
                                                     @Valid @RequestBody ActorRequest request) {
        schedulingService.voteForTimeSlot(matchId, slotId, request.userId());
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @PostMapping("/{matchId}/time-slots/{slotId}/confirm")
    public ResponseEntity<MatchView> confirmTimeSlot(@PathVariable UUID matchId, @PathVariable UUID slotId,
                                                     @Valid @RequestBody ActorRequest request) {
        schedulingService.confirmTimeSlot(matchId, slotId, request.userId());
        return ResponseEntity.ok(queryService.view(matchId));
    }

    // =========================================================================
    // Results
    // =========================================================================

    @PostMapping("/{matchId}/result")
    public ResponseEntity<MatchView> submitResult(@PathVariable UUID matchId,
                                                  @Valid @RequestBody SubmitResultRequest request) {
        log.info("Result for match {} submitted by {}: {}", matchId, request.submitterId(), request.scores());
        resultService.submitResult(matchId, new MatchResultService.SubmitResultCommand(
                request.submitterId(), request.scores(), request.unfinished()));
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @PostMapping("/{matchId}/result/confirm")
    public ResponseEntity<MatchView> confirmResult(@PathVariable UUID matchId,
                                                   @Valid @RequestBody ConfirmResultRequest request) {
        log.info("Result for match {} {} by {}", matchId, request.confirmed() ? "confirmed" : "disputed",
                request.userId());
        resultService.confirmResult(matchId, new MatchResultService.ConfirmResultCommand(request.userId(),
                request.confirmed(), request.reason(), request.category(), request.counterScore(),
                request.evidenceUrl()));
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @PostMapping("/{matchId}/walkover")
    public ResponseEntity<MatchView> submitWalkover(@PathVariable UUID matchId,
                                                    @Valid @RequestBody WalkoverRequest request) {
        log.info("Walkover on match {} reported by {} against {}", matchId, request.reporterId(),
                request.defaultingUserId());
        resultService.submitWalkover(matchId, new MatchResultService.WalkoverCommand(request.reporterId(),
                request.defaultingUserId(), request.reason(), request.detail()));
        return ResponseEntity.ok(queryService.view(matchId));
    }

    // =========================================================================
    // Disputes on this match
    // =========================================================================

    @PostMapping("/{matchId}/disputes")
    public ResponseEntity<MatchDispute> raiseDispute(@PathVariable UUID matchId,
                                                     @Valid @RequestBody RaiseDisputeRequest request) {
        log.info("Dispute raised on completed match {} by {}", matchId, request.userId());
        MatchDispute dispute = resultService.raiseDispute(matchId, new MatchResultService.RaiseDisputeCommand(
                request.userId(), request.category(), request.reason(), request.counterScore(), request.evidenceUrl()));
        return ResponseEntity.status(HttpStatus.CREATED).body(dispute);
    }

    @GetMapping("/{matchId}/disputes")
    public ResponseEntity<List<MatchDispute>> getDisputes(@PathVariable UUID matchId) {
        return ResponseEntity.ok(disputeService.disputesFor(matchId));
    }

    // =========================================================================
    // Request records
    // =========================================================================

    public record CreateMatchRequest(
            @NotNull UUID creatorId,
            @NotNull UUID divisionId,
            @NotNull UUID seasonId,
            @NotNull SportType sport,
            @NotNull MatchType matchType,
            Set3Format set3Format,
            Boolean requiresConfirmation,
            MatchSchedulingService.InvitationSetup setup
    ) {}

    public record ResendRequest(@NotNull UUID creatorId, @NotNull MatchSchedulingService.InvitationSetup setup) {}

    public record JoinRequest(@NotNull UUID userId, boolean asPartner) {}

    public record CancelRequest(@NotNull UUID userId, String reason) {}

    public record ActorRequest(@NotNull UUID userId) {}

    public record RescheduleRequest(@NotNull UUID userId, @NotEmpty List<LocalDateTime> proposedTimes, String reason) {}

    public record ProposeSlotRequest(@NotNull UUID userId, @NotNull LocalDateTime proposedTime, String location) {}

    public record SubmitResultRequest(@NotNull UUID submitterId, @NotEmpty List<SetScore> scores, boolean unfinished) {}

    public record ConfirmResultRequest(
            @NotNull UUID userId,
            boolean confirmed,
            String reason,
            DisputeCategory category,
            List<SetScore> counterScore,
            String evidenceUrl
    ) {}

    public record RaiseDisputeRequest(
            @NotNull UUID userId,
            @NotNull DisputeCategory category,
            @NotNull String reason,
            List<SetScore> counterScore,
            String evidenceUrl
    ) {}

    public record WalkoverRequest(
            @NotNull UUID reporterId,
            @NotNull UUID defaultingUserId,
            @NotNull WalkoverReason reason,
            String detail
    ) {}
}
