package com.deuceleague.deuce_api.controller;

import com.deuceleague.deuce_api.model.MatchWalkover;
import com.deuceleague.deuce_api.model.Penalty;
import com.deuceleague.deuce_api.model.PenaltySeverity;
import com.deuceleague.deuce_api.model.SetScore;
import com.deuceleague.deuce_api.service.AdminMatchService;
import com.deuceleague.deuce_api.service.MatchQueryService;
import com.deuceleague.deuce_api.service.MatchQueryService.AdminActionView;
import com.deuceleague.deuce_api.service.MatchQueryService.MatchView;
import com.deuceleague.deuce_api.service.RecalculationReport;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin/matches")
@CrossOrigin(origins = "*")
public class AdminMatchController {
    private static final Logger log = LoggerFactory.getLogger(AdminMatchController.class);

    private final AdminMatchService adminMatchService;
    private final MatchQueryService queryService;

    public AdminMatchController(AdminMatchService adminMatchService, MatchQueryService queryService) {
        this.adminMatchService = adminMatchService;
        this.queryService = queryService;
    }

    // =========================================================================
    // Edits
    // =========================================================================

    @PutMapping("/{matchId}/result")
    public ResponseEntity<EditResponse> editResult(@PathVariable UUID matchId,
                                                   @Valid @RequestBody EditResultRequest request) {
        log.info("Admin {} editing result of match {}", request.adminId(), matchId);
        AdminMatchService.EditOutcome outcome = adminMatchService.editResult(matchId,
                new AdminMatchService.EditResultCommand(request.adminId(), request.scores(), request.reason()));
        return ResponseEntity.ok(toResponse(outcome));
    }

    @PutMapping("/{matchId}/participants")
    public ResponseEntity<EditResponse> editParticipants(@PathVariable UUID matchId,
                                                         @Valid @RequestBody EditParticipantsRequest request) {
        log.info("Admin {} editing participants of match {}", request.adminId(), matchId);
        AdminMatchService.EditOutcome outcome = adminMatchService.editParticipants(matchId,
                new AdminMatchService.EditParticipantsCommand(request.adminId(), request.participants(),
                        request.reason()));
        return ResponseEntity.ok(toResponse(outcome));
    }

    @PostMapping("/{matchId}/void")
    public ResponseEntity<EditResponse> voidMatch(@PathVariable UUID matchId, @Valid @RequestBody ReasonRequest request) {
        log.info("Admin {} voiding match {}", request.adminId(), matchId);
        return ResponseEntity.ok(toResponse(adminMatchService.voidMatch(matchId, request.adminId(), request.reason())));
    }

    @PostMapping("/{matchId}/reinstate")
    public ResponseEntity<MatchView> reinstateMatch(@PathVariable UUID matchId,
                                                    @Valid @RequestBody ReasonRequest request) {
        log.info("Admin {} reinstating match {}", request.adminId(), matchId);
        adminMatchService.reinstateMatch(matchId, request.adminId(), request.reason());
        return ResponseEntity.ok(queryService.view(matchId));
    }

    @GetMapping("/{matchId}/actions")
    public ResponseEntity<List<AdminActionView>> getHistory(@PathVariable UUID matchId) {
        return ResponseEntity.ok(queryService.adminHistory(matchId));
    }

    // =========================================================================
    // Late cancellations & walkovers
    // =========================================================================

    @GetMapping("/late-cancellations")
    public ResponseEntity<List<MatchView>> pendingLateCancellations() {
        return ResponseEntity.ok(queryService.pendingLateCancellations());
    }

    @PostMapping("/{matchId}/late-cancellation/review")
    public ResponseEntity<LateCancellationResponse> reviewLateCancellation(
            @PathVariable UUID matchId, @Valid @RequestBody LateCancellationRequest request) {
        log.info("Admin {} reviewing late cancellation of match {}: approved={}", request.adminId(), matchId,
                request.approved());
        AdminMatchService.LateCancellationDecision decision = adminMatchService.reviewLateCancellation(matchId,
                new AdminMatchService.LateCancellationReview(request.adminId(), request.approved(),
                        request.applyPenalty(), request.penaltySeverity(), request.reason()));
        return ResponseEntity.ok(new LateCancellationResponse(decision.approved(), decision.penalty()));
    }

    @PostMapping("/{matchId}/walkover/verify")
    public ResponseEntity<MatchWalkover> verifyWalkover(@PathVariable UUID matchId,
                                                        @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(adminMatchService.verifyWalkover(matchId, request.adminId(), request.reason()));
    }

    private EditResponse toResponse(AdminMatchService.EditOutcome outcome) {
        return new EditResponse(queryService.view(outcome.match().getId()), outcome.changes(), outcome.report());
    }

    // =========================================================================
    // Request / response records
    // =========================================================================

    public record EditResultRequest(@NotNull UUID adminId, @NotEmpty List<SetScore> scores, @NotNull String reason) {}

    public record EditParticipantsRequest(
            @NotNull UUID adminId,
            @NotEmpty List<AdminMatchService.ParticipantAssignment> participants,
            @NotNull String reason
    ) {}

    public record ReasonRequest(@NotNull UUID adminId, String reason) {}

    public record LateCancellationRequest(
            @NotNull UUID adminId,
            boolean approved,
            boolean applyPenalty,
            PenaltySeverity penaltySeverity,
            String reason
    ) {}

    public record EditResponse(
            MatchView match,
            AdminMatchService.ParticipantChanges changes,
            RecalculationReport recalculation
    ) {}

    public record LateCancellationResponse(boolean approved, Penalty penalty) {}
}
