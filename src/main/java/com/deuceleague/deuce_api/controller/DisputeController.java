package com.deuceleague.deuce_api.controller;

import com.deuceleague.deuce_api.model.MatchDispute;
import com.deuceleague.deuce_api.model.ResolutionAction;
import com.deuceleague.deuce_api.model.SetScore;
import com.deuceleague.deuce_api.service.DisputeService;
import com.deuceleague.deuce_api.service.MatchQueryService;
import com.deuceleague.deuce_api.service.MatchQueryService.MatchView;
import com.deuceleague.deuce_api.service.RecalculationReport;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/disputes")
@CrossOrigin(origins = "*")
public class DisputeController {
    private static final Logger log = LoggerFactory.getLogger(DisputeController.class);

    private final DisputeService disputeService;
    private final MatchQueryService queryService;

    public DisputeController(DisputeService disputeService, MatchQueryService queryService) {
        this.disputeService = disputeService;
        this.queryService = queryService;
    }

    /** Review queue: OPEN and UNDER_REVIEW, oldest first. */
    @GetMapping
    public ResponseEntity<List<MatchDispute>> listOpen() {
        return ResponseEntity.ok(disputeService.listOpen());
    }

    @GetMapping("/{disputeId}")
    public ResponseEntity<MatchDispute> getDispute(@PathVariable UUID disputeId) {
        return ResponseEntity.ok(disputeService.get(disputeId));
    }

    @PostMapping("/{disputeId}/claim")
    public ResponseEntity<MatchDispute> claim(@PathVariable UUID disputeId, @Valid @RequestBody AdminRequest request) {
        log.info("Admin {} claiming dispute {}", request.adminId(), disputeId);
        return ResponseEntity.ok(disputeService.claimDispute(disputeId, request.adminId()));
    }

    @PostMapping("/{disputeId}/resolve")
    public ResponseEntity<ResolutionResponse> resolve(@PathVariable UUID disputeId,
                                                      @Valid @RequestBody ResolveRequest request) {
        log.info("Admin {} resolving dispute {} with {}", request.adminId(), disputeId, request.action());
        DisputeService.DisputeResolution resolution = disputeService.resolveDispute(disputeId,
                new DisputeService.ResolveDisputeCommand(request.adminId(), request.action(),
                        request.finalScore(), request.reason()));
        return ResponseEntity.ok(new ResolutionResponse(resolution.dispute(),
                queryService.view(resolution.dispute().getMatchId()), resolution.report()));
    }

    public record AdminRequest(@NotNull UUID adminId) {}

    public record ResolveRequest(
            @NotNull UUID adminId,
            @NotNull ResolutionAction action,
            List<SetScore> finalScore,
            String reason
    ) {}

    public record ResolutionResponse(MatchDispute dispute, MatchView match, RecalculationReport recalculation) {}
}
