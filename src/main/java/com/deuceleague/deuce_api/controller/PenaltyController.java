package com.deuceleague.deuce_api.controller;

import com.deuceleague.deuce_api.model.Penalty;
import com.deuceleague.deuce_api.model.PenaltySeverity;
import com.deuceleague.deuce_api.model.PenaltyType;
import com.deuceleague.deuce_api.service.PenaltyService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/penalties")
@CrossOrigin(origins = "*")
public class PenaltyController {
    private static final Logger log = LoggerFactory.getLogger(PenaltyController.class);

    private final PenaltyService penaltyService;

    public PenaltyController(PenaltyService penaltyService) {
        this.penaltyService = penaltyService;
    }

    @PostMapping
    public ResponseEntity<Penalty> applyPenalty(@Valid @RequestBody ApplyPenaltyRequest request) {
        log.info("Admin {} applying {} to {}", request.adminId(), request.penaltyType(), request.userId());
        Penalty penalty = penaltyService.applyPenalty(new PenaltyService.PenaltyCommand(request.userId(),
                request.adminId(), request.penaltyType(), request.severity(), request.relatedMatchId(),
                request.relatedDisputeId(), request.pointsDeducted(), request.suspensionDays(), request.reason(),
                request.evidenceUrl()));
        return ResponseEntity.status(HttpStatus.CREATED).body(penalty);
    }

    /**
     * GET /api/penalties?userId=...
     */
    @GetMapping
    public ResponseEntity<List<Penalty>> getPenalties(@RequestParam UUID userId) {
        return ResponseEntity.ok(penaltyService.penaltiesFor(userId));
    }

    @PostMapping("/{penaltyId}/appeal")
    public ResponseEntity<Penalty> appeal(@PathVariable UUID penaltyId, @Valid @RequestBody AppealRequest request) {
        log.info("User {} appealing penalty {}", request.userId(), penaltyId);
        return ResponseEntity.ok(penaltyService.submitAppeal(penaltyId, request.userId(), request.reason()));
    }

    @PostMapping("/{penaltyId}/appeal/resolve")
    public ResponseEntity<Penalty> resolveAppeal(@PathVariable UUID penaltyId,
                                                 @Valid @RequestBody ResolveAppealRequest request) {
        log.info("Admin {} resolving appeal on penalty {}: overturn={}", request.adminId(), penaltyId,
                request.overturn());
        return ResponseEntity.ok(penaltyService.resolveAppeal(penaltyId, request.adminId(), request.overturn(),
                request.notes()));
    }

    public record ApplyPenaltyRequest(
            @NotNull UUID userId,
            @NotNull UUID adminId,
            @NotNull PenaltyType penaltyType,
            PenaltySeverity severity,
            UUID relatedMatchId,
            UUID relatedDisputeId,
            Integer pointsDeducted,
            Integer suspensionDays,
            @NotBlank String reason,
            String evidenceUrl
    ) {}

    public record AppealRequest(@NotNull UUID userId, @NotBlank String reason) {}

    public record ResolveAppealRequest(@NotNull UUID adminId, boolean overturn, String notes) {}
}
