package com.deuceleague.deuce_api.controller;

import com.deuceleague.deuce_api.model.MatchInvitation;
import com.deuceleague.deuce_api.service.InvitationService;
import com.deuceleague.deuce_api.service.MatchQueryService;
import com.deuceleague.deuce_api.service.MatchQueryService.InvitationView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/invitations")
@CrossOrigin(origins = "*")
public class InvitationController {
    private static final Logger log = LoggerFactory.getLogger(InvitationController.class);

    private final InvitationService invitationService;
    private final MatchQueryService queryService;

    public InvitationController(InvitationService invitationService, MatchQueryService queryService) {
        this.invitationService = invitationService;
        this.queryService = queryService;
    }

    /**
     * GET /api/invitations?userId=...
     */
    @GetMapping
    public ResponseEntity<List<InvitationView>> getInvitations(@RequestParam UUID userId) {
        return ResponseEntity.ok(queryService.invitationsFor(userId));
    }

    @PostMapping("/{invitationId}/respond")
    public ResponseEntity<InvitationView> respond(@PathVariable UUID invitationId,
                                                  @Valid @RequestBody RespondRequest request) {
        log.info("User {} {} invitation {}", request.userId(), request.accept() ? "accepting" : "declining",
                invitationId);
        MatchInvitation invitation = invitationService.respond(invitationId, request.userId(), request.accept(),
                request.declineReason());
        return ResponseEntity.ok(InvitationView.from(invitation));
    }

    @PostMapping("/{invitationId}/cancel")
    public ResponseEntity<InvitationView> cancel(@PathVariable UUID invitationId,
                                                 @Valid @RequestBody MatchController.ActorRequest request) {
        log.info("User {} cancelling invitation {}", request.userId(), invitationId);
        return ResponseEntity.ok(InvitationView.from(invitationService.cancel(invitationId, request.userId())));
    }

    public record RespondRequest(@NotNull UUID userId, boolean accept, String declineReason) {}
}
