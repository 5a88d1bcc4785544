package com.deuceleague.deuce_api.controller;

import com.deuceleague.deuce_api.model.DivisionStanding;
import com.deuceleague.deuce_api.model.PlayerRating;
import com.deuceleague.deuce_api.model.RatingHistory;
import com.deuceleague.deuce_api.service.MatchQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class StandingsController {

    private final MatchQueryService queryService;

    public StandingsController(MatchQueryService queryService) {
        this.queryService = queryService;
    }

    // =========================================================================
    // Division table
    // =========================================================================

    /**
     * GET /api/standings?divisionId=...&seasonId=...
     */
    @GetMapping("/standings")
    public ResponseEntity<List<DivisionStanding>> getStandings(@RequestParam UUID divisionId,
                                                               @RequestParam UUID seasonId) {
        return ResponseEntity.ok(queryService.standings(divisionId, seasonId));
    }

    // =========================================================================
    // Ratings
    // =========================================================================

    /**
     * GET /api/ratings/{userId}?seasonId=...
     */
    @GetMapping("/ratings/{userId}")
    public ResponseEntity<PlayerRating> getRating(@PathVariable UUID userId, @RequestParam UUID seasonId) {
        return queryService.rating(userId, seasonId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/ratings/{userId}/history")
    public ResponseEntity<List<RatingHistory>> getRatingHistory(@PathVariable UUID userId) {
        return ResponseEntity.ok(queryService.ratingHistory(userId));
    }
}
