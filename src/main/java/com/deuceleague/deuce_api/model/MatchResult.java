package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Derived per-player row for a completed match, the input to standings and
 * to the best-results aggregate.
 */
@Getter
@Entity
@Table(name = "match_results")
public class MatchResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "match_id", nullable = false)
    private UUID matchId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "opponent_id")
    private UUID opponentId;

    @Column(name = "division_id", nullable = false)
    private UUID divisionId;

    @Column(name = "season_id", nullable = false)
    private UUID seasonId;

    @Column(name = "is_winner", nullable = false)
    private boolean winner;

    @Column(name = "match_points", nullable = false)
    private int matchPoints;

    @Column(name = "sets_won", nullable = false)
    private int setsWon;

    @Column(name = "sets_lost", nullable = false)
    private int setsLost;

    @Column(name = "games_won", nullable = false)
    private int gamesWon;

    @Column(name = "games_lost", nullable = false)
    private int gamesLost;

    @Column(nullable = false)
    private int margin;

    @Column(name = "date_played", nullable = false)
    private LocalDateTime datePlayed;

    @Setter
    @Column(name = "counts_for_standings", nullable = false)
    private boolean countsForStandings;

    @Setter
    @Column(name = "result_sequence")
    private Integer resultSequence;

    public MatchResult() {}

    public MatchResult(UUID matchId, UUID userId, UUID opponentId, UUID divisionId, UUID seasonId,
                       boolean winner, int matchPoints, int setsWon, int setsLost,
                       int gamesWon, int gamesLost, LocalDateTime datePlayed) {
        this.matchId = matchId;
        this.userId = userId;
        this.opponentId = opponentId;
        this.divisionId = divisionId;
        this.seasonId = seasonId;
        this.winner = winner;
        this.matchPoints = matchPoints;
        this.setsWon = setsWon;
        this.setsLost = setsLost;
        this.gamesWon = gamesWon;
        this.gamesLost = gamesLost;
        this.margin = gamesWon - gamesLost;
        this.datePlayed = datePlayed;
    }
}
