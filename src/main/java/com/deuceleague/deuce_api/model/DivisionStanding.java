package com.deuceleague.deuce_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "division_standings")
public class DivisionStanding {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "division_id", nullable = false)
    private UUID divisionId;

    @Column(name = "season_id", nullable = false)
    private UUID seasonId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "matches_played", nullable = false)
    private int matchesPlayed;

    @Column(nullable = false)
    private int wins;

    @Column(nullable = false)
    private int losses;

    @Column(name = "sets_won", nullable = false)
    private int setsWon;

    @Column(name = "sets_lost", nullable = false)
    private int setsLost;

    @Column(name = "games_won", nullable = false)
    private int gamesWon;

    @Column(name = "games_lost", nullable = false)
    private int gamesLost;

    // Sum of match points over the counted (best-N) results only.
    @Column(name = "total_points", nullable = false)
    private int totalPoints;

    @Column(name = "standing_rank")
    private Integer rank;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public DivisionStanding() {}

    public DivisionStanding(UUID divisionId, UUID seasonId, UUID userId) {
        this.divisionId = divisionId;
        this.seasonId = seasonId;
        this.userId = userId;
    }

    public int getSetDifference() {
        return setsWon - setsLost;
    }

    public int getGameDifference() {
        return gamesWon - gamesLost;
    }
}
