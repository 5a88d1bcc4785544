package com.deuceleague.deuce_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;

import java.util.UUID;

/**
 * One stored set (or pickleball game). Rows are never updated in place:
 * an edit replaces the whole collection.
 */
@Getter
@Entity
@Table(name = "match_scores")
public class MatchScore {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @JsonIgnore
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "match_id", nullable = false)
    private Match match;

    @Column(name = "set_number", nullable = false)
    private int setNumber;

    @Column(name = "team1_games", nullable = false)
    private int team1Games;

    @Column(name = "team2_games", nullable = false)
    private int team2Games;

    @Column(name = "team1_tiebreak")
    private Integer team1Tiebreak;

    @Column(name = "team2_tiebreak")
    private Integer team2Tiebreak;

    @Enumerated(EnumType.STRING)
    @Column(name = "tiebreak_type", length = 20)
    private TiebreakType tiebreakType;

    public MatchScore() {}

    MatchScore(Match match, SetScore score, TiebreakType tiebreakType) {
        this.match = match;
        this.setNumber = score.setNumber();
        this.team1Games = score.team1Games();
        this.team2Games = score.team2Games();
        this.team1Tiebreak = score.team1Tiebreak();
        this.team2Tiebreak = score.team2Tiebreak();
        this.tiebreakType = tiebreakType;
    }

    public SetScore toSetScore() {
        return new SetScore(setNumber, team1Games, team2Games, team1Tiebreak, team2Tiebreak);
    }
}
