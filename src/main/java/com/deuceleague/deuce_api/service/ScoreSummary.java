package com.deuceleague.deuce_api.service;

import com.deuceleague.deuce_api.model.MatchTeam;
import com.deuceleague.deuce_api.model.SetScore;
import com.deuceleague.deuce_api.model.SportType;

import java.util.List;

/**
 * Sets won per side and the winning side, derived from a list of set scores.
 * {@code winner} is null when neither side won more sets.
 */
public record ScoreSummary(int team1Sets, int team2Sets, MatchTeam winner) {

    public static ScoreSummary of(List<SetScore> sets) {
        int t1 = 0;
        int t2 = 0;
        for (SetScore set : sets) {
            MatchTeam w = set.winner();
            if (w == MatchTeam.TEAM1) t1++;
            else if (w == MatchTeam.TEAM2) t2++;
        }
        MatchTeam winner = t1 > t2 ? MatchTeam.TEAM1 : t2 > t1 ? MatchTeam.TEAM2 : null;
        return new ScoreSummary(t1, t2, winner);
    }

    /**
     * The fixed score recorded for a walkover: 6-0 6-0 in tennis and padel,
     * 15-0 15-0 in pickleball, to the winning side.
     */
    public static List<SetScore> walkoverScore(SportType sport, MatchTeam winner) {
        int games = sport == SportType.PICKLEBALL ? 15 : 6;
        int t1 = winner == MatchTeam.TEAM1 ? games : 0;
        int t2 = winner == MatchTeam.TEAM2 ? games : 0;
        return List.of(SetScore.of(1, t1, t2), SetScore.of(2, t1, t2));
    }
}
