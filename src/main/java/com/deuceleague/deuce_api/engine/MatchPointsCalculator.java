package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.model.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns a decided match into one {@link MatchResult} per accepted player.
 *
 * Points: 1 for taking part, 1 per set won, 2 more for the win.
 */
public final class MatchPointsCalculator {

    static final int PARTICIPATION_POINTS = 1;
    static final int WIN_BONUS = 2;

    private MatchPointsCalculator() {}

    public static List<MatchResult> resultsFor(Match match, LocalDateTime datePlayed) {
        if (match.getOutcome() == null) return List.of();

        List<SetScore> sets = match.getSetScores();
        int team1Sets = match.getTeam1Score() == null ? 0 : match.getTeam1Score();
        int team2Sets = match.getTeam2Score() == null ? 0 : match.getTeam2Score();
        int team1Games = sets.stream().mapToInt(SetScore::team1Games).sum();
        int team2Games = sets.stream().mapToInt(SetScore::team2Games).sum();

        List<MatchResult> results = new ArrayList<>();
        for (MatchParticipant p : match.getAcceptedParticipants()) {
            boolean team1 = p.getTeam() == MatchTeam.TEAM1;
            boolean won = p.getTeam() == match.getOutcome();
            int setsWon = team1 ? team1Sets : team2Sets;
            int setsLost = team1 ? team2Sets : team1Sets;
            int points = PARTICIPATION_POINTS + setsWon + (won ? WIN_BONUS : 0);

            results.add(new MatchResult(match.getId(), p.getUserId(), opponentOf(match, p),
                    match.getDivisionId(), match.getSeasonId(), won, points,
                    setsWon, setsLost,
                    team1 ? team1Games : team2Games, team1 ? team2Games : team1Games,
                    datePlayed));
        }
        return results;
    }

    // Singles only; a doubles side has no single opponent.
    private static UUID opponentOf(Match match, MatchParticipant p) {
        if (match.getMatchType() != MatchType.SINGLES || p.getTeam() == null) return null;
        List<UUID> other = match.getTeamUserIds(p.getTeam().opposite());
        return other.isEmpty() ? null : other.get(0);
    }
}
