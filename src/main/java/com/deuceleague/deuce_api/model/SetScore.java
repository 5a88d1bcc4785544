package com.deuceleague.deuce_api.model;

/**
 * One set (tennis, padel) or game (pickleball) as reported by a player or admin.
 * Tiebreak points are only present on sets decided by a tiebreak.
 */
public record SetScore(
        int setNumber,
        int team1Games,
        int team2Games,
        Integer team1Tiebreak,
        Integer team2Tiebreak
) {
    public static SetScore of(int setNumber, int team1Games, int team2Games) {
        return new SetScore(setNumber, team1Games, team2Games, null, null);
    }

    public boolean hasTiebreak() {
        return team1Tiebreak != null || team2Tiebreak != null;
    }

    /** The side that took this set: more games, then the higher tiebreak. Null if level. */
    public MatchTeam winner() {
        if (team1Games > team2Games) return MatchTeam.TEAM1;
        if (team2Games > team1Games) return MatchTeam.TEAM2;
        int tb1 = team1Tiebreak == null ? 0 : team1Tiebreak;
        int tb2 = team2Tiebreak == null ? 0 : team2Tiebreak;
        if (tb1 > tb2) return MatchTeam.TEAM1;
        if (tb2 > tb1) return MatchTeam.TEAM2;
        return null;
    }

    public int gamesFor(MatchTeam team) {
        return team == MatchTeam.TEAM1 ? team1Games : team2Games;
    }

    @Override
    public String toString() {
        String base = team1Games + "-" + team2Games;
        return hasTiebreak() ? base + "(" + team1Tiebreak + "-" + team2Tiebreak + ")" : base;
    }
}
