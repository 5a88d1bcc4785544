package com.deuceleague.deuce_api.model;

public enum MatchTeam {
    TEAM1,
    TEAM2;

    public MatchTeam opposite() {
        return this == TEAM1 ? TEAM2 : TEAM1;
    }
}
