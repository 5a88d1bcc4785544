package com.deuceleague.deuce_api.model;

public enum MatchType {
    SINGLES,
    DOUBLES;

    /** Accepted players a match of this type needs before it may complete. */
    public int rosterSize() {
        return this == SINGLES ? 2 : 4;
    }
}
