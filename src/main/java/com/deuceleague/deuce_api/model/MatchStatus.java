package com.deuceleague.deuce_api.model;

public enum MatchStatus {
    DRAFT,
    SCHEDULED,
    ONGOING,
    COMPLETED,
    CANCELLED,
    VOID,
    UNFINISHED
}
