package com.deuceleague.deuce_api.model;

public enum DisputeCategory {
    WRONG_SCORE,
    NO_SHOW,
    BEHAVIOR,
    OTHER
}
