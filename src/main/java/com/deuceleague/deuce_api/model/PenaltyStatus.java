package com.deuceleague.deuce_api.model;

public enum PenaltyStatus {
    ACTIVE,
    APPEALED,
    OVERTURNED,
    EXPIRED
}
