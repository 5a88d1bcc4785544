package com.deuceleague.deuce_api.model;

public enum TimeSlotStatus {
    PROPOSED,
    CONFIRMED,
    REJECTED
}
