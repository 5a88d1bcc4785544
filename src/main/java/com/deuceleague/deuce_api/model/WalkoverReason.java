package com.deuceleague.deuce_api.model;

public enum WalkoverReason {
    NO_SHOW,
    LATE_CANCELLATION,
    INJURY,
    PERSONAL_EMERGENCY,
    OTHER
}
