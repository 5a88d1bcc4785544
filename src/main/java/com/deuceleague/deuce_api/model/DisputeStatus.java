package com.deuceleague.deuce_api.model;

public enum DisputeStatus {
    OPEN,
    UNDER_REVIEW,
    RESOLVED,
    REJECTED;

    public boolean isClosed() {
        return this == RESOLVED || this == REJECTED;
    }
}
