package com.deuceleague.deuce_api.model;

public enum RecalculationTaskStatus {
    PENDING,
    DONE,
    FAILED
}
