package com.deuceleague.deuce_api.model;

public enum DisputePriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
