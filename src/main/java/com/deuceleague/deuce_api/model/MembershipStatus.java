package com.deuceleague.deuce_api.model;

public enum MembershipStatus {
    ACTIVE,
    INACTIVE,
    REMOVED
}
