package com.deuceleague.deuce_api.model;

public enum ParticipantRole {
    CREATOR,
    OPPONENT,
    PARTNER
}
