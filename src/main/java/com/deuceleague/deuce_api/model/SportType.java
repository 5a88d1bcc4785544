package com.deuceleague.deuce_api.model;

public enum SportType {
    TENNIS,
    PADEL,
    PICKLEBALL
}
