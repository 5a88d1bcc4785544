package com.deuceleague.deuce_api.model;

public enum PenaltyType {
    WARNING,
    POINTS_DEDUCTION,
    SUSPENSION
}
