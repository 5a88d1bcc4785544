package com.deuceleague.deuce_api.model;

public enum PenaltySeverity {
    WARNING,
    POINTS_DEDUCTION,
    SUSPENSION,
    PERMANENT_BAN
}
