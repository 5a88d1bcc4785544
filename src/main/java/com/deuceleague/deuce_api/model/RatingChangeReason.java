package com.deuceleague.deuce_api.model;

public enum RatingChangeReason {
    MATCH_WIN,
    MATCH_LOSS,
    WALKOVER_WIN,
    WALKOVER_LOSS
}
