package com.deuceleague.deuce_api.model;

/**
 * How a deciding third set is played in tennis and padel.
 */
public enum Set3Format {
    MATCH_TIEBREAK,
    FULL_SET
}
