package com.deuceleague.deuce_api.model;

public enum TiebreakType {
    STANDARD_7PT,
    MATCH_10PT
}
