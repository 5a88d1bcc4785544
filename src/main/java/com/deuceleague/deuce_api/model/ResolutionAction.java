package com.deuceleague.deuce_api.model;

public enum ResolutionAction {
    UPHOLD_ORIGINAL,
    UPHOLD_DISPUTER,
    CUSTOM_SCORE,
    VOID_MATCH,
    AWARD_WALKOVER,
    REQUEST_MORE_INFO,
    REJECT;

    /** Actions that change a rated fact of the match and so re-run the cascade. */
    public boolean changesResult() {
        return this == UPHOLD_DISPUTER || this == CUSTOM_SCORE
                || this == AWARD_WALKOVER || this == VOID_MATCH;
    }
}
