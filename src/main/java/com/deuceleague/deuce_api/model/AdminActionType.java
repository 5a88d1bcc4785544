package com.deuceleague.deuce_api.model;

public enum AdminActionType {
    EDIT_RESULT,
    EDIT_PARTICIPANTS,
    VOID_MATCH,
    REINSTATE_MATCH,
    OVERRIDE_DISPUTE,
    APPLY_PENALTY,
    APPROVE_LATE_CANCELLATION,
    DENY_LATE_CANCELLATION,
    VERIFY_WALKOVER
}
