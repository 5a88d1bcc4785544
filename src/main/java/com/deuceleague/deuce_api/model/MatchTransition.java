package com.deuceleague.deuce_api.model;

import java.util.EnumSet;
import java.util.Set;

import static com.deuceleague.deuce_api.model.MatchStatus.*;

/**
 * Every legal edge of the match lifecycle. A status change that is not one of
 * these is rejected by {@code MatchStateMachine}.
 */
public enum MatchTransition {

    SEND_INVITATIONS(EnumSet.of(DRAFT), SCHEDULED),
    INVITATIONS_LAPSED(EnumSet.of(SCHEDULED), DRAFT),
    SUBMIT_FOR_CONFIRMATION(EnumSet.of(SCHEDULED, UNFINISHED), ONGOING),
    SUBMIT_FINAL(EnumSet.of(SCHEDULED, UNFINISHED), COMPLETED),
    MARK_UNFINISHED(EnumSet.of(SCHEDULED), UNFINISHED),
    CONTINUE(EnumSet.of(UNFINISHED), SCHEDULED),
    CONFIRM(EnumSet.of(ONGOING), COMPLETED),
    DISPUTE(EnumSet.of(ONGOING), SCHEDULED),
    CANCEL(EnumSet.of(SCHEDULED, ONGOING), CANCELLED),
    VOID(EnumSet.of(COMPLETED), MatchStatus.VOID),
    ADMIN_EDIT(EnumSet.of(COMPLETED), COMPLETED),
    WALKOVER(EnumSet.of(SCHEDULED, ONGOING, UNFINISHED), COMPLETED),
    ADJUDICATE(EnumSet.of(SCHEDULED, ONGOING), COMPLETED),
    DISPUTE_VOID(EnumSet.of(SCHEDULED, ONGOING, COMPLETED), MatchStatus.VOID),
    ADMIN_REINSTATE(EnumSet.of(CANCELLED, MatchStatus.VOID), SCHEDULED);

    private final Set<MatchStatus> sources;
    private final MatchStatus target;

    MatchTransition(Set<MatchStatus> sources, MatchStatus target) {
        this.sources = sources;
        this.target = target;
    }

    public boolean allowsFrom(MatchStatus status) {
        return sources.contains(status);
    }

    public MatchStatus target() {
        return target;
    }
}
