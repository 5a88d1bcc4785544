package com.deuceleague.deuce_api.event;

public enum MatchEventType {

    INVITATION_SENT(Audience.PLAYERS),
    INVITATION_ACCEPTED(Audience.PLAYERS),
    INVITATION_DECLINED(Audience.PLAYERS),
    INVITATION_EXPIRED(Audience.PLAYERS),
    INVITATIONS_LAPSED(Audience.PLAYERS),
    PLAYER_JOINED(Audience.PLAYERS),
    TIME_SLOT_CONFIRMED(Audience.PLAYERS),
    RESCHEDULE_REQUESTED(Audience.PLAYERS),
    MATCH_CANCELLED(Audience.PLAYERS),
    LATE_CANCELLATION_REVIEW(Audience.ADMINS),
    RESULT_SUBMITTED(Audience.PLAYERS),
    RESULT_CONFIRMED(Audience.PLAYERS),
    RESULT_AUTO_APPROVED(Audience.PLAYERS),
    DISPUTE_OPENED(Audience.EVERYONE),
    DISPUTE_ESCALATED(Audience.ADMINS),
    DISPUTE_RESOLVED(Audience.PLAYERS),
    WALKOVER_RECORDED(Audience.EVERYONE),
    DISCIPLINARY_WARNING_ISSUED(Audience.PLAYERS),
    PENALTY_APPLIED(Audience.PLAYERS),
    APPEAL_RESOLVED(Audience.PLAYERS),
    MATCH_EDITED(Audience.PLAYERS),
    MATCH_VOIDED(Audience.PLAYERS),
    MATCH_REINSTATED(Audience.PLAYERS);

    public enum Audience { PLAYERS, ADMINS, EVERYONE }

    private final Audience audience;

    MatchEventType(Audience audience) {
        this.audience = audience;
    }

    public boolean reachesPlayers() {
        return audience != Audience.ADMINS;
    }

    public boolean reachesAdmins() {
        return audience != Audience.PLAYERS;
    }
}
