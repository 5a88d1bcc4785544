package com.deuceleague.deuce_api.exception;

import com.deuceleague.deuce_api.model.MatchStatus;
import com.deuceleague.deuce_api.model.MatchTransition;
import org.springframework.http.HttpStatus;

import java.util.UUID;

public class ConflictException extends LeagueException {

    public ConflictException(String code, String message) {
        super(HttpStatus.CONFLICT, code, message);
    }

    public static ConflictException illegalTransition(UUID matchId, MatchStatus from, MatchTransition transition) {
        return new ConflictException("illegal_transition",
                "Match " + matchId + " cannot " + transition + " from " + from);
    }

    public static ConflictException scheduleConflict(UUID userId, UUID conflictingMatchId) {
        return new ConflictException("schedule_conflict",
                "User " + userId + " already has match " + conflictingMatchId + " near that time");
    }

    public static ConflictException disputeAlreadyOpen(UUID matchId) {
        return new ConflictException("dispute_already_open",
                "Match " + matchId + " already has an open dispute");
    }

    public static ConflictException alreadyResponded(UUID invitationId) {
        return new ConflictException("invitation_already_responded",
                "Invitation " + invitationId + " has already been responded to");
    }

    public static ConflictException invitationExpired(UUID invitationId) {
        return new ConflictException("invitation_expired", "Invitation " + invitationId + " has expired");
    }

    public static ConflictException matchFull(UUID matchId) {
        return new ConflictException("match_full", "This match is already full");
    }

    public static ConflictException alreadyVoted(UUID slotId) {
        return new ConflictException("already_voted", "Already voted for time slot " + slotId);
    }

    public static ConflictException resultPending(UUID matchId) {
        return new ConflictException("result_pending",
                "Match " + matchId + " already has a result awaiting confirmation");
    }

    public static ConflictException noPendingResult(UUID matchId) {
        return new ConflictException("no_pending_result", "Match " + matchId + " has no result to confirm");
    }

    public static ConflictException rescheduleLimitReached(UUID matchId, int limit) {
        return new ConflictException("reschedule_limit_reached",
                "Match " + matchId + " has already been rescheduled " + limit + " times");
    }

    public static ConflictException disputeClosed(UUID disputeId) {
        return new ConflictException("dispute_closed", "Dispute " + disputeId + " is already closed");
    }

    public static ConflictException invalidState(String detail) {
        return new ConflictException("invalid_state", detail);
    }
}
