package com.deuceleague.deuce_api.exception;

import org.springframework.http.HttpStatus;

public class AuthorizationException extends LeagueException {

    public AuthorizationException(String code, String message) {
        super(HttpStatus.FORBIDDEN, code, message);
    }

    public static AuthorizationException notParticipant(Object userId) {
        return new AuthorizationException("not_participant",
                "User " + userId + " is not an accepted participant of this match");
    }

    public static AuthorizationException notMember(Object userId) {
        return new AuthorizationException("not_division_member",
                "User " + userId + " is not an active member of this division");
    }

    public static AuthorizationException notAllowed(String detail) {
        return new AuthorizationException("not_allowed", detail);
    }
}
