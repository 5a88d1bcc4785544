package com.deuceleague.deuce_api.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends LeagueException {

    public NotFoundException(String what, Object id) {
        super(HttpStatus.NOT_FOUND, what.toLowerCase().replace(' ', '_') + "_not_found", what + " not found: " + id);
    }
}
