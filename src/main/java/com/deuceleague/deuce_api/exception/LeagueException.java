package com.deuceleague.deuce_api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base for every rejection the engine reports to a caller. Carries the HTTP
 * status and a stable machine-readable code.
 */
@Getter
public abstract class LeagueException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected LeagueException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
