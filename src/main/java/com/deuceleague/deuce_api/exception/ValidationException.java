package com.deuceleague.deuce_api.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationException extends LeagueException {

    private final List<String> violations;

    public ValidationException(String code, String message) {
        this(code, message, List.of(message));
    }

    private ValidationException(String code, String message, List<String> violations) {
        super(HttpStatus.BAD_REQUEST, code, message);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    public static ValidationException invalidScore(List<String> violations) {
        return new ValidationException("invalid_score", String.join("; ", violations), violations);
    }

    public static ValidationException missingField(String field) {
        return new ValidationException("missing_field", field + " is required");
    }

    public static ValidationException invalidRoster(String detail) {
        return new ValidationException("invalid_roster", detail);
    }
}
