package com.example.autocheckin.exception;

import lombok.Getter;

/**
 * Exception for schedule expressions that cannot be turned into a trigger
 */
@Getter
public class ScheduleException extends RuntimeException {

    private final String expression;

    public ScheduleException(String expression, String message) {
        super(String.format("Invalid schedule '%s': %s", expression, message));
        this.expression = expression;
    }

    public ScheduleException(String expression, Exception cause) {
        super(String.format("Invalid schedule '%s': %s", expression, cause.getMessage()), cause);
        this.expression = expression;
    }
}
