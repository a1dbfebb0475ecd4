package com.example.autocheckin.exception;

import lombok.Getter;

/**
 * Exception for a task whose method is neither message nor button
 */
@Getter
public class UnknownMethodException extends RuntimeException {

    private final String method;

    public UnknownMethodException(String method) {
        super(String.format("unknown method \"%s\"", method));
        this.method = method;
    }
}
