package com.example.autocheckin.exception;

import lombok.Getter;

/**
 * Exception for a session that could not be authenticated
 */
@Getter
public class AuthException extends RuntimeException {

    private final String account;

    public AuthException(String account, String message) {
        super(String.format("Authentication failed for %s: %s", account, message));
        this.account = account;
    }

    public AuthException(String account, Exception cause) {
        super(String.format("Authentication failed for %s: %s", account, cause.getMessage()), cause);
        this.account = account;
    }
}
