package com.example.autocheckin.exception;

import lombok.Getter;

/**
 * Exception for failures talking to the messenger gateway
 */
@Getter
public class MessengerException extends RuntimeException {

    private final String operation;
    private final Integer httpStatusCode;
    private final String responseBody;

    public MessengerException(String operation, String message) {
        super(String.format("[%s] %s", operation, message));
        this.operation = operation;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public MessengerException(String operation, Exception cause) {
        super(String.format("[%s] %s", operation, cause.getMessage()), cause);
        this.operation = operation;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public MessengerException(String operation, String message, Exception cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
        this.httpStatusCode = null;
        this.responseBody = null;
    }

    public MessengerException(String operation, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", operation, httpStatusCode, responseBody));
        this.operation = operation;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }

    /**
     * Check if the gateway rejected the session credentials
     */
    public boolean isUnauthorized() {
        return httpStatusCode != null && (httpStatusCode == 401 || httpStatusCode == 403);
    }
}
