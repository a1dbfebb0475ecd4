package com.example.autocheckin.exception;

/**
 * Exception for missing, unreadable or ambiguous configuration
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
