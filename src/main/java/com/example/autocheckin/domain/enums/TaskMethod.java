package com.example.autocheckin.domain.enums;

import com.example.autocheckin.exception.UnknownMethodException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Remote action a task performs.
 * Each method maps to a specific handler implementation.
 */
@Getter
@RequiredArgsConstructor
public enum TaskMethod {

    /**
     * Send the payload as a text message to the target
     */
    MESSAGE("message", "Send Message"),

    /**
     * Click the inline button whose label equals the payload
     */
    BUTTON("button", "Click Button");

    private final String code;
    private final String displayName;

    /**
     * Find TaskMethod by its configuration code, case-insensitive and trimmed.
     */
    public static Optional<TaskMethod> lookup(String code) {
        if (code == null) {
            return Optional.empty();
        }
        var normalized = code.trim();
        for (var method : values()) {
            if (method.getCode().equalsIgnoreCase(normalized)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    /**
     * Find TaskMethod by its code value
     *
     * @throws UnknownMethodException if the code names no method
     */
    public static TaskMethod fromCode(String code) {
        return lookup(code).orElseThrow(() -> new UnknownMethodException(code));
    }
}
