package com.example.autocheckin.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a task is executing.
 * The code is used in log events and per-task log file names.
 */
@Getter
@RequiredArgsConstructor
public enum TriggerType {

    /**
     * Submitted once when the account session comes up
     */
    RUN_ON_START("run_on_start", "Executing startup task...", "Startup task failed"),

    /**
     * Fired by a cron or interval schedule entry
     */
    SCHEDULED("scheduled", "Executing scheduled task...", "Scheduled task failed"),

    /**
     * Submitted by run-once mode
     */
    ONCE("once", "Executing task...", "Task failed");

    private final String code;
    private final String startMessage;
    private final String failureMessage;

    public static TriggerType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type code: " + code);
    }
}
