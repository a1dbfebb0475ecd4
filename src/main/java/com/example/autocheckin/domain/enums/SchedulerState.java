package com.example.autocheckin.domain.enums;

/**
 * Lifecycle of the shared timer engine.
 */
public enum SchedulerState {
    STOPPED,
    RUNNING
}
