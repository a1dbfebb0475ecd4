package com.example.autocheckin.domain.enums;

/**
 * Lifecycle of a per-account task executor.
 */
public enum ExecutorState {
    CREATED,
    RUNNING,
    STOPPING,
    STOPPED;

    /**
     * Check if the executor still accepts submissions
     */
    public boolean isAcceptingTasks() {
        return this == CREATED || this == RUNNING;
    }
}
