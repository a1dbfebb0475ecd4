package com.example.autocheckin.service.scheduler;

/**
 * Callback invoked when a schedule entry fires. Must not block.
 */
@FunctionalInterface
public interface TaskTrigger {

    void fire();
}
