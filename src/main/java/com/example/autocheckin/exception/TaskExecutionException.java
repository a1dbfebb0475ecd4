package com.example.autocheckin.exception;

import lombok.Getter;

/**
 * Exception for task execution failures
 */
@Getter
public class TaskExecutionException extends RuntimeException {

    private final String taskName;

    public TaskExecutionException(String taskName, String message) {
        super(String.format("Task %s execution failed: %s", taskName, message));
        this.taskName = taskName;
    }

    public TaskExecutionException(String taskName, Exception cause) {
        super(String.format("Task %s execution failed: %s", taskName, cause.getMessage()), cause);
        this.taskName = taskName;
    }
}
