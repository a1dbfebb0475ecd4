package com.example.autocheckin.domain.model;

import com.example.autocheckin.domain.enums.TriggerType;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One queued execution of a task.
 * <p>
 * The worker id is unknown at submission and is filled in by the worker
 * that dequeues the request.
 */
@Value
@Builder
public class TaskRequest {

    Task task;
    TriggerType triggerType;
    AccountContext account;

    @Builder.Default
    Instant submittedAt = Instant.now();

    @With
    Integer workerId;

    public boolean isAssigned() {
        return workerId != null;
    }
}
