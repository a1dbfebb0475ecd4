package com.example.autocheckin.domain.model;

import com.example.autocheckin.domain.enums.TaskMethod;
import com.example.autocheckin.exception.UnknownMethodException;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of a configured task.
 * <p>
 * The method is resolved once, when the snapshot is taken. An unrecognised
 * method code is kept as-is so that the failure surfaces when the task is
 * executed rather than when configuration is read.
 */
@Value
@Builder
public class Task {

    String name;
    String target;
    String methodCode;
    TaskMethod method;
    String payload;
    String schedule;
    boolean enabled;
    boolean runOnStart;
    int replyWaitSeconds;
    int replyHistoryLimit;

    public static Task from(TaskConfig config) {
        return Task.builder()
                .name(config.getName())
                .target(config.getTarget())
                .methodCode(config.getMethod())
                .method(TaskMethod.lookup(config.getMethod()).orElse(null))
                .payload(config.getPayload())
                .schedule(config.getSchedule() != null ? config.getSchedule().trim() : "")
                .enabled(config.isEffectivelyEnabled())
                .runOnStart(config.isRunOnStart())
                .replyWaitSeconds(config.getReplyWaitSeconds())
                .replyHistoryLimit(config.getReplyHistoryLimit())
                .build();
    }

    /**
     * Name used in logs: the configured name, or the target when the name is empty
     */
    public String getDisplayName() {
        return name == null || name.isBlank() ? target : name;
    }

    public boolean hasSchedule() {
        return schedule != null && !schedule.isBlank();
    }

    /**
     * @throws UnknownMethodException if the configured method was not recognised
     */
    public TaskMethod requireMethod() {
        if (method == null) {
            throw new UnknownMethodException(methodCode);
        }
        return method;
    }
}
