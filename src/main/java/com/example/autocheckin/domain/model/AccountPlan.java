package com.example.autocheckin.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * The enabled/disabled partition of one account's tasks.
 * <p>
 * Disabled tasks are listed explicitly so that "skipped because disabled" can
 * be reported separately from "not configured".
 */
@Value
@Builder
public class AccountPlan {

    String accountLabel;

    @Singular
    List<Task> enabledTasks;

    @Singular
    List<Task> startupTasks;

    @Singular
    List<Task> scheduledTasks;

    @Singular
    List<Task> disabledTasks;

    public boolean hasRunnableTasks() {
        return !startupTasks.isEmpty() || !scheduledTasks.isEmpty();
    }

    public boolean hasEnabledTasks() {
        return !enabledTasks.isEmpty();
    }
}
