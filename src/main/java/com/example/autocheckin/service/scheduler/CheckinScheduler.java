package com.example.autocheckin.service.scheduler;

import com.example.autocheckin.domain.enums.SchedulerState;
import com.example.autocheckin.exception.ScheduleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Process-wide schedule engine shared by all accounts.
 * <p>
 * Entries may be added before or after {@link #start()}; entries added while
 * running are armed immediately. {@link #stop()} cancels future firings and
 * clears the registry; a firing already in progress runs to completion.
 * Firings run on the scheduler's own thread, so callbacks must only enqueue.
 */
@Slf4j
@Component
public class CheckinScheduler {

    private final TaskScheduler taskScheduler;
    private final ScheduleExpressionParser parser;

    private final List<ScheduleEntry> entries = new ArrayList<>();
    private final Map<Integer, ScheduledFuture<?>> futures = new HashMap<>();
    private SchedulerState state = SchedulerState.STOPPED;
    private int nextId;

    public CheckinScheduler(@Qualifier("checkinTaskScheduler") TaskScheduler taskScheduler,
                            ScheduleExpressionParser parser) {
        this.taskScheduler = taskScheduler;
        this.parser = parser;
    }

    /**
     * Register a callback for an expression
     *
     * @throws ScheduleException if the expression is malformed; nothing is registered
     */
    public synchronized ScheduleEntry addTask(String expression, TaskTrigger taskTrigger) {
        var trigger = parser.parse(expression);
        var entry = new ScheduleEntry(++nextId, expression.trim(), trigger, taskTrigger);
        entries.add(entry);
        if (state == SchedulerState.RUNNING) {
            arm(entry);
        }
        log.debug("Added schedule entry {} with expression '{}'", entry.getId(), entry.getExpression());
        return entry;
    }

    public synchronized void start() {
        if (state == SchedulerState.RUNNING) {
            return;
        }
        state = SchedulerState.RUNNING;
        entries.forEach(this::arm);
        log.info("Scheduler started with {} entries", entries.size());
    }

    public synchronized void stop() {
        if (state == SchedulerState.STOPPED) {
            return;
        }
        futures.values().forEach(future -> future.cancel(false));
        futures.clear();
        entries.clear();
        state = SchedulerState.STOPPED;
        log.info("Scheduler stopped");
    }

    public synchronized SchedulerState getState() {
        return state;
    }

    public synchronized List<ScheduleEntry> getEntries() {
        return List.copyOf(entries);
    }

    private void arm(ScheduleEntry entry) {
        var future = taskScheduler.schedule(() -> fire(entry), entry.getTrigger());
        if (future == null) {
            log.warn("Schedule '{}' has no future firing time", entry.getExpression());
            return;
        }
        futures.put(entry.getId(), future);
    }

    private void fire(ScheduleEntry entry) {
        try {
            entry.getTaskTrigger().fire();
        } catch (RuntimeException e) {
            log.error("Schedule entry {} ('{}') failed to fire: {}", entry.getId(), entry.getExpression(), e.getMessage(), e);
        }
    }
}
