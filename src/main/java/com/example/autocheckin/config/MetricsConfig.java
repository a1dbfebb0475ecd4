package com.example.autocheckin.config;

import com.example.autocheckin.domain.enums.TriggerType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics for monitoring check-in execution.
 * <p>
 * Records:
 * - Submissions and drops per account
 * - Execution times and failures
 * - Queue depth per account
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    /**
     * Register a queue depth gauge for an account's executor
     */
    public void registerQueueDepth(String account, Supplier<Number> depth) {
        Gauge.builder("checkin_queue_depth", depth)
                .tag("account", account)
                .description("Number of queued task requests")
                .register(meterRegistry);
    }

    public Timer.Sample startTaskExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTaskExecution(Timer.Sample sample, String account, String method, boolean success) {
        sample.stop(Timer.builder("checkin_task_execution_time")
                .tag("account", account)
                .tag("method", method != null ? method : "unknown")
                .tag("success", String.valueOf(success))
                .description("Task execution time")
                .register(meterRegistry));
    }

    public void recordSubmission(String account, TriggerType triggerType) {
        meterRegistry.counter("checkin_tasks_submitted",
                "account", account,
                "trigger", triggerType.getCode()
        ).increment();
    }

    /**
     * Record a task dropped because the account's queue was full
     */
    public void recordDropped(String account) {
        meterRegistry.counter("checkin_tasks_dropped", "account", account).increment();
    }

    public void recordTaskFailure(String account, String errorType) {
        meterRegistry.counter("checkin_task_failures",
                "account", account,
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }
}
