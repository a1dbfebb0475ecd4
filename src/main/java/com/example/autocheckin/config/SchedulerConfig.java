package com.example.autocheckin.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the shared schedule engine.
 * <p>
 * A single timer thread serves every account: firings only enqueue work,
 * the per-account worker pools do the actual execution.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean(name = "checkinTaskScheduler")
    public ThreadPoolTaskScheduler checkinTaskScheduler(CheckinProperties properties) {
        log.info("Configuring check-in scheduler thread");

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(properties.getSchedulerThreadName());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("Scheduled firing failed: {}", t.getMessage(), t));
        return scheduler;
    }
}
