package com.example.autocheckin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Auto Check-in Service Application
 * <p>
 * Runs scheduled check-in actions (text messages or inline button clicks)
 * against a messaging platform on behalf of several accounts.
 * <p>
 * Features:
 * - Layered YAML configuration with environment overlays
 * - Cron and fixed-interval schedules shared across accounts
 * - Bounded per-account worker pools with drop-on-full submission
 * - Per-task log files next to the shared application log
 * - Run-once mode for cron-driven or manual invocations
 */
@SpringBootApplication
public class AutoCheckinApplication {

    public static void main(String[] args) {
        var context = SpringApplication.run(AutoCheckinApplication.class, args);
        if (context.isActive() && context.getBean(CheckinCommandRunner.class).isCompleted()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
