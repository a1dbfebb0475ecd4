package com.example.autocheckin.service.scheduler;

import com.example.autocheckin.exception.ScheduleException;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns schedule expressions into Spring triggers.
 * <p>
 * Supported forms:
 * - standard 5-field cron: {@code min hour day-of-month month day-of-week}
 * - descriptors: {@code @yearly @annually @monthly @weekly @daily @midnight @hourly}
 * - fixed intervals: {@code @every 1h30m}, first firing one interval after registration
 */
@Component
public class ScheduleExpressionParser {

    static final String EVERY_PREFIX = "@every ";

    private static final int CRON_FIELDS = 5;
    private static final Pattern DURATION = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|μs|ms|s|m|h)");

    /**
     * @throws ScheduleException if the expression is empty or malformed
     */
    public Trigger parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleException(String.valueOf(expression), "empty expression");
        }
        var trimmed = expression.trim();

        if (trimmed.toLowerCase(Locale.ROOT).startsWith(EVERY_PREFIX)) {
            var interval = parseDuration(trimmed, trimmed.substring(EVERY_PREFIX.length()).trim());
            var trigger = new PeriodicTrigger(interval);
            trigger.setFixedRate(true);
            trigger.setInitialDelay(interval);
            return trigger;
        }

        if (trimmed.startsWith("@")) {
            return cronTrigger(trimmed, trimmed.toLowerCase(Locale.ROOT));
        }

        var fields = trimmed.split("\\s+");
        if (fields.length != CRON_FIELDS) {
            throw new ScheduleException(trimmed,
                    String.format("expected exactly %d fields, found %d", CRON_FIELDS, fields.length));
        }
        // Spring cron expressions carry a leading seconds field
        return cronTrigger(trimmed, "0 " + String.join(" ", fields));
    }

    /**
     * Parse a duration such as {@code 1h30m}, {@code 45s} or {@code 1.5h}
     *
     * @throws ScheduleException if the text is not a positive duration
     */
    static Duration parseDuration(String expression, String text) {
        if (text.isEmpty()) {
            throw new ScheduleException(expression, "missing duration");
        }
        var matcher = DURATION.matcher(text);
        var total = BigDecimal.ZERO;
        var position = 0;
        while (position < text.length()) {
            matcher.region(position, text.length());
            if (!matcher.lookingAt()) {
                throw new ScheduleException(expression, "invalid duration '" + text + "'");
            }
            var amount = new BigDecimal(matcher.group(1));
            total = total.add(amount.multiply(BigDecimal.valueOf(nanosPerUnit(matcher.group(2)))));
            position = matcher.end();
        }

        long nanos;
        try {
            nanos = total.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            throw new ScheduleException(expression, "interval out of range");
        }
        if (nanos <= 0) {
            throw new ScheduleException(expression, "interval must be positive");
        }
        return Duration.ofNanos(nanos);
    }

    private static long nanosPerUnit(String unit) {
        return switch (unit) {
            case "ns" -> 1L;
            case "us", "µs", "μs" -> 1_000L;
            case "ms" -> 1_000_000L;
            case "s" -> 1_000_000_000L;
            case "m" -> 60_000_000_000L;
            default -> 3_600_000_000_000L;
        };
    }

    private static Trigger cronTrigger(String expression, String cron) {
        try {
            return new CronTrigger(cron);
        } catch (IllegalArgumentException e) {
            throw new ScheduleException(expression, e);
        }
    }
}
