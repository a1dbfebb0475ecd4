package com.example.autocheckin.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.filter.Filter;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Helpers for file appenders attached to the root logger at runtime.
 * Both the shared app.log and per-task log files are built here so they share one format.
 */
public final class LogbackAppenders {

    public static final String TEXT_PATTERN =
            "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] [%X{account:-}] [%X{task:-}] %logger{36} - %msg%n";

    private LogbackAppenders() {
    }

    /**
     * The Logback context, if Logback is the bound SLF4J backend
     */
    public static Optional<LoggerContext> context() {
        var factory = LoggerFactory.getILoggerFactory();
        return factory instanceof LoggerContext context ? Optional.of(context) : Optional.empty();
    }

    /**
     * Create and start a file appender; the caller attaches it
     *
     * @param filter optional filter, started along with the appender
     */
    public static FileAppender<ILoggingEvent> startFileAppender(LoggerContext context, String name, Path file,
                                                                boolean json, Filter<ILoggingEvent> filter) {
        var appender = new FileAppender<ILoggingEvent>();
        appender.setContext(context);
        appender.setName(name);
        appender.setFile(file.toString());
        appender.setAppend(true);
        appender.setEncoder(startEncoder(context, json));
        if (filter != null) {
            filter.setContext(context);
            filter.start();
            appender.addFilter(filter);
        }
        appender.start();
        return appender;
    }

    private static Encoder<ILoggingEvent> startEncoder(LoggerContext context, boolean json) {
        if (json) {
            var encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
