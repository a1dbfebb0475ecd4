package com.example.autocheckin.config;

import ch.qos.logback.classic.Logger;
import com.example.autocheckin.domain.model.LogConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Applies the resolved log settings once the account configuration is known:
 * the level (command line wins over config) and the shared app.log in the log directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingSetup {

    static final String APP_LOG_APPENDER = "CHECKIN_APP_FILE";
    static final String APP_LOG_FILE = "app.log";

    private final LoggingSystem loggingSystem;

    public void apply(LogConfig logConfig, String levelOverride) {
        var level = resolveLevel(levelOverride != null && !levelOverride.isBlank()
                ? levelOverride
                : logConfig.getLevel());
        loggingSystem.setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, level);
        attachAppLog(logConfig);
        log.info("Logging configured: level={}, format={}, dir={}",
                level, logConfig.getEffectiveFormat(), logConfig.getEffectiveDir());
    }

    /**
     * Map a config level name to a Spring Boot level; unknown names fall back to INFO
     */
    static LogLevel resolveLevel(String name) {
        if (name == null || name.isBlank()) {
            return LogLevel.INFO;
        }
        var normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return LogLevel.WARN;
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown log level '{}', using INFO", name);
            return LogLevel.INFO;
        }
    }

    private void attachAppLog(LogConfig logConfig) {
        var context = LogbackAppenders.context().orElse(null);
        if (context == null) {
            log.warn("Logback is not the active logging backend, app.log disabled");
            return;
        }
        var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root.getAppender(APP_LOG_APPENDER) != null) {
            return;
        }
        var file = Path.of(logConfig.getEffectiveDir()).resolve(APP_LOG_FILE);
        try {
            Files.createDirectories(file.getParent());
        } catch (IOException e) {
            log.error("Failed to create log directory {}, app.log disabled: {}", file.getParent(), e.getMessage());
            return;
        }
        root.addAppender(LogbackAppenders.startFileAppender(context, APP_LOG_APPENDER, file, logConfig.isJson(), null));
    }
}
