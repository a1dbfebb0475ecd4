package com.example.autocheckin;

import com.example.autocheckin.config.CheckinProperties;
import com.example.autocheckin.config.LoggingSetup;
import com.example.autocheckin.domain.model.AppConfig;
import com.example.autocheckin.exception.ConfigException;
import com.example.autocheckin.exception.RunOnceException;
import com.example.autocheckin.service.config.ConfigLoader;
import com.example.autocheckin.service.session.SessionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point.
 * <p>
 * Options:
 * - {@code --once}: run every enabled task once and exit
 * - {@code --log-level=<level>}: overrides log.level from the config file
 * - {@code --config=<path>}: account/task configuration file
 * <p>
 * Without {@code --once} the runner returns after starting the account sessions;
 * the application then keeps running until its context is closed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckinCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String ONCE_OPTION = "once";
    static final String LOG_LEVEL_OPTION = "log-level";
    static final String CONFIG_OPTION = "config";

    private final CheckinProperties properties;
    private final ConfigLoader configLoader;
    private final LoggingSetup loggingSetup;
    private final SessionOrchestrator orchestrator;

    private int exitCode;
    private boolean completed = true;

    @Override
    public void run(ApplicationArguments args) {
        var once = args.containsOption(ONCE_OPTION);
        var levelOverride = optionValue(args, LOG_LEVEL_OPTION);
        var configPath = optionValue(args, CONFIG_OPTION);
        if (configPath == null || configPath.isBlank()) {
            configPath = properties.getConfigPath();
        }

        AppConfig config;
        try {
            config = configLoader.load(Path.of(configPath));
        } catch (ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            exitCode = 1;
            return;
        }

        loggingSetup.apply(config.getLog(), levelOverride);
        logStartup(config, configPath, once);

        var token = orchestrator.getProcessToken();
        if (once) {
            try {
                orchestrator.runOnce(config, token);
                log.info(token.isCancelled() ? "Tasks cancelled" : "All tasks completed, exiting");
            } catch (RunOnceException e) {
                log.error("Task execution failed: {}", e.getMessage());
                exitCode = 1;
            }
            return;
        }

        orchestrator.runForever(config, token);
        completed = false;
    }

    /**
     * @return false while the service keeps running in daemon mode
     */
    public boolean isCompleted() {
        return completed;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void logStartup(AppConfig config, String configPath, boolean once) {
        log.info("Language initialized: {}", config.getEffectiveLanguage());

        var environment = System.getenv(properties.getEnvironmentVariable());
        if (environment != null && !environment.isBlank()) {
            log.info("Using environment-specific config: {}", environment);
        }

        log.info("Configuration loaded successfully: accounts={}, onceMode={}, config={}, logFormat={}, logLevel={}, proxy={}",
                config.getAccounts().size(), once, configPath,
                config.getLog().getEffectiveFormat(), config.getLog().getLevel(), config.getProxy());
    }

    private static String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
