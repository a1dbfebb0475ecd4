package com.example.autocheckin.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Service-level settings for the check-in runner.
 * Loaded from application.yml; account and task settings live in the separate config file.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "checkin")
public class CheckinProperties {

    /**
     * Account/task configuration file used when --config is not given
     */
    @NotBlank
    private String configPath = "config.yaml";

    /**
     * Environment variable naming the overlay file, e.g. APP_ENV=prod selects config.prod.yaml
     */
    @NotBlank
    private String environmentVariable = "APP_ENV";

    /**
     * Prefix of environment variables that override config file values, e.g. TG_LOG_LEVEL
     */
    @NotBlank
    private String envPrefix = "TG";

    /**
     * Thread name prefix of the shared schedule engine
     */
    @NotBlank
    private String schedulerThreadName = "checkin-scheduler-";

    /**
     * How long an idle worker waits on the queue before re-checking cancellation
     */
    @Min(10)
    private long workerPollIntervalMs = 200;

    /**
     * How long shutdown waits for account sessions to wind down
     */
    @Min(1)
    private int shutdownGraceSeconds = 30;
}
