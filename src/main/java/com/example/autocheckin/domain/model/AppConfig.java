package com.example.autocheckin.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the account/task configuration file (config.yaml).
 * <p>
 * Global values act as fallbacks for account and task level settings:
 * - app_id / app_hash when an account carries none
 * - reply_wait_seconds / reply_history_limit below account and task overrides
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AppConfig {

    @Builder.Default
    private List<AccountConfig> accounts = new ArrayList<>();

    /**
     * Proxy URL handed to every messenger session, e.g. socks5://127.0.0.1:1080
     */
    private String proxy;

    private int appId;

    private String appHash;

    /**
     * Seconds to wait for a reply after an action
     */
    private int replyWaitSeconds;

    /**
     * Number of recent messages inspected when looking for a reply
     */
    private int replyHistoryLimit;

    @Builder.Default
    private LogConfig log = new LogConfig();

    /**
     * en | zh, default en
     */
    private String language;

    public List<AccountConfig> getAccounts() {
        return accounts != null ? accounts : List.of();
    }

    public LogConfig getLog() {
        return log != null ? log : new LogConfig();
    }

    @JsonIgnore
    public String getEffectiveLanguage() {
        return language == null || language.isBlank() ? "en" : language.trim();
    }
}
