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
 * One credentialed identity with its own task set, worker pool and queue.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AccountConfig {

    public static final int DEFAULT_WORKER_COUNT = 4;
    public static final int DEFAULT_TASK_QUEUE_SIZE = 100;

    private String name;

    private String phone;

    /**
     * Two-factor authentication password
     */
    private String password;

    private int appId;

    private String appHash;

    /**
     * Concurrent workers, non-positive means default (4)
     */
    private int workerCount;

    /**
     * Queue slots, non-positive means default (100)
     */
    private int taskQueueSize;

    private int replyWaitSeconds;

    private int replyHistoryLimit;

    @Builder.Default
    private List<TaskConfig> tasks = new ArrayList<>();

    public List<TaskConfig> getTasks() {
        return tasks != null ? tasks : List.of();
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    /**
     * Session name: the phone number, or session_&lt;app_id&gt; when no phone is set
     */
    @JsonIgnore
    public String getSessionName() {
        if (phone != null && !phone.isBlank()) {
            return phone;
        }
        return "session_" + appId;
    }

    /**
     * Human-readable label used in every log line of this account
     */
    @JsonIgnore
    public String getLabel() {
        var hasPhone = phone != null && !phone.isBlank();
        if (hasName() && hasPhone) {
            return String.format("%s(%s)", name, phone);
        }
        if (hasName()) {
            return name;
        }
        if (hasPhone) {
            return phone;
        }
        var session = getSessionName();
        return session.isBlank() ? "unknown_account" : session;
    }
}
