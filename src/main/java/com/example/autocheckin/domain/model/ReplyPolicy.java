package com.example.autocheckin.domain.model;

import lombok.Value;

import java.time.Duration;

/**
 * How long to wait for a remote reply and how deep to look for it.
 */
@Value
public class ReplyPolicy {

    public static final int DEFAULT_WAIT_SECONDS = 3;
    public static final int DEFAULT_HISTORY_LIMIT = 10;

    public static final ReplyPolicy DEFAULT = new ReplyPolicy(DEFAULT_WAIT_SECONDS, DEFAULT_HISTORY_LIMIT);

    int waitSeconds;
    int historyLimit;

    public Duration getWaitDuration() {
        return Duration.ofSeconds(waitSeconds);
    }
}
