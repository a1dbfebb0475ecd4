package com.example.autocheckin.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Task entry as written in config.yaml.
 * <p>
 * {@code enabled} is a wrapper type so that "absent" (enabled) can be told
 * apart from an explicit {@code false} when overlays are merged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TaskConfig {

    private String name;

    /**
     * Target username or id
     */
    private String target;

    /**
     * message | button
     */
    private String method;

    /**
     * Message text or button label
     */
    private String payload;

    /**
     * 5-field cron, @every &lt;duration&gt; or a descriptor such as @daily; empty means not time-triggered
     */
    private String schedule;

    private Boolean enabled;

    private boolean runOnStart;

    private int replyWaitSeconds;

    private int replyHistoryLimit;

    @JsonIgnore
    public boolean isEffectivelyEnabled() {
        return enabled == null || enabled;
    }
}
