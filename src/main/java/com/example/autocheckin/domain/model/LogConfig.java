package com.example.autocheckin.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Logging section of config.yaml
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogConfig {

    public static final String DEFAULT_DIR = "./log";
    public static final String DEFAULT_LEVEL = "info";
    public static final String DEFAULT_FORMAT = "text";

    private String dir;

    /**
     * debug | info | warn | error
     */
    private String level;

    /**
     * text (console pattern) or json
     */
    private String format;

    @JsonIgnore
    public String getEffectiveDir() {
        return dir == null || dir.isBlank() ? DEFAULT_DIR : dir;
    }

    @JsonIgnore
    public String getEffectiveFormat() {
        return format == null || format.isBlank() ? DEFAULT_FORMAT : format.trim().toLowerCase();
    }

    @JsonIgnore
    public boolean isJson() {
        return "json".equals(getEffectiveFormat());
    }
}
