package com.example.autocheckin.service.config;

import com.example.autocheckin.config.CheckinProperties;
import com.example.autocheckin.domain.model.AppConfig;
import com.example.autocheckin.exception.ConfigException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;

/**
 * Reads the account/task configuration.
 * <p>
 * Sources, lowest priority first:
 * 1. the main file (config.yaml)
 * 2. the environment overlay file next to it (config.&lt;ENV&gt;.yaml) when the
 *    environment marker variable is set and the file exists
 * 3. prefixed environment variables
 */
@Slf4j
@Component
public class ConfigLoader {

    private final CheckinProperties properties;
    private final ConfigResolver configResolver;
    private final YAMLMapper mapper;

    public ConfigLoader(CheckinProperties properties, ConfigResolver configResolver) {
        this.properties = properties;
        this.configResolver = configResolver;
        this.mapper = YAMLMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public AppConfig load(Path path) {
        return load(path, System.getenv());
    }

    /**
     * @throws ConfigException if a file is missing or unreadable, or the merge is ambiguous
     */
    public AppConfig load(Path path, Map<String, String> environment) {
        var base = read(path);

        var overrides = new ArrayList<AppConfig>();
        var env = environment.get(properties.getEnvironmentVariable());
        if (env != null && !env.isBlank()) {
            var overlayPath = overlayPath(path, env.trim());
            if (Files.exists(overlayPath)) {
                log.info("Merging environment config {} (environment: {})", overlayPath, env.trim());
                overrides.add(read(overlayPath));
            } else {
                log.debug("No environment config at {}", overlayPath);
            }
        }

        var merged = configResolver.resolve(base, overrides);
        return new EnvironmentOverlay(mapper, properties.getEnvPrefix()).apply(merged, environment);
    }

    /**
     * config.yaml + "prod" -&gt; config.prod.yaml in the same directory
     */
    static Path overlayPath(Path path, String env) {
        var fileName = path.getFileName().toString();
        var dot = fileName.lastIndexOf('.');
        var name = dot > 0 ? fileName.substring(0, dot) : fileName;
        var ext = dot > 0 ? fileName.substring(dot) : "";
        return path.resolveSibling(name + "." + env + ext);
    }

    private AppConfig read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Config file not found: " + path);
        }
        try {
            var config = mapper.readValue(path.toFile(), AppConfig.class);
            return config != null ? config : new AppConfig();
        } catch (IOException e) {
            throw new ConfigException(String.format("Failed to read config file %s: %s", path, e.getMessage()), e);
        }
    }
}
