package com.example.autocheckin.service.config;

import com.example.autocheckin.domain.model.AppConfig;
import com.example.autocheckin.exception.ConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Overrides configuration values from environment variables.
 * <p>
 * Every value path of the configuration maps to one variable name:
 * prefix + "_" + path with "." replaced by "_", upper-cased, list indices
 * included as segments. Examples: TG_LOG_LEVEL, TG_APP_ID,
 * TG_ACCOUNTS_0_PHONE, TG_ACCOUNTS_0_TASKS_1_PAYLOAD.
 * <p>
 * Only paths that exist in the configuration can be overridden; list
 * entries cannot be created from the environment.
 */
@Slf4j
public class EnvironmentOverlay {

    private final ObjectMapper mapper;
    private final String prefix;

    public EnvironmentOverlay(ObjectMapper mapper, String prefix) {
        this.mapper = mapper;
        this.prefix = prefix.toUpperCase(Locale.ROOT);
    }

    public AppConfig apply(AppConfig config, Map<String, String> environment) {
        ObjectNode tree = mapper.valueToTree(config);
        var applied = overlay(tree, prefix, environment);
        if (applied == 0) {
            return config;
        }

        log.info("Applied {} configuration override(s) from {}_* environment variables", applied, prefix);
        try {
            return mapper.treeToValue(tree, AppConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid configuration value in environment override: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Variable name for a dotted configuration path, e.g. "log.level" -&gt; "TG_LOG_LEVEL"
     */
    public String variableName(String path) {
        return prefix + "_" + path.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private int overlay(JsonNode node, String key, Map<String, String> environment) {
        var applied = 0;
        if (node instanceof ObjectNode object) {
            for (var field : fieldNames(object)) {
                var childKey = key + "_" + field.toUpperCase(Locale.ROOT);
                var child = object.get(field);
                if (child.isContainerNode()) {
                    applied += overlay(child, childKey, environment);
                } else if (environment.containsKey(childKey)) {
                    object.set(field, TextNode.valueOf(environment.get(childKey)));
                    log.debug("Overriding {} from environment", childKey);
                    applied++;
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (var i = 0; i < array.size(); i++) {
                var childKey = key + "_" + i;
                var child = array.get(i);
                if (child.isContainerNode()) {
                    applied += overlay(child, childKey, environment);
                } else if (environment.containsKey(childKey)) {
                    array.set(i, TextNode.valueOf(environment.get(childKey)));
                    applied++;
                }
            }
        }
        return applied;
    }

    private static List<String> fieldNames(ObjectNode object) {
        var names = new ArrayList<String>();
        object.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
