package com.issuelake.pipeline.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One configured ingestion unit. Immutable for the duration of a run.
 */
public record SourceConfig(
        String name,
        SourceKind kind,
        Map<String, Object> options,
        String destination,
        String checkpointKey
) {

    public SourceConfig {
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public boolean hasCheckpointKey() {
        return checkpointKey != null && !checkpointKey.isBlank();
    }

    public String requiredOption(String key) {
        Object value = options.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Source " + name + " is missing required option: " + key);
        }
        return value.toString();
    }

    public String stringOption(String key, String defaultValue) {
        Object value = options.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public int intOption(String key, int defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Source " + name + " option " + key
                    + " is not an integer: " + value, e);
        }
    }

    public double doubleOption(String key, double defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Source " + name + " option " + key
                    + " is not a number: " + value, e);
        }
    }
}
