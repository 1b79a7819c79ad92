package io.stationkeeper.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Typed reads from a worker-scoped configuration section.
 */
public final class ConfigValues {
    private ConfigValues() {
    }

    public static Object require(Map<String, Object> section, String key) {
        Object value = section.get(key);
        if (value == null) {
            throw new ConfigurationException("failed to find the required key '" + key + "'");
        }
        return value;
    }

    public static String requireString(Map<String, Object> section, String key) {
        return String.valueOf(require(section, key));
    }

    public static Optional<String> optionalString(Map<String, Object> section, String key) {
        Object value = section.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public static double requireDouble(Map<String, Object> section, String key) {
        return toDouble(key, require(section, key));
    }

    public static Duration requireSeconds(Map<String, Object> section, String key) {
        double seconds = requireDouble(section, key);
        if (seconds < 0) {
            throw new ConfigurationException("the value of the key '" + key + "' (" + seconds + ") must not be negative");
        }
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    public static Duration optionalSeconds(Map<String, Object> section, String key, Duration fallback) {
        if (!section.containsKey(key)) {
            return fallback;
        }
        return requireSeconds(section, key);
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "failed to cast the value of the key '" + key + "' (" + value + ") to a float"
            );
        }
    }
}
