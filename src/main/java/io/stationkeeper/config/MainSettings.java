package io.stationkeeper.config;

import java.time.Duration;
import java.util.Map;

/**
 * Settings of the {@code main} section.
 *
 * @param period          delay between two reconciliation cycles
 * @param stopTimeout     how long shutdown waits for one worker before interrupting it
 * @param versionedPrefix prefix of versioned configuration file names
 */
public record MainSettings(Duration period, Duration stopTimeout, String versionedPrefix) {
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(30);

    public static MainSettings from(ConfigSource source) {
        return from(source.getGlobal());
    }

    @SuppressWarnings("unchecked")
    public static MainSettings from(Map<String, Object> document) {
        Object raw = document.get(ConfigDocuments.MAIN);
        if (!(raw instanceof Map)) {
            throw new ConfigurationException("failed to find the required table 'main' in the configuration");
        }
        Map<String, Object> main = (Map<String, Object>) raw;
        Duration period;
        try {
            period = ConfigValues.requireSeconds(main, "period");
        } catch (ConfigurationException e) {
            throw new ConfigurationException("invalid main configuration: " + e.getMessage());
        }
        if (period.isZero()) {
            throw new ConfigurationException("invalid main configuration: 'period' must be positive");
        }
        Duration stopTimeout = ConfigValues.optionalSeconds(main, "stop_timeout", DEFAULT_STOP_TIMEOUT);
        String prefix = ConfigValues.optionalString(main, "versioned_prefix")
                .filter(value -> !value.isBlank())
                .orElse(StationPaths.DEFAULT_VERSIONED_PREFIX);
        return new MainSettings(period, stopTimeout, prefix);
    }
}
