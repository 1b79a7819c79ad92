package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.ConfigurationException;

import java.util.Objects;
import java.util.Optional;

/**
 * A worker kind: the configuration key that requests it, how to build it and
 * how to validate its configuration section.
 */
public record WorkerDescriptor(String key, WorkerFactory factory, ConfigCheck configCheck) {
    public WorkerDescriptor {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("worker key cannot be empty");
        }
        Objects.requireNonNull(factory, "factory");
        configCheck = configCheck == null ? ConfigCheck.none() : configCheck;
    }

    /**
     * Runs the kind's validation, turning any exception into an error message.
     */
    public Optional<String> checkConfig(ConfigSource configSource) {
        try {
            return configCheck.check(configSource);
        } catch (ConfigurationException e) {
            return Optional.of(e.getMessage());
        } catch (RuntimeException e) {
            return Optional.of(key + ": " + Worker.describe(e));
        }
    }
}
