package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigSource;

import java.util.Optional;

/**
 * Side-effect free validation of a worker kind's configuration section.
 * Returns a human readable error, or empty when the section is usable.
 */
@FunctionalInterface
public interface ConfigCheck {
    Optional<String> check(ConfigSource configSource);

    static ConfigCheck none() {
        return source -> Optional.empty();
    }
}
