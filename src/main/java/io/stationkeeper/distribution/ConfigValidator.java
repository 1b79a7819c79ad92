package io.stationkeeper.distribution;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.ConfigurationException;
import io.stationkeeper.config.MainSettings;
import io.stationkeeper.config.StaticConfigSource;
import io.stationkeeper.worker.WorkerCatalog;
import io.stationkeeper.worker.WorkerDescriptor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a configuration file may become the station configuration:
 * it parses, has a usable {@code main} section, requests only registered
 * worker kinds and every requested kind accepts its section.
 */
public final class ConfigValidator {
    private final WorkerCatalog catalog;
    private final Map<String, String> variables;

    public ConfigValidator(WorkerCatalog catalog, Map<String, String> variables) {
        this.catalog = catalog;
        this.variables = variables;
    }

    /**
     * @throws ConfigurationException listing every problem found
     */
    public void validate(Path file) {
        ConfigSource source = new StaticConfigSource(file, variables);
        validate(source);
    }

    public void validate(ConfigSource source) {
        MainSettings.from(source);
        List<WorkerDescriptor> descriptors = catalog.resolveStrict(source.getGlobal());
        List<String> errors = new ArrayList<>();
        for (WorkerDescriptor descriptor : descriptors) {
            Optional<String> error = descriptor.checkConfig(source);
            error.ifPresent(message -> errors.add(descriptor.key() + ": " + message));
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(String.join(" || ", errors));
        }
    }
}
