package io.stationkeeper.config;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a configuration file once, at construction.
 */
public final class StaticConfigSource implements ConfigSource {
    private final Path path;
    private final Map<String, Object> document;

    public StaticConfigSource(Path path) {
        this(path, null);
    }

    public StaticConfigSource(Path path, Map<String, String> variables) {
        this.path = path;
        this.document = ConfigDocuments.read(path, variables);
    }

    public Path path() {
        return path;
    }

    @Override
    public Map<String, Object> getGlobal() {
        return ConfigDocuments.deepCopy(document);
    }

    @Override
    public Optional<FileTime> changeMarker() {
        return Optional.empty();
    }
}
