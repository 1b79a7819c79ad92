package io.stationkeeper.config;

import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Optional;

public final class InMemoryConfigSource implements ConfigSource {
    private final Map<String, Object> document;

    public InMemoryConfigSource(Map<String, ?> document) {
        this.document = ConfigDocuments.deepCopy(document);
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
