package io.stationkeeper.config;

import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Optional;

/**
 * Yields the current station configuration document.
 *
 * <p>Every returned mapping is a private deep copy; callers may mutate it freely.
 */
public interface ConfigSource {

    /**
     * The full document: {@code main} plus one section per worker kind.
     */
    Map<String, Object> getGlobal();

    /**
     * The section whose top-level key equals {@code name} or ends with it.
     *
     * @throws ConfigNotFoundException when no key matches
     */
    default Map<String, Object> get(String name) {
        return ConfigDocuments.section(getGlobal(), name);
    }

    /**
     * Modification time of the backing file, if the source has one. A value that
     * differs from an earlier reading means the document has been rewritten.
     */
    Optional<FileTime> changeMarker();
}
