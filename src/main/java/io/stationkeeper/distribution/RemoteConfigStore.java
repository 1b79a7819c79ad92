package io.stationkeeper.distribution;

import java.nio.file.Path;
import java.util.List;

/**
 * A place versioned configuration files are published to.
 */
public interface RemoteConfigStore {
    /**
     * Names of every file currently published.
     */
    List<String> listFiles();

    /**
     * Copies {@code filename} to {@code target}, replacing it.
     */
    void download(String filename, Path target);

    String location();
}
