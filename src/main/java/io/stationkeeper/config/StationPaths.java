package io.stationkeeper.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * File layout of one station folder.
 */
public final class StationPaths {
    public static final String DEFAULT_ROOT = "/opt/stationkeeper";
    public static final String ROOT_ENV = "STATIONKEEPER_ROOT";
    public static final String DEFAULT_ALIAS = "station_config.toml";
    public static final String DEFAULT_VERSIONED_PREFIX = "station";

    private final Path rootDir;

    public StationPaths(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static StationPaths fromRoot(String root) {
        String raw = root;
        if (raw == null || raw.isBlank()) {
            raw = System.getenv(ROOT_ENV);
        }
        Path resolved = raw == null || raw.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(raw);
        Path absolute = resolved.toAbsolutePath().normalize();
        if (Files.isSymbolicLink(absolute)) {
            try {
                absolute = absolute.toRealPath();
            } catch (IOException e) {
                throw new IllegalStateException("station folder link " + absolute + " can not be resolved", e);
            }
        }
        return new StationPaths(absolute);
    }

    /**
     * Fails fast when the station folder or its configuration alias is missing;
     * nothing can be supervised without them.
     */
    public StationPaths requireInstalled() {
        if (!Files.isDirectory(rootDir)) {
            throw new IllegalStateException("station folder " + rootDir + " not found");
        }
        if (!Files.isRegularFile(configAlias())) {
            throw new IllegalStateException("station configuration file " + configAlias() + " not found");
        }
        return this;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path configAlias() {
        return rootDir.resolve(DEFAULT_ALIAS);
    }

    public Path globalsFile() {
        return rootDir.resolve("globals.toml");
    }

    public Path tmpDir() {
        return rootDir.resolve("tmp");
    }

    public Path commandDir() {
        return rootDir.resolve("command");
    }

    public Path localCommandScript() {
        return rootDir.resolve("command.sh");
    }

    public Path journalDir() {
        return rootDir.resolve("journal");
    }

    public Path statusJournal() {
        return journalDir().resolve("status.jsonl");
    }
}
