package io.stationkeeper.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Configuration file that may be rewritten at any time, typically by the
 * config distributor repointing the station alias.
 *
 * <p>The file is re-parsed only when its modification time moved since the
 * cached parse. Every stat and read happens while holding the shared
 * {@link ConfigLocks#CONFIGURATION} lock, the same lock the distributor holds
 * while it repoints the alias, so a read never sees a half-adopted file.
 */
public final class DynamicConfigSource implements ConfigSource {
    private final Path path;
    private final Map<String, String> variables;
    private final ReentrantLock lock;
    private FileTime parsedModifiedTime;
    private Path parsedTarget;
    private Map<String, Object> cached;

    public DynamicConfigSource(Path path) {
        this(path, null);
    }

    public DynamicConfigSource(Path path, Map<String, String> variables) {
        this(path, variables, ConfigLocks.configuration());
    }

    DynamicConfigSource(Path path, Map<String, String> variables, ReentrantLock lock) {
        this.path = path;
        this.variables = variables;
        this.lock = lock;
    }

    public Path path() {
        return path;
    }

    @Override
    public Map<String, Object> getGlobal() {
        lock.lock();
        try {
            FileTime modified = modifiedTime();
            Path target = realTarget();
            if (cached == null || !modified.equals(parsedModifiedTime) || !target.equals(parsedTarget)) {
                cached = ConfigDocuments.read(path, variables);
                parsedModifiedTime = modified;
                parsedTarget = target;
            }
            return ConfigDocuments.deepCopy(cached);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current modification time of the file (no parsing), or empty if it is gone.
     */
    @Override
    public Optional<FileTime> changeMarker() {
        lock.lock();
        try {
            return Optional.of(modifiedTime());
        } catch (ConfigurationException e) {
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Modification time the cached document was parsed at.
     */
    public Optional<FileTime> lastObserved() {
        lock.lock();
        try {
            return Optional.ofNullable(parsedModifiedTime);
        } finally {
            lock.unlock();
        }
    }

    // the alias is usually a symbolic link; repointing it changes the target even if mtimes collide
    private Path realTarget() {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new ConfigurationException("failed to resolve configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    private FileTime modifiedTime() {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("failed to find configuration file " + path);
        }
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new ConfigurationException("failed to stat configuration file " + path + ": " + e.getMessage(), e);
        }
    }
}
