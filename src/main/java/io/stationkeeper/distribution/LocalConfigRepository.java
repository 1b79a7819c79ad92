package io.stationkeeper.distribution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The versioned configuration files of the station folder and the alias
 * (a symbolic link) that designates the current one.
 *
 * <p>The alias is repointed by creating a fresh link under a temporary name
 * and renaming it over the alias, so readers see either the old or the new
 * target, never a missing file. Every mutation holds the shared configuration
 * lock.
 */
public final class LocalConfigRepository {
    private static final Logger LOG = LoggerFactory.getLogger(LocalConfigRepository.class);

    private final Path folder;
    private final Path alias;
    private final ReentrantLock lock;

    public LocalConfigRepository(Path folder, Path alias, ReentrantLock lock) {
        this.folder = folder;
        this.alias = alias;
        this.lock = lock;
    }

    public Path folder() {
        return folder;
    }

    public Path alias() {
        return alias;
    }

    /**
     * Names of the valid versioned files present in the folder.
     */
    public List<String> versionedFiles(String prefix) {
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(folder)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder, prefix + "_*" + VersionedConfigFile.EXTENSION)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)
                        && VersionedConfigFile.isValid(name, prefix)) {
                    out.add(name);
                }
            }
        } catch (IOException e) {
            throw new DistributionException("failed to list " + folder + ": " + e.getMessage(), e);
        }
        out.sort(String::compareTo);
        return out;
    }

    public Optional<String> best(String prefix) {
        return VersionedConfigFile.best(versionedFiles(prefix), prefix);
    }

    /**
     * File name the alias currently points to, if the alias is a link into the folder.
     */
    public Optional<String> currentTarget() {
        if (!Files.isSymbolicLink(alias)) {
            return Optional.empty();
        }
        try {
            Path target = Files.readSymbolicLink(alias);
            Path fileName = target.getFileName();
            return fileName == null ? Optional.empty() : Optional.of(fileName.toString());
        } catch (IOException e) {
            LOG.warn("failed to read the link {}: {}", alias, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Moves {@code downloaded} into the folder, points the alias at it and deletes
     * every other versioned file. Runs entirely under the configuration lock.
     */
    public void adopt(Path downloaded, String prefix) {
        String filename = downloaded.getFileName().toString();
        lock.lock();
        try {
            Path target = folder.resolve(filename);
            try {
                Files.move(downloaded, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new DistributionException("failed to move " + downloaded + " to " + target + ": " + e.getMessage(), e);
            }
            repoint(filename);
            deleteOthers(filename, prefix);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Points the alias at {@code filename}, already present in the folder, and
     * deletes every other versioned file.
     */
    public void tidy(String filename, String prefix) {
        lock.lock();
        try {
            repoint(filename);
            deleteOthers(filename, prefix);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes one versioned file unless the alias points to it.
     */
    public void discard(String filename) {
        lock.lock();
        try {
            if (currentTarget().filter(filename::equals).isPresent()) {
                return;
            }
            Files.deleteIfExists(folder.resolve(filename));
        } catch (IOException e) {
            LOG.warn("failed to delete {}: {}", folder.resolve(filename), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private void repoint(String filename) {
        if (currentTarget().filter(filename::equals).isPresent()) {
            return;
        }
        Path link = alias.resolveSibling("." + alias.getFileName() + "." + UUID.randomUUID() + ".link");
        try {
            Files.createSymbolicLink(link, folder.resolve(filename));
            Files.move(link, alias, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(link);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new DistributionException("failed to point " + alias + " to " + filename + ": " + e.getMessage(), e);
        }
        LOG.info("{} now points to {}", alias, filename);
    }

    private void deleteOthers(String keep, String prefix) {
        for (String name : versionedFiles(prefix)) {
            if (name.equals(keep)) {
                continue;
            }
            try {
                Files.deleteIfExists(folder.resolve(name));
                LOG.info("deleted previous configuration file {}", name);
            } catch (IOException e) {
                LOG.warn("failed to delete previous configuration file {}: {}", name, e.getMessage());
            }
        }
    }
}
