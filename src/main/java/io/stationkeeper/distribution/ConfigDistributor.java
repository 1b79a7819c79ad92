package io.stationkeeper.distribution;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.ConfigValues;
import io.stationkeeper.config.ConfigurationException;
import io.stationkeeper.config.MainSettings;
import io.stationkeeper.status.StatusRegistry;
import io.stationkeeper.worker.CancellationToken;
import io.stationkeeper.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Keeps the station configuration in line with the newest versioned file a
 * remote store publishes.
 *
 * <p>A remote file is adopted only when its version is strictly higher than
 * every local one and it passes validation. Adoption repoints the station
 * alias under the configuration lock; the previous version is deleted
 * afterwards. Listing, download and validation problems are logged and leave
 * the local configuration untouched; they never fail the worker.
 */
public final class ConfigDistributor extends Worker {
    public static final String KEY = "ConfigDistributor";

    private static final Logger LOG = LoggerFactory.getLogger(ConfigDistributor.class);
    private static final DateTimeFormatter CHECK_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LocalConfigRepository repository;
    private final Path tmpDir;
    private final ConfigValidator validator;
    private final Function<String, RemoteConfigStore> stores;
    private final List<ConfigChangeListener> listeners;

    public ConfigDistributor(
            ConfigSource configSource,
            StatusRegistry statusRegistry,
            LocalConfigRepository repository,
            Path tmpDir,
            ConfigValidator validator,
            Function<String, RemoteConfigStore> stores,
            List<ConfigChangeListener> listeners
    ) {
        super(KEY, configSource, statusRegistry);
        this.repository = repository;
        this.tmpDir = tmpDir;
        this.validator = validator;
        this.stores = stores;
        this.listeners = List.copyOf(listeners);
    }

    /**
     * Validation of the {@code ConfigDistributor} section: {@code url} and
     * {@code update_every} are both required.
     *
     * @return the problem found, empty when the section is usable
     */
    public static Optional<String> checkConfig(ConfigSource configSource) {
        try {
            Map<String, Object> section = configSource.get(KEY);
            ConfigValues.requireString(section, "url");
            ConfigValues.requireSeconds(section, "update_every");
        } catch (ConfigurationException e) {
            return Optional.of(e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    protected void step(CancellationToken token) {
        Map<String, Object> section = configSource().get(KEY);
        String url = ConfigValues.requireString(section, "url");
        Duration updateEvery = ConfigValues.requireSeconds(section, "update_every");
        String prefix = MainSettings.from(configSource()).versionedPrefix();

        try {
            DistributionOutcome outcome = distribute(stores.apply(url), prefix);
            LOG.debug("distribution round: {}", outcome);
            status().removeMisc("last error");
        } catch (DistributionException e) {
            LOG.error("failed to update the configuration from {}: {}", url, e.getMessage());
            status().setMisc("last error", e.getMessage());
        }
        status().setMisc("current", repository.currentTarget().orElse("none"));
        status().setMisc("last check", LocalDateTime.now().format(CHECK_TIME));
        token.sleep(updateEvery);
    }

    /**
     * One distribution round against {@code store}.
     */
    public DistributionOutcome distribute(RemoteConfigStore store, String prefix) {
        List<String> remoteFiles = store.listFiles();
        Optional<String> remoteBest = VersionedConfigFile.best(remoteFiles, prefix);
        if (remoteBest.isEmpty()) {
            LOG.warn("no versioned configuration file with prefix '{}' found at {}", prefix, store.location());
            return DistributionOutcome.of(DistributionOutcome.Action.NO_REMOTE_FILE, null);
        }
        long remoteVersion = VersionedConfigFile.version(remoteBest.get(), prefix);
        Optional<String> localBest = repository.best(prefix);
        if (localBest.isPresent() && VersionedConfigFile.version(localBest.get(), prefix) >= remoteVersion) {
            return tidy(localBest.get(), prefix);
        }

        String filename = remoteBest.get();
        Path candidate = tmpDir.resolve(filename);
        try {
            Files.createDirectories(tmpDir);
        } catch (IOException e) {
            throw new DistributionException("failed to create " + tmpDir + ": " + e.getMessage(), e);
        }
        LOG.info("downloading {} from {}", filename, store.location());
        try {
            store.download(filename, candidate);
        } catch (DistributionException e) {
            deleteQuietly(candidate);
            throw e;
        }
        try {
            validator.validate(candidate);
        } catch (ConfigurationException e) {
            LOG.error("configuration file {} is not valid, discarding it: {}", filename, e.getMessage());
            deleteQuietly(candidate);
            return new DistributionOutcome(DistributionOutcome.Action.REJECTED, filename, e.getMessage());
        }
        try {
            repository.adopt(candidate, prefix);
        } catch (DistributionException e) {
            deleteQuietly(candidate);
            throw e;
        }
        LOG.info("configuration updated to {}", filename);
        notifyListeners(filename, remoteVersion);
        return DistributionOutcome.of(DistributionOutcome.Action.ADOPTED, filename);
    }

    private DistributionOutcome tidy(String localBest, String prefix) {
        if (repository.currentTarget().filter(localBest::equals).isPresent()) {
            return DistributionOutcome.of(DistributionOutcome.Action.UP_TO_DATE, localBest);
        }
        // a local file the alias does not point to yet was never validated by this process
        try {
            validator.validate(repository.folder().resolve(localBest));
        } catch (ConfigurationException e) {
            LOG.error("local configuration file {} is not valid, discarding it: {}", localBest, e.getMessage());
            repository.discard(localBest);
            return new DistributionOutcome(DistributionOutcome.Action.REJECTED, localBest, e.getMessage());
        }
        LOG.info("pointing the station configuration to the local file {}", localBest);
        repository.tidy(localBest, prefix);
        notifyListeners(localBest, VersionedConfigFile.version(localBest, prefix));
        return DistributionOutcome.of(DistributionOutcome.Action.UP_TO_DATE, localBest);
    }

    private void notifyListeners(String filename, long version) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigAdopted(filename, version);
            } catch (RuntimeException e) {
                LOG.error("configuration change listener failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Downloads the newest remote file into a scratch folder and validates it.
     * Nothing is adopted.
     */
    @Override
    public void deployTest() throws IOException {
        Map<String, Object> section = configSource().get(KEY);
        String url = ConfigValues.requireString(section, "url");
        String prefix = MainSettings.from(configSource()).versionedPrefix();
        RemoteConfigStore store = stores.apply(url);
        String best = VersionedConfigFile.best(store.listFiles(), prefix).orElseThrow(() -> new DistributionException(
                "no versioned configuration file with prefix '" + prefix + "' found at " + store.location()
        ));
        Path scratch = Files.createTempDirectory("stationkeeper-distribution");
        try {
            Path candidate = scratch.resolve(best);
            store.download(best, candidate);
            validator.validate(candidate);
            LOG.info("{}: {} downloaded and valid", KEY, best);
        } finally {
            deleteRecursively(scratch);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("failed to delete {}: {}", path, e.getMessage());
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            for (Path path : stream.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
