package io.stationkeeper.reporting;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.ConfigValues;
import io.stationkeeper.config.ConfigurationException;
import io.stationkeeper.status.StatusRegistry;
import io.stationkeeper.status.StatusReport;
import io.stationkeeper.worker.CancellationToken;
import io.stationkeeper.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Periodically summarizes every worker status of the registry into
 * {@code status.txt} and hands the report to the configured callbacks.
 */
public final class StatusReporter extends Worker {
    public static final String KEY = "StatusReporter";
    public static final String REPORT_FILE = "status.txt";

    private static final Logger LOG = LoggerFactory.getLogger(StatusReporter.class);

    private final StatusRegistry statusRegistry;
    private final String version;
    private final Path diskRoot;
    private final List<StatusReportCallback> callbacks;
    private final Clock clock;

    public StatusReporter(
            ConfigSource configSource,
            StatusRegistry statusRegistry,
            String version,
            Path diskRoot,
            List<StatusReportCallback> callbacks
    ) {
        this(configSource, statusRegistry, version, diskRoot, callbacks, Clock.systemDefaultZone());
    }

    StatusReporter(
            ConfigSource configSource,
            StatusRegistry statusRegistry,
            String version,
            Path diskRoot,
            List<StatusReportCallback> callbacks,
            Clock clock
    ) {
        super(KEY, configSource, statusRegistry);
        this.statusRegistry = statusRegistry;
        this.version = version;
        this.diskRoot = diskRoot;
        this.callbacks = List.copyOf(callbacks);
        this.clock = clock;
    }

    public static Optional<String> checkConfig(ConfigSource configSource) {
        try {
            Map<String, Object> section = configSource.get(KEY);
            ConfigValues.requireSeconds(section, "update_every");
            ConfigValues.requireString(section, "folder");
        } catch (ConfigurationException e) {
            return Optional.of(e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    protected void step(CancellationToken token) throws IOException {
        Map<String, Object> section = configSource().get(KEY);
        Duration updateEvery = ConfigValues.requireSeconds(section, "update_every");
        Path folder = Paths.get(ConfigValues.requireString(section, "folder"));
        status().setMisc("status report expected every (seconds)", String.valueOf(updateEvery.toMillis() / 1000.0));

        StatusReport report = report();
        write(folder, report);
        for (StatusReportCallback callback : callbacks) {
            try {
                callback.onReport(report);
            } catch (RuntimeException e) {
                LOG.error("status report callback failed: {}", e.getMessage(), e);
            }
        }
        token.sleepUntilConfigChange(updateEvery);
    }

    public StatusReport report() {
        return StatusReport.of(statusRegistry.snapshot(), clock.instant(), version, diskRoot);
    }

    @Override
    public void deployTest() throws IOException {
        Path folder = Paths.get(ConfigValues.requireString(configSource().get(KEY), "folder"));
        Files.createDirectories(folder);
        if (!Files.isWritable(folder)) {
            throw new ConfigurationException("status folder " + folder + " is not writable");
        }
    }

    private static void write(Path folder, StatusReport report) throws IOException {
        Files.createDirectories(folder);
        Path target = folder.resolve(REPORT_FILE);
        Path tmp = folder.resolve("." + REPORT_FILE + ".tmp");
        Files.writeString(tmp, report.text(), StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
