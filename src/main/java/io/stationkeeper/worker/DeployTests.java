package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.MainSettings;
import io.stationkeeper.status.StatusRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pre-deployment verification: every worker kind the configuration requests is
 * built, its configuration checked, and its {@link Worker#deployTest()} run
 * once. Workers are never started.
 */
public final class DeployTests {
    private static final Logger LOG = LoggerFactory.getLogger(DeployTests.class);

    private DeployTests() {
    }

    /**
     * @return error per worker kind key, in configuration order; empty means the kind passed
     * @throws io.stationkeeper.config.ConfigurationException if {@code main} is unusable or a key does not resolve
     */
    public static Map<String, Optional<String>> run(ConfigSource configSource, WorkerCatalog catalog) {
        MainSettings.from(configSource);
        List<WorkerDescriptor> descriptors = catalog.resolveStrict(configSource.getGlobal());
        StatusRegistry scratch = new StatusRegistry();
        Map<String, Optional<String>> results = new LinkedHashMap<>();
        for (WorkerDescriptor descriptor : descriptors) {
            LOG.info("testing {}", descriptor.key());
            Optional<String> configError = descriptor.checkConfig(configSource);
            if (configError.isPresent()) {
                LOG.error("{}: configuration error: {}", descriptor.key(), configError.get());
                results.put(descriptor.key(), configError.map(e -> "configuration error: " + e));
                continue;
            }
            try {
                Worker worker = descriptor.factory().create(configSource, scratch);
                worker.deployTest();
                results.put(descriptor.key(), Optional.empty());
            } catch (Exception e) {
                LOG.error("{}: deploy test failed: {}", descriptor.key(), Worker.describe(e));
                results.put(descriptor.key(), Optional.of(Worker.describe(e)));
            }
        }
        return results;
    }
}
