package io.stationkeeper.runtime;

import io.stationkeeper.command.CommandCallback;
import io.stationkeeper.command.CommandExecutor;
import io.stationkeeper.command.LoggingCommandCallback;
import io.stationkeeper.config.ConfigDocuments;
import io.stationkeeper.config.ConfigLocks;
import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.DynamicConfigSource;
import io.stationkeeper.config.StationPaths;
import io.stationkeeper.distribution.ConfigChangeListener;
import io.stationkeeper.distribution.ConfigDistributor;
import io.stationkeeper.distribution.ConfigValidator;
import io.stationkeeper.distribution.LocalConfigRepository;
import io.stationkeeper.distribution.RemoteConfigStores;
import io.stationkeeper.reporting.StatusReportCallback;
import io.stationkeeper.reporting.StatusReporter;
import io.stationkeeper.status.LoggingStatusCallback;
import io.stationkeeper.status.StatusChangeCallback;
import io.stationkeeper.status.StatusJournal;
import io.stationkeeper.status.StatusRegistry;
import io.stationkeeper.worker.Supervisor;
import io.stationkeeper.worker.WorkerCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wires one station: its folder layout, templating variables, the catalog of
 * worker kinds and the callbacks statuses, commands and reports are pushed to.
 */
public final class StationRuntime {
    public static final String VERSION = "0.1.0";

    private static final Logger LOG = LoggerFactory.getLogger(StationRuntime.class);

    private final StationPaths paths;
    private final Map<String, String> variables;
    private final List<StatusChangeCallback> statusCallbacks = new ArrayList<>();
    private final List<CommandCallback> commandCallbacks = new ArrayList<>();
    private final List<StatusReportCallback> reportCallbacks = new ArrayList<>();
    private final List<ConfigChangeListener> configListeners = new ArrayList<>();

    public StationRuntime(StationPaths paths, Map<String, String> variables) {
        this.paths = paths;
        this.variables = Map.copyOf(variables);
        statusCallbacks.add(new LoggingStatusCallback());
        commandCallbacks.add(new LoggingCommandCallback());
        configListeners.add((filename, version) -> LOG.info("station configuration is now {} (version {})", filename, version));
    }

    /**
     * Runtime of the station installed at {@code paths}, with templating variables
     * taken from its {@code globals.toml}, the {@code STATION_*} environment and the host name.
     */
    public static StationRuntime open(StationPaths paths, Map<String, String> environment) {
        return new StationRuntime(paths, ConfigDocuments.stationVariables(paths.globalsFile(), environment));
    }

    public StationPaths paths() {
        return paths;
    }

    public Map<String, String> variables() {
        return variables;
    }

    public StationRuntime addStatusCallback(StatusChangeCallback callback) {
        statusCallbacks.add(callback);
        return this;
    }

    public StationRuntime addCommandCallback(CommandCallback callback) {
        commandCallbacks.add(callback);
        return this;
    }

    public StationRuntime addReportCallback(StatusReportCallback callback) {
        reportCallbacks.add(callback);
        return this;
    }

    public StationRuntime addConfigListener(ConfigChangeListener listener) {
        configListeners.add(listener);
        return this;
    }

    /**
     * Dynamic source on the station alias, sharing the configuration lock with the distributor.
     */
    public ConfigSource configSource() {
        return new DynamicConfigSource(paths.configAlias(), variables);
    }

    /**
     * Registry pushing to the registered callbacks, then to the station's status journal.
     */
    public StatusRegistry statusRegistry() {
        List<StatusChangeCallback> callbacks = new ArrayList<>(statusCallbacks);
        callbacks.add(new StatusJournal(paths.statusJournal()));
        return new StatusRegistry(callbacks);
    }

    public ConfigValidator validator(WorkerCatalog catalog) {
        return new ConfigValidator(catalog, variables);
    }

    /**
     * Every worker kind shipped with the station.
     */
    public WorkerCatalog catalog() {
        WorkerCatalog catalog = new WorkerCatalog();
        ConfigValidator validator = validator(catalog);
        List<CommandCallback> commands = List.copyOf(commandCallbacks);
        List<StatusReportCallback> reports = List.copyOf(reportCallbacks);
        List<ConfigChangeListener> listeners = List.copyOf(configListeners);
        catalog.register(
                ConfigDistributor.KEY,
                (source, registry) -> new ConfigDistributor(
                        source,
                        registry,
                        new LocalConfigRepository(paths.rootDir(), paths.configAlias(), ConfigLocks.configuration()),
                        paths.tmpDir(),
                        validator,
                        RemoteConfigStores::forUrl,
                        listeners
                ),
                ConfigDistributor::checkConfig
        );
        catalog.register(
                CommandExecutor.KEY,
                (source, registry) -> new CommandExecutor(
                        source, registry, paths.commandDir(), paths.localCommandScript(), commands
                ),
                source -> CommandExecutor.checkConfig(source, paths.commandDir())
        );
        catalog.register(
                StatusReporter.KEY,
                (source, registry) -> new StatusReporter(source, registry, VERSION, paths.rootDir(), reports),
                StatusReporter::checkConfig
        );
        return catalog;
    }

    public Supervisor supervisor() {
        return new Supervisor(configSource(), catalog(), statusRegistry());
    }
}
