package io.stationkeeper.cli;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.ConfigurationException;
import io.stationkeeper.config.StationPaths;
import io.stationkeeper.runtime.StationRuntime;
import io.stationkeeper.util.Jsons;
import io.stationkeeper.util.SensitiveDataMasker;
import io.stationkeeper.worker.DeployTests;
import io.stationkeeper.worker.Supervisor;
import io.stationkeeper.worker.WorkerCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "stationkeeper",
        mixinStandardHelpOptions = true,
        version = "stationkeeper " + StationRuntime.VERSION,
        description = "Supervises the workers of a remote camera station",
        subcommands = {
                StationCommand.RunCommand.class,
                StationCommand.DeployTestCommand.class,
                StationCommand.CheckConfigCommand.class,
                StationCommand.ShowConfigCommand.class,
                StationCommand.WorkersCommand.class
        }
)
public final class StationCommand implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(StationCommand.class);

    @Option(names = {"--root"}, description = "Station folder (default: $STATIONKEEPER_ROOT or /opt/stationkeeper)")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | deploy-test | check-config | show-config | workers");
    }

    StationPaths paths() {
        return StationPaths.fromRoot(root);
    }

    StationRuntime runtime() {
        return StationRuntime.open(paths(), System.getenv());
    }

    StationRuntime installedRuntime() {
        return StationRuntime.open(paths().requireInstalled(), System.getenv());
    }

    @Command(name = "run", description = "Run the supervisor in the foreground until terminated")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        StationCommand parent;

        @Option(names = {"--shutdown-wait-ms"}, defaultValue = "120000",
                description = "How long the shutdown hook waits for workers to stop")
        long shutdownWaitMs;

        @Override
        public Integer call() {
            Supervisor supervisor = parent.installedRuntime().supervisor();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("termination signal received, stopping the supervisor");
                supervisor.requestStop();
                try {
                    if (!supervisor.awaitTermination(Duration.ofMillis(shutdownWaitMs))) {
                        LOG.error("supervisor did not terminate within {} ms", shutdownWaitMs);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "stationkeeper-shutdown-hook"));
            supervisor.run();
            return 0;
        }
    }

    @Command(name = "deploy-test", description = "Check the configuration and exercise every configured worker once")
    static final class DeployTestCommand implements Callable<Integer> {
        @ParentCommand
        StationCommand parent;

        @Override
        public Integer call() {
            StationRuntime runtime = parent.installedRuntime();
            Map<String, Optional<String>> results;
            try {
                results = DeployTests.run(runtime.configSource(), runtime.catalog());
            } catch (ConfigurationException e) {
                System.out.println("configuration error: " + e.getMessage());
                return 1;
            }
            boolean failed = false;
            for (Map.Entry<String, Optional<String>> entry : results.entrySet()) {
                System.out.println(entry.getKey() + ": " + entry.getValue().orElse("OK"));
                failed |= entry.getValue().isPresent();
            }
            return failed ? 1 : 0;
        }
    }

    @Command(name = "check-config", description = "Validate a candidate configuration file as the distributor would")
    static final class CheckConfigCommand implements Callable<Integer> {
        @ParentCommand
        StationCommand parent;

        @Parameters(index = "0", description = "Configuration file to validate")
        Path file;

        @Override
        public Integer call() {
            if (!Files.isRegularFile(file)) {
                System.out.println("file not found: " + file);
                return 1;
            }
            StationRuntime runtime = parent.runtime();
            WorkerCatalog catalog = runtime.catalog();
            try {
                runtime.validator(catalog).validate(file);
            } catch (ConfigurationException e) {
                System.out.println("invalid: " + e.getMessage());
                return 1;
            }
            System.out.println("valid: " + file);
            return 0;
        }
    }

    @Command(name = "show-config", description = "Print the current station configuration as JSON, secrets masked")
    static final class ShowConfigCommand implements Callable<Integer> {
        @ParentCommand
        StationCommand parent;

        @Override
        public Integer call() {
            ConfigSource source = parent.installedRuntime().configSource();
            System.out.println(Jsons.toJson(SensitiveDataMasker.masked(source.getGlobal())));
            return 0;
        }
    }

    @Command(name = "workers", description = "List the worker kinds this station can run")
    static final class WorkersCommand implements Callable<Integer> {
        @ParentCommand
        StationCommand parent;

        @Override
        public Integer call() {
            for (String key : parent.runtime().catalog().keys()) {
                System.out.println(key);
            }
            return 0;
        }
    }
}
