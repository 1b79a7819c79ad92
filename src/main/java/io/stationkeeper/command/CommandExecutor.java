package io.stationkeeper.command;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.ConfigurationException;
import io.stationkeeper.status.StatusRegistry;
import io.stationkeeper.worker.CancellationToken;
import io.stationkeeper.worker.TaskChannel;
import io.stationkeeper.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs shell commands sent to the station, one at a time.
 *
 * <p>Each step first collects the outcome of the command in flight, if any,
 * then, when nothing is in flight, accepts the next request: the local
 * {@code command.sh} script when it has content, otherwise whatever the
 * configured channel hands out. Requests seen while a command is in flight
 * stay where they are until it completes. A command runs on its own thread so
 * that polling is never blocked by it; its result goes back to the channel it
 * came from and to every callback, exactly once.
 */
public final class CommandExecutor extends Worker {
    public static final String KEY = "CommandExecutor";
    public static final String LOCAL_COMMAND_ID = "local";

    private static final Logger LOG = LoggerFactory.getLogger(CommandExecutor.class);

    private final Path defaultFolder;
    private final Path localScript;
    private final List<CommandCallback> callbacks;
    private final ReentrantLock inFlightLock = new ReentrantLock();
    private CommandSettings channelSettings;
    private CommandChannel channel;
    private CommandRun inFlight;
    private CommandChannel inFlightOrigin;
    private CommandResult previousResult;
    private CommandRequest previousRequest;

    public CommandExecutor(
            ConfigSource configSource,
            StatusRegistry statusRegistry,
            Path defaultFolder,
            Path localScript,
            List<CommandCallback> callbacks
    ) {
        super(KEY, configSource, statusRegistry, List.of("hammer_and_wrench"));
        this.defaultFolder = defaultFolder;
        this.localScript = localScript;
        this.callbacks = List.copyOf(callbacks);
    }

    public static Optional<String> checkConfig(ConfigSource configSource, Path defaultFolder) {
        try {
            CommandSettings.from(configSource.get(KEY), defaultFolder);
        } catch (ConfigurationException e) {
            return Optional.of(e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    protected void step(CancellationToken token) {
        CommandSettings settings = CommandSettings.from(configSource().get(KEY), defaultFolder);
        inFlightLock.lock();
        try {
            collect();
            if (inFlight == null) {
                Optional<CommandRequest> local = takeLocalScript();
                if (local.isPresent()) {
                    launch(local.get(), null, settings);
                } else {
                    CommandChannel current = channel(settings);
                    Optional<CommandRequest> request = current.poll(previousRequest);
                    if (request.isPresent()) {
                        previousRequest = request.get();
                        launch(request.get(), current, settings);
                    }
                }
            }
            updateMisc();
        } finally {
            inFlightLock.unlock();
        }
        token.sleep(settings.updateEvery());
    }

    @Override
    public void deployTest() {
        CommandSettings settings = CommandSettings.from(configSource().get(KEY), defaultFolder);
        try (CommandChannel probe = settings.openChannel()) {
            probe.probe();
            LOG.info("{}: command channel {} reachable", KEY, probe.describe());
        }
    }

    @Override
    protected void onExit() {
        inFlightLock.lock();
        try {
            if (inFlight != null) {
                LOG.warn("{}: stopping while command {} is running, killing it", KEY, inFlight.request().commandId());
                inFlight.cancel();
                inFlight = null;
                inFlightOrigin = null;
            }
            if (channel != null) {
                channel.close();
                channel = null;
            }
        } finally {
            inFlightLock.unlock();
        }
    }

    /**
     * Whether a command is currently in flight.
     */
    public boolean busy() {
        inFlightLock.lock();
        try {
            return inFlight != null;
        } finally {
            inFlightLock.unlock();
        }
    }

    private CommandChannel channel(CommandSettings settings) {
        if (channel == null || !settings.sameChannel(channelSettings)) {
            if (channel != null) {
                channel.close();
            }
            if (!settings.sameChannel(channelSettings)) {
                // the last consumed request is kept across restarts of this worker, not across endpoints
                previousRequest = null;
            }
            channel = settings.openChannel();
            channelSettings = settings;
            LOG.info("{}: polling commands from {}", KEY, channel.describe());
        }
        return channel;
    }

    private void launch(CommandRequest request, CommandChannel origin, CommandSettings settings) {
        LOG.info("{}: executing command {}", KEY, request.commandId());
        inFlight = CommandRun.start(request, settings.commandTimeout());
        inFlightOrigin = origin;
    }

    @SuppressWarnings("unchecked")
    private void collect() {
        if (inFlight == null) {
            return;
        }
        TaskChannel<CommandResult> messages = inFlight.channel();
        Optional<TaskChannel.TaskMessage<CommandResult>> message = messages.poll();
        CommandResult result = null;
        while (message.isPresent()) {
            TaskChannel.TaskMessage<CommandResult> m = message.get();
            if (m instanceof TaskChannel.TaskMessage.Result) {
                result = ((TaskChannel.TaskMessage.Result<CommandResult>) m).value();
            } else if (m instanceof TaskChannel.TaskMessage.Failure) {
                result = CommandResult.failed(inFlight.request(), ((TaskChannel.TaskMessage.Failure<CommandResult>) m).error());
            }
            message = messages.poll();
        }
        if (result == null) {
            return;
        }
        CommandChannel origin = inFlightOrigin;
        inFlight = null;
        inFlightOrigin = null;
        previousResult = result;
        deliver(result, origin);
    }

    private void deliver(CommandResult result, CommandChannel origin) {
        if (origin != null) {
            try {
                origin.report(result);
            } catch (CommandException e) {
                LOG.error("{}: failed to report the result of command {}: {}", KEY, result.commandId(), e.getMessage());
            }
        }
        for (CommandCallback callback : callbacks) {
            try {
                callback.onCommandResult(result);
            } catch (RuntimeException e) {
                LOG.error("{}: command callback failed: {}", KEY, e.getMessage(), e);
            }
        }
    }

    private Optional<CommandRequest> takeLocalScript() {
        if (localScript == null || !Files.isRegularFile(localScript)) {
            return Optional.empty();
        }
        try {
            String content = new String(Files.readAllBytes(localScript), StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return Optional.empty();
            }
            LOG.info("{}: executing local command file {}", KEY, localScript);
            Files.write(localScript, new byte[0]);
            return Optional.of(new CommandRequest(LOCAL_COMMAND_ID, content, null));
        } catch (IOException e) {
            throw new CommandException("failed to consume local command file " + localScript + ": " + e.getMessage(), e);
        }
    }

    private void updateMisc() {
        if (inFlight == null) {
            status().setMisc("current command", "no command running");
        } else {
            status().setMisc("current command", String.format(
                    "running for %ds: %s", inFlight.runningFor().getSeconds(), inFlight.request().commandText().strip()
            ));
        }
        if (previousResult == null) {
            status().setMisc("previous command output", "no previous command");
        } else {
            status().setMisc("previous command output", "exit code " + previousResult.exitCode()
                    + "\nstdout:\n" + previousResult.stdout()
                    + "\nstderr:\n" + previousResult.stderr());
        }
    }
}
