package io.stationkeeper.command;

import io.stationkeeper.worker.TaskChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * One command executing on its own thread through {@code /bin/bash -c}. The
 * run posts a heartbeat every second and exactly one terminal message on its
 * {@link TaskChannel}; stdout and stderr are captured separately.
 */
public final class CommandRun {
    static final Duration HEARTBEAT_EVERY = Duration.ofSeconds(1);
    static final String SHELL = "/bin/bash";

    private static final Logger LOG = LoggerFactory.getLogger(CommandRun.class);

    private final CommandRequest request;
    private final Duration timeout;
    private final Clock clock;
    private final TaskChannel<CommandResult> channel = new TaskChannel<>();
    private final Instant startedAt;
    private final Thread thread;
    private volatile CommandState state = CommandState.PENDING;
    private volatile Process process;

    private CommandRun(CommandRequest request, Duration timeout, Clock clock) {
        this.request = request;
        this.timeout = timeout;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.thread = new Thread(this::execute, "command-" + request.commandId());
        this.thread.setDaemon(true);
    }

    public static CommandRun start(CommandRequest request, Duration timeout) {
        return start(request, timeout, Clock.systemUTC());
    }

    static CommandRun start(CommandRequest request, Duration timeout, Clock clock) {
        CommandRun run = new CommandRun(request, timeout, clock);
        run.thread.start();
        return run;
    }

    public CommandRequest request() {
        return request;
    }

    public CommandState state() {
        return state;
    }

    public TaskChannel<CommandResult> channel() {
        return channel;
    }

    public Duration runningFor() {
        return Duration.between(startedAt, clock.instant());
    }

    /**
     * Kills the child process, if any. The run then terminates with a failure message.
     */
    public void cancel() {
        Process current = process;
        if (current != null) {
            current.destroyForcibly();
        }
        thread.interrupt();
    }

    private void execute() {
        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("stationkeeper-command-", ".out");
            stderr = Files.createTempFile("stationkeeper-command-", ".err");
            ProcessBuilder pb = new ProcessBuilder(SHELL, "-c", request.commandText());
            pb.redirectOutput(stdout.toFile());
            pb.redirectError(stderr.toFile());
            Process started = pb.start();
            process = started;
            state = CommandState.RUNNING;
            started.getOutputStream().close();

            long deadline = System.nanoTime() + timeout.toNanos();
            boolean finished = false;
            while (!finished) {
                channel.heartbeat();
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    break;
                }
                finished = started.waitFor(Math.min(remaining, HEARTBEAT_EVERY.toNanos()), TimeUnit.NANOSECONDS);
            }
            if (!finished) {
                LOG.warn("command {} timed out after {}, killing it", request.commandId(), timeout);
                started.destroyForcibly();
                started.waitFor(1, TimeUnit.SECONDS);
                String err = read(stderr) + "command timed out after " + timeout + "\n";
                channel.complete(new CommandResult(
                        request.commandId(), request.commandText(), CommandResult.NO_EXIT_CODE, read(stdout), err
                ));
                return;
            }
            channel.complete(new CommandResult(
                    request.commandId(), request.commandText(), started.exitValue(), read(stdout), read(stderr)
            ));
        } catch (IOException e) {
            channel.fail("failed to execute command: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Process current = process;
            if (current != null) {
                current.destroyForcibly();
            }
            channel.fail("command interrupted");
        } finally {
            state = CommandState.DONE;
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("failed to delete {}: {}", file, e.getMessage());
        }
    }
}
