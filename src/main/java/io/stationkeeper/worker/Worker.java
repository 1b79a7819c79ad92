package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.status.StatusRegistry;
import io.stationkeeper.status.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A supervised unit of long-running work.
 *
 * <p>Each {@link #start()} allocates a new execution context: a dedicated
 * thread that calls {@link #step(CancellationToken)} until the token is
 * cancelled. A step that throws ends its context and leaves the status in
 * {@code FAILURE}; it is not retried in place. Recovery goes through
 * {@link #revive()}, which starts a fresh context for the same worker.
 */
public abstract class Worker {
    public static final String AUTHENTICATION_FAILURE_TAG = "authentication_failure";
    static final Duration FORCED_STOP_GRACE = Duration.ofSeconds(1);

    private static final Logger LOG = LoggerFactory.getLogger(Worker.class);

    private final String name;
    private final ConfigSource configSource;
    private final WorkerStatus status;
    private final Object lifecycleLock = new Object();
    private Thread thread;
    private CancellationToken token;
    private boolean stopped;

    protected Worker(String name, ConfigSource configSource, StatusRegistry statusRegistry) {
        this(name, configSource, statusRegistry, List.of());
    }

    protected Worker(String name, ConfigSource configSource, StatusRegistry statusRegistry, List<String> tags) {
        this.name = name;
        this.configSource = configSource;
        this.status = statusRegistry.create(name, tags);
    }

    public final String name() {
        return name;
    }

    public final WorkerStatus status() {
        return status;
    }

    protected final ConfigSource configSource() {
        return configSource;
    }

    /**
     * One iteration of the worker's loop. Long waits should go through
     * {@code token.sleep(...)} so that stop requests are honored promptly.
     */
    protected abstract void step(CancellationToken token) throws Exception;

    /**
     * Exercises the worker's real side effects once, before deployment.
     */
    public abstract void deployTest() throws Exception;

    /**
     * Called from the worker thread when its execution context ends.
     */
    protected void onExit() {
    }

    public final void start() {
        synchronized (lifecycleLock) {
            if (thread != null && thread.isAlive()) {
                throw new IllegalStateException("worker " + name + " is already running");
            }
            CancellationToken next = new CancellationToken(configSource);
            Thread t = new Thread(() -> runLoop(next), "worker-" + name);
            t.setDaemon(true);
            status.removeTag(AUTHENTICATION_FAILURE_TAG);
            status.setStarting();
            token = next;
            thread = t;
            stopped = false;
            t.start();
        }
    }

    public final boolean isAlive() {
        synchronized (lifecycleLock) {
            return thread != null && thread.isAlive();
        }
    }

    /**
     * Cooperative stop without deadline.
     */
    public final void stop() {
        stop(null);
    }

    /**
     * Requests a cooperative stop and waits for the execution context to end.
     * With a non-null {@code timeout}, a context still running after it is
     * interrupted and, if that does not help either, abandoned with status
     * {@code FAILURE}.
     *
     * @return false if the context had to be abandoned
     */
    public final boolean stop(Duration timeout) {
        Thread current;
        synchronized (lifecycleLock) {
            stopped = true;
            if (token != null) {
                token.requestStop();
            }
            current = thread;
        }
        if (current != null && current != Thread.currentThread()) {
            if (!join(current, timeout)) {
                LOG.warn("worker {} did not stop within {}, interrupting it", name, timeout);
                current.interrupt();
                if (!join(current, FORCED_STOP_GRACE)) {
                    LOG.error("worker {} ignored interruption, abandoning its thread", name);
                    status.setFailure("did not stop within " + timeout);
                    return false;
                }
            }
        }
        synchronized (lifecycleLock) {
            if (thread == current) {
                thread = null;
            }
        }
        status.setOff();
        return true;
    }

    /**
     * Starts a new execution context if the previous one died without being
     * stopped. Start failures are logged, never thrown.
     *
     * @return true if a new context was started
     */
    public final boolean revive() {
        synchronized (lifecycleLock) {
            if (stopped || (thread != null && thread.isAlive())) {
                return false;
            }
            LOG.info("worker {} not running, trying to restart", name);
            thread = null;
            try {
                start();
                return true;
            } catch (RuntimeException e) {
                thread = null;
                LOG.error("failed to revive worker {}: {}", name, e.getMessage(), e);
                return false;
            }
        }
    }

    private void runLoop(CancellationToken context) {
        LOG.info("{}: starting", name);
        try {
            while (!context.isStopRequested()) {
                status.setRunning();
                step(context);
            }
        } catch (AuthenticationException e) {
            LOG.error("{}: authentication failure: {}", name, e.getMessage());
            status.addTag(AUTHENTICATION_FAILURE_TAG);
            status.setFailure("authentication failure: " + e.getMessage());
            exit();
            return;
        } catch (Exception e) {
            LOG.error("{}: step failed: {}", name, describe(e), e);
            status.setFailure(describe(e));
            exit();
            return;
        }
        LOG.info("{}: turning off", name);
        exit();
        status.setOff();
    }

    private void exit() {
        try {
            onExit();
        } catch (RuntimeException e) {
            LOG.error("{}: exit hook failed: {}", name, e.getMessage(), e);
        }
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static boolean join(Thread t, Duration timeout) {
        try {
            if (timeout == null) {
                t.join();
            } else {
                t.join(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(timeout.toNanos())));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !t.isAlive();
    }
}
