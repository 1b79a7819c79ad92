package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigSource;

import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stop signal handed to one execution context of a worker. Sleeps end as soon
 * as a stop is requested and, on demand, as soon as the configuration source
 * reports that its document changed.
 */
public final class CancellationToken {
    static final Duration CONFIG_POLL_INTERVAL = Duration.ofMillis(50);

    private final ConfigSource configSource;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stopSignal = lock.newCondition();
    private volatile boolean stopRequested;

    public CancellationToken(ConfigSource configSource) {
        this.configSource = configSource;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public void requestStop() {
        lock.lock();
        try {
            stopRequested = true;
            stopSignal.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps for {@code duration} or until a stop is requested.
     */
    public SleepOutcome sleep(Duration duration) {
        return sleep(duration, false);
    }

    /**
     * Sleeps for {@code duration}, or until a stop is requested, or until the
     * configuration changed compared to when the sleep started.
     */
    public SleepOutcome sleepUntilConfigChange(Duration duration) {
        return sleep(duration, true);
    }

    private SleepOutcome sleep(Duration duration, boolean watchConfig) {
        Optional<FileTime> marker = watchConfig ? configSource.changeMarker() : Optional.empty();
        boolean pollConfig = watchConfig && marker.isPresent();
        long deadline = System.nanoTime() + Math.max(0L, duration.toNanos());
        lock.lock();
        try {
            while (!stopRequested) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    return SleepOutcome.ELAPSED;
                }
                long wait = pollConfig ? Math.min(remaining, CONFIG_POLL_INTERVAL.toNanos()) : remaining;
                try {
                    stopSignal.await(wait, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stopRequested = true;
                    return SleepOutcome.STOPPED;
                }
                if (pollConfig && !stopRequested && !marker.equals(configSource.changeMarker())) {
                    return SleepOutcome.CONFIG_CHANGED;
                }
            }
            return SleepOutcome.STOPPED;
        } finally {
            lock.unlock();
        }
    }

    public enum SleepOutcome {
        ELAPSED,
        STOPPED,
        CONFIG_CHANGED
    }
}
