package io.stationkeeper.status;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable status record of one worker, written by the worker that owns it and
 * read by reporting code through {@link #snapshot()}.
 *
 * <p>Transitions notify the owning registry only when the state actually
 * changes. {@code startedRunningAt} is set while (and only while) the state is
 * {@link WorkerState#RUNNING}; leaving RUNNING stamps {@code lastTimeRunningAt}.
 */
public final class WorkerStatus {
    private final String name;
    private final Clock clock;
    private final StatusNotifier notifier;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> tags;
    private final Map<String, String> misc = new LinkedHashMap<>();
    private WorkerState state = WorkerState.STARTING;
    private String error;
    private Instant startedRunningAt;
    private Instant lastTimeRunningAt;

    WorkerStatus(String name, Iterable<String> tags, Clock clock, StatusNotifier notifier) {
        this.name = name;
        this.clock = clock;
        this.notifier = notifier;
        this.tags = new LinkedHashSet<>();
        if (tags != null) {
            tags.forEach(this.tags::add);
        }
    }

    public String name() {
        return name;
    }

    public WorkerState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> error() {
        lock.lock();
        try {
            return Optional.ofNullable(error);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> startedRunningAt() {
        lock.lock();
        try {
            return Optional.ofNullable(startedRunningAt);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> lastTimeRunningAt() {
        lock.lock();
        try {
            return Optional.ofNullable(lastTimeRunningAt);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Duration> runningFor() {
        return startedRunningAt().map(start -> Duration.between(start, clock.instant()));
    }

    public Optional<Duration> notRunningFor() {
        return lastTimeRunningAt().map(last -> Duration.between(last, clock.instant()));
    }

    public void addTag(String tag) {
        lock.lock();
        try {
            tags.add(tag);
        } finally {
            lock.unlock();
        }
    }

    public void removeTag(String tag) {
        lock.lock();
        try {
            tags.remove(tag);
        } finally {
            lock.unlock();
        }
    }

    public void setMisc(String key, String value) {
        lock.lock();
        try {
            misc.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    public void removeMisc(String key) {
        lock.lock();
        try {
            misc.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public void setStarting() {
        transition(WorkerState.STARTING, null);
    }

    public void setRunning() {
        transition(WorkerState.RUNNING, null);
    }

    public void setOff() {
        transition(WorkerState.OFF, null);
    }

    public void setFailure(String error) {
        transition(WorkerState.FAILURE, error);
    }

    public StatusSnapshot snapshot() {
        lock.lock();
        try {
            return new StatusSnapshot(
                    name,
                    state,
                    error,
                    startedRunningAt,
                    lastTimeRunningAt,
                    misc,
                    new ArrayList<>(tags)
            );
        } finally {
            lock.unlock();
        }
    }

    StatusChange initialChange() {
        lock.lock();
        try {
            return changeFrom(null);
        } finally {
            lock.unlock();
        }
    }

    private void transition(WorkerState next, String failure) {
        StatusChange change = null;
        lock.lock();
        try {
            WorkerState previous = state;
            Instant now = clock.instant();
            if (previous == WorkerState.RUNNING && next != WorkerState.RUNNING) {
                lastTimeRunningAt = now;
            }
            if (next == WorkerState.RUNNING) {
                if (startedRunningAt == null) {
                    startedRunningAt = now;
                }
                error = null;
            } else {
                startedRunningAt = null;
                error = next == WorkerState.FAILURE ? failure : error;
            }
            if (next == WorkerState.STARTING) {
                error = null;
            }
            state = next;
            if (previous != next) {
                change = changeFrom(previous);
            }
        } finally {
            lock.unlock();
        }
        // fan-out outside the record lock so callbacks may query this status
        if (change != null) {
            notifier.publish(change);
        }
    }

    private StatusChange changeFrom(WorkerState previous) {
        return new StatusChange(
                name,
                state,
                previous,
                new ArrayList<>(tags),
                misc,
                error,
                lastTimeRunningAt,
                startedRunningAt
        );
    }

    @FunctionalInterface
    interface StatusNotifier {
        void publish(StatusChange change);
    }
}
