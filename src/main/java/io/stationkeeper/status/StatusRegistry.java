package io.stationkeeper.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One {@link WorkerStatus} per live worker name, plus the ordered list of
 * callbacks every transition is pushed to.
 *
 * <p>The callback list is fixed at construction and scoped to the registry.
 * Fan-out is synchronous and serialized across workers, so callbacks observe
 * a single total order of transitions.
 */
public final class StatusRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(StatusRegistry.class);

    private final List<StatusChangeCallback> callbacks;
    private final Clock clock;
    private final Map<String, WorkerStatus> statuses = new LinkedHashMap<>();
    private final Object statusesLock = new Object();
    private final ReentrantLock fanOutLock = new ReentrantLock();

    public StatusRegistry() {
        this(List.of());
    }

    public StatusRegistry(List<StatusChangeCallback> callbacks) {
        this(callbacks, Clock.systemDefaultZone());
    }

    public StatusRegistry(List<StatusChangeCallback> callbacks, Clock clock) {
        this.callbacks = List.copyOf(callbacks);
        this.clock = clock;
    }

    /**
     * Registers a fresh status (state STARTING) under {@code name}, replacing
     * any previous record of that name, and fires the synthetic STARTING event.
     */
    public WorkerStatus create(String name, List<String> tags) {
        WorkerStatus status = new WorkerStatus(name, tags, clock, this::publish);
        synchronized (statusesLock) {
            statuses.put(name, status);
        }
        publish(status.initialChange());
        return status;
    }

    public void remove(String name) {
        synchronized (statusesLock) {
            statuses.remove(name);
        }
    }

    public Optional<WorkerStatus> find(String name) {
        synchronized (statusesLock) {
            return Optional.ofNullable(statuses.get(name));
        }
    }

    public Map<String, StatusSnapshot> snapshot() {
        List<WorkerStatus> current;
        synchronized (statusesLock) {
            current = List.copyOf(statuses.values());
        }
        Map<String, StatusSnapshot> out = new LinkedHashMap<>();
        for (WorkerStatus status : current) {
            out.put(status.name(), status.snapshot());
        }
        return out;
    }

    public List<StatusChangeCallback> callbacks() {
        return callbacks;
    }

    void publish(StatusChange change) {
        fanOutLock.lock();
        try {
            for (StatusChangeCallback callback : callbacks) {
                try {
                    callback.onStatusChange(change);
                } catch (RuntimeException e) {
                    LOG.error("status callback {} failed for worker {} ({}): {}",
                            callback.getClass().getSimpleName(), change.name(), change.state(), e.getMessage(), e);
                }
            }
        } finally {
            fanOutLock.unlock();
        }
    }
}
