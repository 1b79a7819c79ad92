package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.ConfigurationException;
import io.stationkeeper.config.MainSettings;
import io.stationkeeper.status.StatusRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the set of live workers equal to the set the configuration asks for.
 *
 * <p>Each cycle: resolve the desired kinds, stop and drop live workers that are
 * no longer desired, start the missing ones, then revive any live worker whose
 * thread died since the previous cycle. The live-worker map is only touched
 * under {@code registryLock}, which is never held across a worker step. A
 * dropped worker gets the {@code main.stop_timeout} to exit before it is
 * abandoned, so a stuck worker cannot hold up the cycle.
 */
public final class Supervisor {
    private static final Logger LOG = LoggerFactory.getLogger(Supervisor.class);

    private final ConfigSource configSource;
    private final WorkerCatalog catalog;
    private final StatusRegistry statusRegistry;
    private final Map<String, Worker> live = new LinkedHashMap<>();
    private final ReentrantLock registryLock = new ReentrantLock();
    private final CancellationToken stopToken;
    private final CountDownLatch terminated = new CountDownLatch(1);

    public Supervisor(ConfigSource configSource, WorkerCatalog catalog, StatusRegistry statusRegistry) {
        this.configSource = configSource;
        this.catalog = catalog;
        this.statusRegistry = statusRegistry;
        this.stopToken = new CancellationToken(configSource);
    }

    public StatusRegistry statusRegistry() {
        return statusRegistry;
    }

    /**
     * Runs reconciliation cycles until {@link #requestStop()} is called, then
     * stops every live worker. The period is read once, at entry.
     */
    public void run() {
        MainSettings settings = MainSettings.from(configSource);
        LOG.info("supervisor starting, reconciliation period {}", settings.period());
        try {
            while (!stopToken.isStopRequested()) {
                reconcile();
                stopToken.sleep(settings.period());
            }
            LOG.info("supervisor requested to stop");
        } finally {
            try {
                shutdown(settings.stopTimeout());
            } finally {
                terminated.countDown();
                LOG.info("supervisor exit");
            }
        }
    }

    public void requestStop() {
        stopToken.requestStop();
    }

    /**
     * Waits for {@link #run()} to complete its orderly shutdown.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public ReconcileOutcome reconcile() {
        Map<String, Object> document;
        try {
            document = configSource.getGlobal();
        } catch (RuntimeException e) {
            LOG.error("skipping worker reconciliation, failed to read the configuration: {}", e.getMessage());
            return ReconcileOutcome.skipped(e.getMessage());
        }
        List<WorkerDescriptor> desired = catalog.resolve(document);
        Duration stopTimeout = stopTimeout(document);
        Set<String> desiredKeys = new LinkedHashSet<>();
        desired.forEach(descriptor -> desiredKeys.add(descriptor.key()));

        List<String> stopped = new ArrayList<>();
        List<String> started = new ArrayList<>();
        List<String> revived = new ArrayList<>();
        registryLock.lock();
        try {
            var it = live.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Worker> entry = it.next();
                if (!desiredKeys.contains(entry.getKey())) {
                    Worker worker = entry.getValue();
                    LOG.info("stopping worker {} ({})", worker.name(), entry.getKey());
                    if (!worker.stop(stopTimeout)) {
                        LOG.error("worker {} ({}) abandoned after {}", worker.name(), entry.getKey(), stopTimeout);
                    }
                    statusRegistry.remove(worker.name());
                    it.remove();
                    stopped.add(entry.getKey());
                }
            }
            for (WorkerDescriptor descriptor : desired) {
                if (live.containsKey(descriptor.key())) {
                    continue;
                }
                LOG.info("starting worker {}", descriptor.key());
                Worker worker;
                try {
                    worker = descriptor.factory().create(configSource, statusRegistry);
                } catch (RuntimeException e) {
                    LOG.error("failed to instantiate worker {}: {}", descriptor.key(), e.getMessage(), e);
                    continue;
                }
                live.put(descriptor.key(), worker);
                try {
                    worker.start();
                    started.add(descriptor.key());
                } catch (RuntimeException e) {
                    LOG.error("failed to start worker {}: {}", descriptor.key(), e.getMessage(), e);
                }
            }
            for (Map.Entry<String, Worker> entry : live.entrySet()) {
                if (entry.getValue().revive()) {
                    revived.add(entry.getKey());
                }
            }
        } finally {
            registryLock.unlock();
        }
        return new ReconcileOutcome(started, stopped, revived, null);
    }

    private static Duration stopTimeout(Map<String, Object> document) {
        try {
            return MainSettings.from(document).stopTimeout();
        } catch (ConfigurationException e) {
            LOG.warn("using the default stop timeout: {}", e.getMessage());
            return MainSettings.DEFAULT_STOP_TIMEOUT;
        }
    }

    /**
     * Live workers by kind key, as of now.
     */
    public Map<String, Worker> liveWorkers() {
        registryLock.lock();
        try {
            return new LinkedHashMap<>(live);
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Stops every live worker concurrently (one stop call per worker) and
     * waits for all of them, each bounded by {@code perWorkerTimeout}.
     *
     * @return keys of workers that had to be abandoned
     */
    public List<String> shutdown(Duration perWorkerTimeout) {
        Map<String, Worker> toStop;
        registryLock.lock();
        try {
            toStop = new LinkedHashMap<>(live);
            live.clear();
        } finally {
            registryLock.unlock();
        }
        if (toStop.isEmpty()) {
            return List.of();
        }
        LOG.info("stopping {} worker(s)", toStop.size());
        ExecutorService stoppers = Executors.newFixedThreadPool(toStop.size(), r -> {
            Thread t = new Thread(r, "worker-stopper");
            t.setDaemon(true);
            return t;
        });
        Map<String, Future<Boolean>> pending = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, Worker> entry : toStop.entrySet()) {
                LOG.info("sending stop request to worker {}", entry.getValue().name());
                pending.put(entry.getKey(), stoppers.submit(() -> entry.getValue().stop(perWorkerTimeout)));
            }
            List<String> abandoned = new ArrayList<>();
            for (Map.Entry<String, Future<Boolean>> entry : pending.entrySet()) {
                boolean clean;
                try {
                    clean = entry.getValue().get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    clean = false;
                } catch (ExecutionException e) {
                    LOG.error("failed to stop worker {}: {}", entry.getKey(), e.getCause().getMessage(), e.getCause());
                    clean = false;
                }
                if (clean) {
                    LOG.info("worker {} stopped", entry.getKey());
                } else {
                    abandoned.add(entry.getKey());
                }
                statusRegistry.remove(toStop.get(entry.getKey()).name());
            }
            return abandoned;
        } finally {
            stoppers.shutdownNow();
        }
    }

    /**
     * What one reconciliation cycle did; {@code skippedReason} is set when the
     * configuration could not be read and nothing was touched.
     */
    public record ReconcileOutcome(List<String> started, List<String> stopped, List<String> revived, String skippedReason) {
        public ReconcileOutcome {
            started = List.copyOf(started);
            stopped = List.copyOf(stopped);
            revived = List.copyOf(revived);
        }

        static ReconcileOutcome skipped(String reason) {
            return new ReconcileOutcome(List.of(), List.of(), List.of(), reason);
        }

        public boolean changedAnything() {
            return !started.isEmpty() || !stopped.isEmpty() || !revived.isEmpty();
        }
    }
}
