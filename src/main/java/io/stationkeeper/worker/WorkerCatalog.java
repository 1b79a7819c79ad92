package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigDocuments;
import io.stationkeeper.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps configuration keys to worker kinds. Populated once at process start.
 *
 * <p>A document key resolves to a registered kind when it equals the kind's
 * key or ends with {@code "." + key}, so fully qualified keys such as
 * {@code "io.stationkeeper.command.CommandExecutor"} keep working.
 */
public final class WorkerCatalog {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerCatalog.class);

    private final Map<String, WorkerDescriptor> descriptors = new LinkedHashMap<>();

    public synchronized WorkerCatalog register(WorkerDescriptor descriptor) {
        descriptors.put(descriptor.key(), descriptor);
        return this;
    }

    public WorkerCatalog register(String key, WorkerFactory factory, ConfigCheck configCheck) {
        return register(new WorkerDescriptor(key, factory, configCheck));
    }

    public synchronized Optional<WorkerDescriptor> find(String documentKey) {
        WorkerDescriptor exact = descriptors.get(documentKey);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (WorkerDescriptor descriptor : descriptors.values()) {
            if (documentKey.endsWith("." + descriptor.key())) {
                return Optional.of(descriptor);
            }
        }
        return Optional.empty();
    }

    public synchronized Collection<String> keys() {
        return List.copyOf(descriptors.keySet());
    }

    /**
     * Worker kinds requested by {@code document}. Keys that do not resolve are
     * logged and skipped; they never prevent the others from resolving.
     */
    public List<WorkerDescriptor> resolve(Map<String, Object> document) {
        Resolution resolution = resolution(document);
        for (String unknown : resolution.unresolved()) {
            LOG.error("configuration error: no worker kind registered for the key '{}'", unknown);
        }
        return resolution.descriptors();
    }

    /**
     * Like {@link #resolve(Map)} but every key must resolve.
     */
    public List<WorkerDescriptor> resolveStrict(Map<String, Object> document) {
        Resolution resolution = resolution(document);
        if (!resolution.unresolved().isEmpty()) {
            throw new ConfigurationException(
                    "no worker kind registered for the key(s) " + String.join(", ", resolution.unresolved())
            );
        }
        return resolution.descriptors();
    }

    private Resolution resolution(Map<String, Object> document) {
        Set<WorkerDescriptor> found = new LinkedHashSet<>();
        List<String> unresolved = new ArrayList<>();
        for (String key : document.keySet()) {
            if (ConfigDocuments.MAIN.equals(key)) {
                continue;
            }
            Optional<WorkerDescriptor> descriptor = find(key);
            if (descriptor.isEmpty()) {
                unresolved.add(key);
            } else if (!found.add(descriptor.get())) {
                LOG.warn("configuration key '{}' requests worker kind {} a second time, ignored", key, descriptor.get().key());
            }
        }
        return new Resolution(List.copyOf(found), unresolved);
    }

    private record Resolution(List<WorkerDescriptor> descriptors, List<String> unresolved) {
    }
}
