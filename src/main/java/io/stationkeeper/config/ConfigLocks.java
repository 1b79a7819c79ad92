package io.stationkeeper.config;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide named locks. Every reader of the station configuration file and
 * the distributor that repoints it share {@link #CONFIGURATION}.
 */
public final class ConfigLocks {
    public static final String CONFIGURATION = "configuration";

    private static final ConcurrentMap<String, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private ConfigLocks() {
    }

    public static ReentrantLock get(String name) {
        return LOCKS.computeIfAbsent(name, ignored -> new ReentrantLock());
    }

    public static ReentrantLock configuration() {
        return get(CONFIGURATION);
    }
}
