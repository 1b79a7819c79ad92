package io.stationkeeper.distribution;

/**
 * Notified after a new configuration file became the station configuration.
 */
@FunctionalInterface
public interface ConfigChangeListener {
    void onConfigAdopted(String filename, long version);
}
