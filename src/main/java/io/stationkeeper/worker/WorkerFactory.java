package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.status.StatusRegistry;

@FunctionalInterface
public interface WorkerFactory {
    Worker create(ConfigSource configSource, StatusRegistry statusRegistry);
}
