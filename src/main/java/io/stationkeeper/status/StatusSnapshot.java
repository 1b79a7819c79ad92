package io.stationkeeper.status;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record StatusSnapshot(
        String name,
        WorkerState state,
        String error,
        Instant startedRunningAt,
        Instant lastTimeRunningAt,
        Map<String, String> misc,
        List<String> tags
) {
    public StatusSnapshot {
        misc = Collections.unmodifiableMap(new LinkedHashMap<>(misc));
        tags = List.copyOf(tags);
    }

    public Optional<Duration> runningFor(Instant now) {
        return startedRunningAt == null ? Optional.empty() : Optional.of(Duration.between(startedRunningAt, now));
    }

    public Optional<Duration> notRunningFor(Instant now) {
        return lastTimeRunningAt == null ? Optional.empty() : Optional.of(Duration.between(lastTimeRunningAt, now));
    }
}
