package io.stationkeeper.status;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One state transition of one worker, as delivered to {@link StatusChangeCallback}s.
 * {@code previousState} is empty for the synthetic event fired when a status is created.
 */
public record StatusChange(
        String name,
        WorkerState state,
        WorkerState previousState,
        List<String> tags,
        Map<String, String> misc,
        String error,
        Instant lastTimeRunning,
        Instant startedRunning
) {
    public StatusChange {
        tags = List.copyOf(tags);
        misc = Collections.unmodifiableMap(new LinkedHashMap<>(misc));
    }

    public Optional<WorkerState> previous() {
        return Optional.ofNullable(previousState);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
