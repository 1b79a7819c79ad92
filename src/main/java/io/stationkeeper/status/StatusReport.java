package io.stationkeeper.status;

import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Human readable summary of all worker statuses, together with the worst
 * state found among them.
 */
public record StatusReport(WorkerState worstState, String text) {
    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("MM/dd/yyyy, HH:mm:ss");

    public static StatusReport of(Map<String, StatusSnapshot> statuses, Instant now, String version, Path diskRoot) {
        List<String> header = new ArrayList<>();
        header.add("local date and time: " + LocalDateTime.ofInstant(now, ZoneId.systemDefault()).format(LOCAL_TIME));
        header.add("stationkeeper version " + version);
        if (diskRoot != null) {
            header.add(diskStats(diskRoot));
        }
        String body = statuses.values().stream()
                .map(snapshot -> workerReport(snapshot, now))
                .collect(Collectors.joining("\n\n"));
        WorkerState worst = WorkerState.worst(statuses.values().stream().map(StatusSnapshot::state).toList());
        return new StatusReport(worst, "\n" + String.join("\n", header) + "\n\n" + body);
    }

    static String workerReport(StatusSnapshot snapshot, Instant now) {
        Map<String, String> entries = new LinkedHashMap<>(snapshot.misc());
        snapshot.runningFor(now).ifPresent(d -> entries.put("running for", format(d)));
        if (snapshot.state() == WorkerState.FAILURE && snapshot.error() != null) {
            entries.put("error", snapshot.error());
        }
        if (snapshot.state() == WorkerState.OFF || snapshot.state() == WorkerState.FAILURE) {
            snapshot.notRunningFor(now).ifPresent(d -> entries.put("last time run", format(d) + " ago"));
        }
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(snapshot.state().name().toLowerCase()).append("] ").append(snapshot.name());
        entries.forEach((key, value) -> sb.append('\n').append(key).append(": ").append(value));
        return sb.toString();
    }

    static String format(Duration duration) {
        long seconds = Math.max(0L, duration.getSeconds());
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    private static String diskStats(Path root) {
        try {
            FileStore store = Files.getFileStore(root);
            long free = store.getUsableSpace() / (1024L * 1024L);
            long total = store.getTotalSpace() / (1024L * 1024L);
            return "disk: " + free + " MiB free of " + total + " MiB";
        } catch (Exception e) {
            return "disk: unknown (" + e.getMessage() + ")";
        }
    }
}
