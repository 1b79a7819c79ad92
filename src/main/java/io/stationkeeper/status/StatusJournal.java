package io.stationkeeper.status;

import io.stationkeeper.util.Jsons;
import io.stationkeeper.util.SensitiveDataMasker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one JSON line per status transition to a local journal file, so a
 * station's history survives restarts and can be uploaded with its data.
 */
public final class StatusJournal implements StatusChangeCallback {
    private final Path journalFile;
    private final Clock clock;

    public StatusJournal(Path journalFile) {
        this(journalFile, Clock.systemUTC());
    }

    public StatusJournal(Path journalFile, Clock clock) {
        this.journalFile = journalFile;
        this.clock = clock;
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // created concurrently, fine
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize status journal: " + journalFile, e);
        }
    }

    public Path journalFile() {
        return journalFile;
    }

    @Override
    public synchronized void onStatusChange(StatusChange change) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("worker", change.name());
        row.put("state", change.state().name());
        row.put("previous_state", change.previous().map(Enum::name).orElse(null));
        row.put("error", change.error());
        row.put("tags", change.tags());
        row.put("misc", SensitiveDataMasker.masked(change.misc()));
        row.put("started_running", change.startedRunning() == null ? null : change.startedRunning().toString());
        row.put("last_time_running", change.lastTimeRunning() == null ? null : change.lastTimeRunning().toString());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write status journal", e);
        }
    }
}
