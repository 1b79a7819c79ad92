package io.stationkeeper.status;

import com.fasterxml.jackson.databind.JsonNode;
import io.stationkeeper.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class StatusJournalTest {

    @Test
    void appendsOneLinePerTransitionWithMaskedSecrets() throws Exception {
        Path root = Files.createTempDirectory("stationkeeper-journal-");
        try {
            StatusJournal journal = new StatusJournal(root.resolve("journal").resolve("status.jsonl"));
            StatusRegistry registry = new StatusRegistry(List.of(journal));
            WorkerStatus status = registry.create("command", List.of());
            status.setMisc("token", "s3cr3t");
            status.setRunning();
            status.setFailure("authentication failure: wrong token");

            List<String> lines = Files.readAllLines(journal.journalFile(), StandardCharsets.UTF_8);
            Assertions.assertEquals(3, lines.size());
            JsonNode last = Jsons.mapper().readTree(lines.get(2));
            Assertions.assertEquals("command", last.path("worker").asText());
            Assertions.assertEquals("FAILURE", last.path("state").asText());
            Assertions.assertEquals("RUNNING", last.path("previous_state").asText());
            Assertions.assertEquals("***", last.path("misc").path("token").asText());
            Assertions.assertFalse(lines.get(2).contains("s3cr3t"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
