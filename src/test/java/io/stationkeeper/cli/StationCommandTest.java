package io.stationkeeper.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StationCommandTest {

    @Test
    void workersListsShippedKinds() throws Exception {
        Path root = Files.createTempDirectory("stationkeeper-cli-workers-");
        try {
            Run run = execute("--root", root.toString(), "workers");
            assertEquals(0, run.exitCode());
            assertTrue(run.out().contains("ConfigDistributor"));
            assertTrue(run.out().contains("CommandExecutor"));
            assertTrue(run.out().contains("StatusReporter"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void checkConfigReportsValidity() throws Exception {
        Path root = Files.createTempDirectory("stationkeeper-cli-check-");
        try {
            Path good = root.resolve("station_config_3.toml");
            Files.writeString(good, """
                    [main]
                    period = 5

                    [StatusReporter]
                    folder = '/tmp/status'
                    update_every = 60
                    """);
            Path bad = root.resolve("station_config_4.toml");
            Files.writeString(bad, """
                    [main]
                    period = 5

                    [PictureTaker]
                    every = 2
                    """);

            Run valid = execute("--root", root.toString(), "check-config", good.toString());
            assertEquals(0, valid.exitCode());
            assertTrue(valid.out().contains("valid: " + good));

            Run invalid = execute("--root", root.toString(), "check-config", bad.toString());
            assertEquals(1, invalid.exitCode());
            assertTrue(invalid.out().contains("PictureTaker"));

            Run missing = execute("--root", root.toString(), "check-config", root.resolve("nope.toml").toString());
            assertEquals(1, missing.exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void uninstalledStationIsRejected() throws Exception {
        Path root = Files.createTempDirectory("stationkeeper-cli-uninstalled-");
        try {
            Run run = execute("--root", root.toString(), "show-config");
            assertNotEquals(0, run.exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Run execute(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            CommandLine commandLine = new CommandLine(new StationCommand());
            commandLine.setErr(new PrintWriter(new ByteArrayOutputStream(), true));
            int exitCode = commandLine.execute(args);
            return new Run(exitCode, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
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

    private record Run(int exitCode, String out) {
    }
}
