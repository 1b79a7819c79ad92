package io.stationkeeper.command;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.stationkeeper.config.ConfigSource;
import io.stationkeeper.config.InMemoryConfigSource;
import io.stationkeeper.status.StatusRegistry;
import io.stationkeeper.status.WorkerState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class CommandExecutorTest {

    @Test
    void sameCommandFileRunsOnceAndNextOneRunsWithItsOwnOutput() throws Exception {
        Path root = Files.createTempDirectory("stationkeeper-executor-");
        List<CommandResult> results = new CopyOnWriteArrayList<>();
        CommandExecutor executor = executor(root, results);
        executor.start();
        try {
            Path commands = root.resolve("commands");
            Files.createDirectories(commands);
            drop(commands, "command_a.txt", "echo first");
            awaitTrue(() -> results.size() == 1);
            Assertions.assertEquals("command_a.txt", results.get(0).commandId());
            Assertions.assertEquals("first\n", results.get(0).stdout());
            Assertions.assertTrue(Files.exists(commands.resolve("command_a.txt.result.json")));

            drop(commands, "command_a.txt", "echo first");
            awaitTrue(() -> !Files.exists(commands.resolve("command_a.txt")));
            Thread.sleep(200);
            Assertions.assertEquals(1, results.size());

            drop(commands, "command_b.txt", "echo second; exit 2");
            awaitTrue(() -> results.size() == 2);
            Assertions.assertEquals("command_b.txt", results.get(1).commandId());
            Assertions.assertEquals("second\n", results.get(1).stdout());
            Assertions.assertEquals(2, results.get(1).exitCode());
            Assertions.assertEquals(WorkerState.RUNNING, executor.status().state());
        } finally {
            executor.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void requestSeenWhileBusyWaitsForCurrentCommand() throws Exception {
        Path root = Files.createTempDirectory("stationkeeper-executor-busy-");
        List<CommandResult> results = new CopyOnWriteArrayList<>();
        CommandExecutor executor = executor(root, results);
        executor.start();
        try {
            Path commands = Files.createDirectories(root.resolve("commands"));
            drop(commands, "command_slow.txt", "sleep 1; echo slow");
            awaitTrue(executor::busy);
            drop(commands, "command_next.txt", "echo next");
            Thread.sleep(300);
            Assertions.assertTrue(Files.exists(commands.resolve("command_next.txt")));
            Assertions.assertTrue(executor.status().snapshot().misc().get("current command").contains("sleep 1"));

            awaitTrue(() -> results.size() == 2);
            Assertions.assertEquals("command_slow.txt", results.get(0).commandId());
            Assertions.assertEquals("slow\n", results.get(0).stdout());
            Assertions.assertEquals("command_next.txt", results.get(1).commandId());
        } finally {
            executor.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void revivedExecutorDoesNotRerunCommandStillServed() throws Exception {
        AtomicBoolean down = new AtomicBoolean();
        AtomicInteger polls = new AtomicInteger();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/station/command", exchange -> {
            polls.incrementAndGet();
            if (down.get()) {
                respond(exchange, 503, "down");
            } else {
                respond(exchange, 200, "{\"command_id\":\"1\",\"command_text\":\"echo once\",\"auth_token\":\"secret\"}");
            }
        });
        server.createContext("/station/result", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 200, "{}");
        });
        server.start();
        List<CommandResult> results = new CopyOnWriteArrayList<>();
        ConfigSource source = config(Map.of(
                "source", "http",
                "url", "http://127.0.0.1:" + server.getAddress().getPort() + "/station",
                "token", "secret",
                "update_every", 0.05
        ));
        CommandExecutor executor = new CommandExecutor(source, new StatusRegistry(), Path.of("unused"), null, List.of(results::add));
        executor.start();
        try {
            awaitTrue(() -> results.size() == 1);
            Assertions.assertEquals("once\n", results.get(0).stdout());
            int served = polls.get();
            awaitTrue(() -> polls.get() >= served + 3);
            Assertions.assertEquals(1, results.size());

            down.set(true);
            awaitTrue(() -> !executor.isAlive());
            Assertions.assertEquals(WorkerState.FAILURE, executor.status().state());
            down.set(false);

            Assertions.assertTrue(executor.revive());
            int revived = polls.get();
            awaitTrue(() -> polls.get() >= revived + 3);
            Thread.sleep(300);
            Assertions.assertEquals(1, results.size());
            Assertions.assertEquals(WorkerState.RUNNING, executor.status().state());
        } finally {
            executor.stop();
            server.stop(0);
        }
    }

    @Test
    void localScriptRunsOnceAndIsTruncated() throws Exception {
        Path root = Files.createTempDirectory("stationkeeper-executor-local-");
        List<CommandResult> results = new CopyOnWriteArrayList<>();
        CommandExecutor executor = executor(root, results);
        Path script = root.resolve("command.sh");
        Files.writeString(script, "echo local\n");
        executor.start();
        try {
            awaitTrue(() -> results.size() == 1);
            Assertions.assertEquals(CommandExecutor.LOCAL_COMMAND_ID, results.get(0).commandId());
            Assertions.assertEquals("local\n", results.get(0).stdout());
            Assertions.assertEquals("", Files.readString(script));
            awaitTrue(() -> executor.status().snapshot().misc().getOrDefault("previous command output", "")
                    .contains("exit code 0"));
            Thread.sleep(200);
            Assertions.assertEquals(1, results.size());
        } finally {
            executor.stop();
            deleteRecursively(root);
        }
    }

    @Test
    void configCheckRejectsIncompleteSections() {
        Path folder = Path.of("commands");
        Assertions.assertEquals(Optional.empty(), CommandExecutor.checkConfig(config(Map.of("update_every", 1)), folder));
        Assertions.assertTrue(CommandExecutor.checkConfig(config(Map.of("source", "http", "update_every", 1)), folder)
                .orElseThrow().contains("'url'"));
        Assertions.assertTrue(CommandExecutor.checkConfig(config(Map.of("source", "carrier-pigeon", "update_every", 1)), folder)
                .orElseThrow().contains("carrier-pigeon"));
        Assertions.assertTrue(CommandExecutor.checkConfig(config(Map.of("source", "file")), folder)
                .orElseThrow().contains("'update_every'"));

        CommandSettings http = CommandSettings.from(
                Map.of("source", "http", "update_every", 5, "url", "http://x", "token", "t", "command_timeout", 30),
                folder
        );
        Assertions.assertEquals(CommandSettings.Source.HTTP, http.source());
        Assertions.assertEquals(30, http.commandTimeout().getSeconds());
        Assertions.assertTrue(http.openChannel() instanceof HttpCommandChannel);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static void drop(Path folder, String name, String text) throws IOException {
        Path tmp = folder.resolve("." + name + ".tmp");
        Files.writeString(tmp, text);
        Files.move(tmp, folder.resolve(name), StandardCopyOption.ATOMIC_MOVE);
    }

    private static ConfigSource config(Map<String, Object> section) {
        return new InMemoryConfigSource(Map.of("main", Map.of("period", 1), CommandExecutor.KEY, section));
    }

    private static CommandExecutor executor(Path root, List<CommandResult> results) {
        ConfigSource source = config(Map.of("source", "file", "update_every", 0.05));
        return new CommandExecutor(
                source, new StatusRegistry(), root.resolve("commands"), root.resolve("command.sh"),
                List.of(results::add)
        );
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                Assertions.fail("condition not met in time");
            }
            Thread.sleep(10);
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
