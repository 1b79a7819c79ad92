package io.stationkeeper.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class ConfigSourceTest {

    @Test
    void staticSourceParsesOnceAndReturnsCopies() throws Exception {
        Path root = Files.createTempDirectory("stationkeeper-static-");
        try {
            Path file = root.resolve("station.toml");
            Files.writeString(file, """
                    [main]
                    period = 1.5

                    [StatusReporter]
                    update_every = 30
                    folder = "/tmp/status"
                    """, StandardCharsets.UTF_8);
            StaticConfigSource source = new StaticConfigSource(file);

            Map<String, Object> first = source.getGlobal();
            first.remove("main");
            Files.writeString(file, "[main]\nperiod = 9\n", StandardCharsets.UTF_8);

            Map<String, Object> second = source.getGlobal();
            Assertions.assertTrue(second.containsKey("main"));
            Assertions.assertEquals(1.5, ((Number) source.get("main").get("period")).doubleValue());
            Assertions.assertEquals("/tmp/status", source.get("StatusReporter").get("folder"));
            Assertions.assertTrue(source.changeMarker().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void getMatchesExactKeyThenSuffix() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("main", Map.of("period", 1));
        document.put("station.workers.CommandExecutor", Map.of("update_every", 2));
        document.put("CommandExecutor", Map.of("update_every", 5));
        document.put("io.stationkeeper.reporting.StatusReporter", Map.of("folder", "/tmp"));
        InMemoryConfigSource source = new InMemoryConfigSource(document);

        Assertions.assertEquals(5, source.get("CommandExecutor").get("update_every"));
        Assertions.assertEquals("/tmp", source.get("StatusReporter").get("folder"));
        ConfigNotFoundException missing = Assertions.assertThrows(
                ConfigNotFoundException.class,
                () -> source.get("ConfigDistributor")
        );
        Assertions.assertTrue(missing.getMessage().contains("ConfigDistributor"));
    }

    @Test
    void inMemorySourceHandsOutDeepCopies() {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("period", 1);
        InMemoryConfigSource source = new InMemoryConfigSource(Map.of("main", section));

        source.get("main").put("period", 42);
        section.put("period", 7);

        Assertions.assertEquals(1, source.get("main").get("period"));
    }

    @Test
    void deepCopyDetachesNestedArraysAndKeepsKeyOrder() {
        List<Object> exposures = new ArrayList<>(List.of(1, 2.5));
        Map<String, Object> camera = new LinkedHashMap<>();
        camera.put("zeta", "last");
        camera.put("alpha", "first");
        camera.put("exposures", exposures);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("main", Map.of("period", 1));
        document.put("Camera", camera);

        Map<String, Object> copy = ConfigDocuments.deepCopy(document);
        exposures.add(9);
        camera.put("zeta", "changed");

        Map<?, ?> copiedCamera = (Map<?, ?>) copy.get("Camera");
        Assertions.assertEquals(List.of("main", "Camera"), new ArrayList<>(copy.keySet()));
        Assertions.assertEquals(List.of("zeta", "alpha", "exposures"), new ArrayList<>(copiedCamera.keySet()));
        Assertions.assertEquals("last", copiedCamera.get("zeta"));
        Assertions.assertEquals(List.of(1, 2.5), copiedCamera.get("exposures"));
    }

    @Test
    void templatingRendersStationVariables() throws Exception {
        Path root = Files.createTempDirectory("stationkeeper-template-");
        try {
            Path globals = root.resolve("globals.toml");
            Files.writeString(globals, "station = \"skylab\"\n", StandardCharsets.UTF_8);
            Path file = root.resolve("station.toml");
            Files.writeString(file, """
                    [main]
                    period = 1

                    [StatusReporter]
                    update_every = 30
                    folder = "/data/{{ station }}/{{region}}"
                    """, StandardCharsets.UTF_8);

            Map<String, String> variables = ConfigDocuments.stationVariables(
                    globals,
                    Map.of("STATION_REGION", "alps", "STATION_STATION", "ignored", "HOME", "/root")
            );
            StaticConfigSource source = new StaticConfigSource(file, variables);

            Assertions.assertEquals("/data/skylab/alps", source.get("StatusReporter").get("folder"));
            Assertions.assertTrue(variables.containsKey("hostname"));
            Assertions.assertFalse(variables.containsKey("home"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownTemplateVariableIsAConfigurationError() {
        ConfigurationException error = Assertions.assertThrows(
                ConfigurationException.class,
                () -> ConfigDocuments.render("url = \"{{ server }}\"", Map.of())
        );
        Assertions.assertTrue(error.getMessage().contains("server"));
    }

    @Test
    void malformedTomlIsAConfigurationError() {
        Assertions.assertThrows(ConfigurationException.class, () -> ConfigDocuments.parse("[main\nperiod = "));
    }

    @Test
    void nonTableSectionIsRejected() {
        InMemoryConfigSource source = new InMemoryConfigSource(Map.of("main", Map.of("period", 1), "CommandExecutor", 3));
        Assertions.assertThrows(ConfigurationException.class, () -> source.get("CommandExecutor"));
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
