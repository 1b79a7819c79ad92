package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigurationException;
import io.stationkeeper.config.InMemoryConfigSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class WorkerCatalogTest {

    @Test
    void resolvesExactAndQualifiedKeys() {
        WorkerCatalog catalog = catalog();

        Assertions.assertEquals("CommandExecutor", catalog.find("CommandExecutor").orElseThrow().key());
        Assertions.assertEquals("CommandExecutor", catalog.find("io.stationkeeper.command.CommandExecutor").orElseThrow().key());
        Assertions.assertTrue(catalog.find("MyCommandExecutor").isEmpty());
        Assertions.assertEquals(List.of("CommandExecutor", "StatusReporter"), List.copyOf(catalog.keys()));
    }

    @Test
    void resolveSkipsUnknownKeysAndDuplicates() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("main", Map.of("period", 1));
        document.put("StatusReporter", Map.of());
        document.put("PictureTaker", Map.of());
        document.put("station.CommandExecutor", Map.of());
        document.put("CommandExecutor", Map.of());

        List<WorkerDescriptor> resolved = catalog().resolve(document);

        Assertions.assertEquals(List.of("StatusReporter", "CommandExecutor"), resolved.stream().map(WorkerDescriptor::key).toList());
        ConfigurationException error = Assertions.assertThrows(ConfigurationException.class, () -> catalog().resolveStrict(document));
        Assertions.assertTrue(error.getMessage().contains("PictureTaker"));
    }

    @Test
    void configCheckFailuresBecomeMessages() {
        WorkerDescriptor descriptor = new WorkerDescriptor("Camera", (source, registry) -> {
            throw new UnsupportedOperationException();
        }, source -> {
            source.get("Camera");
            return Optional.empty();
        });

        Optional<String> missing = descriptor.checkConfig(new InMemoryConfigSource(Map.of("main", Map.of())));
        Optional<String> crash = new WorkerDescriptor("Crash", (source, registry) -> null, source -> {
            throw new IllegalArgumentException("bad exposure");
        }).checkConfig(new InMemoryConfigSource(Map.of()));

        Assertions.assertTrue(missing.orElseThrow().contains("Camera"));
        Assertions.assertEquals("Crash: bad exposure", crash.orElseThrow());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new WorkerDescriptor(" ", (s, r) -> null, null));
    }

    private static WorkerCatalog catalog() {
        return new WorkerCatalog()
                .register("CommandExecutor", (source, registry) -> null, null)
                .register("StatusReporter", (source, registry) -> null, null);
    }
}
