package io.stationkeeper.worker;

import io.stationkeeper.config.ConfigValues;
import io.stationkeeper.config.ConfigurationException;
import io.stationkeeper.config.InMemoryConfigSource;
import io.stationkeeper.status.StatusRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

final class DeployTestsTest {

    @Test
    void reportsPerWorkerOutcomeWithoutStartingAnything() {
        AtomicInteger deployTests = new AtomicInteger();
        WorkerCatalog catalog = new WorkerCatalog()
                .register("Healthy", (source, registry) -> new CheckedWorker("Healthy", registry, () -> deployTests.incrementAndGet()), null)
                .register("Unreachable", (source, registry) -> new CheckedWorker("Unreachable", registry, () -> {
                    throw new IllegalStateException("server unreachable");
                }), null)
                .register("Misconfigured", (source, registry) -> new CheckedWorker("Misconfigured", registry, deployTests::incrementAndGet),
                        source -> {
                            ConfigValues.requireSeconds(source.get("Misconfigured"), "update_every");
                            return Optional.empty();
                        });
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("main", Map.of("period", 1));
        document.put("Healthy", Map.of());
        document.put("Unreachable", Map.of());
        document.put("Misconfigured", Map.of());

        Map<String, Optional<String>> results = DeployTests.run(new InMemoryConfigSource(document), catalog);

        Assertions.assertEquals(List.of("Healthy", "Unreachable", "Misconfigured"), List.copyOf(results.keySet()));
        Assertions.assertTrue(results.get("Healthy").isEmpty());
        Assertions.assertEquals("server unreachable", results.get("Unreachable").orElseThrow());
        Assertions.assertTrue(results.get("Misconfigured").orElseThrow().startsWith("configuration error: "));
        Assertions.assertEquals(1, deployTests.get());
    }

    @Test
    void unusableMainOrUnknownKeyFailsUpFront() {
        WorkerCatalog catalog = new WorkerCatalog();
        Assertions.assertThrows(ConfigurationException.class,
                () -> DeployTests.run(new InMemoryConfigSource(Map.of("Healthy", Map.of())), catalog));
        Assertions.assertThrows(ConfigurationException.class,
                () -> DeployTests.run(new InMemoryConfigSource(Map.of("main", Map.of("period", 1), "Ghost", Map.of())), catalog));
    }

    private static final class CheckedWorker extends Worker {
        private final Runnable sideEffect;

        CheckedWorker(String name, StatusRegistry registry, Runnable sideEffect) {
            super(name, new InMemoryConfigSource(Map.of()), registry);
            this.sideEffect = sideEffect;
        }

        @Override
        protected void step(CancellationToken token) {
            throw new AssertionError("deploy tests must not start workers");
        }

        @Override
        public void deployTest() {
            sideEffect.run();
        }
    }
}
