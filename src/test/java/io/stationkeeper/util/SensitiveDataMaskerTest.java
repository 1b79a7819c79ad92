package io.stationkeeper.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAndOpaqueValuesRecursively() {
        Map<String, Object> masked = SensitiveDataMasker.masked(Map.of(
                "CommandExecutor", Map.of("url", "https://example.org/station", "token", "hunter2"),
                "uploads", List.of("a3f9c2e1b7d8a3f9c2e1b7d8a3f9c2e1b7d8", "/data/pictures"),
                "main", Map.of("period", 5)
        ));

        Map<?, ?> executor = (Map<?, ?>) masked.get("CommandExecutor");
        assertEquals("***", executor.get("token"));
        assertEquals("https://example.org/station", executor.get("url"));
        assertEquals(List.of("***", "/data/pictures"), masked.get("uploads"));
        assertEquals(Map.of("period", 5), masked.get("main"));
    }

    @Test
    void sensitiveKeyHints() {
        assertTrue(SensitiveDataMasker.isSensitiveKey("ftp_PASSWORD"));
        assertTrue(SensitiveDataMasker.isSensitiveKey("api_key"));
        assertFalse(SensitiveDataMasker.isSensitiveKey("folder"));
        assertFalse(SensitiveDataMasker.isSensitiveKey(""));
        assertFalse(SensitiveDataMasker.isSensitiveKey(null));
    }
}
