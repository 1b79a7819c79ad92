package io.stationkeeper.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credentials (ftp passwords, channel tokens...) before a configuration
 * document or a journal line leaves the process.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> masked(Map<String, ?> input) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (input == null) {
            return out;
        }
        for (Map.Entry<String, ?> entry : input.entrySet()) {
            String key = entry.getKey();
            if (isSensitiveKey(key)) {
                out.put(key, MASK);
            } else {
                out.put(key, maskedValue(entry.getValue()));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object maskedValue(Object value) {
        if (value instanceof Map) {
            return masked((Map<String, ?>) value);
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(SensitiveDataMasker::maskedValue).toList();
        }
        if (value instanceof String && likelySecretValue((String) value)) {
            return MASK;
        }
        return value;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 32 || v.contains("/") || v.contains(" ")) {
            return false;
        }
        // long opaque strings are treated as tokens
        return v.matches("^[A-Za-z0-9+=_\\-:.]{32,}$");
    }
}
