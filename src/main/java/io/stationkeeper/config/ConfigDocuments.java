package io.stationkeeper.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import io.stationkeeper.util.Jsons;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing, templating and copying of configuration documents.
 *
 * <p>A document is a two-level mapping: the reserved {@code main} section plus
 * one section per worker kind. Placeholders of the form {@code {{ name }}} are
 * substituted before the TOML is parsed.
 */
public final class ConfigDocuments {
    public static final String MAIN = "main";
    public static final String ENV_PREFIX = "STATION_";

    private static final TomlMapper TOML = new TomlMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*}}");

    private ConfigDocuments() {
    }

    public static Map<String, Object> parse(String content) {
        try {
            LinkedHashMap<String, Object> parsed = TOML.readValue(content, DOCUMENT_TYPE);
            return parsed == null ? new LinkedHashMap<>() : parsed;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("failed to (toml) parse configuration: " + e.getOriginalMessage(), e);
        }
    }

    public static Map<String, Object> read(Path path, Map<String, String> variables) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("failed to find configuration file " + path);
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("failed to read configuration file " + path + ": " + e.getMessage(), e);
        }
        try {
            return parse(variables == null ? content : render(content, variables));
        } catch (ConfigurationException e) {
            throw new ConfigurationException("failed to parse configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    public static String render(String template, Map<String, String> variables) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = variables.get(name);
            if (value == null) {
                throw new ConfigurationException("no value for the template variable '" + name + "'");
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Template variables for station documents: the hostname, overridden by
     * {@code STATION_*} environment variables, overridden by {@code globals.toml} entries.
     */
    public static Map<String, String> stationVariables(Path globalsFile, Map<String, String> environment) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("hostname", hostname());
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (entry.getKey().startsWith(ENV_PREFIX) && entry.getKey().length() > ENV_PREFIX.length()) {
                String key = entry.getKey().substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT);
                out.put(key, entry.getValue());
            }
        }
        if (globalsFile != null && Files.isRegularFile(globalsFile)) {
            Map<String, Object> globals = read(globalsFile, null);
            globals.forEach((key, value) -> out.put(key, String.valueOf(value)));
        }
        return out;
    }

    static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    /**
     * Detached copy of {@code document}, nested tables and arrays included.
     */
    public static Map<String, Object> deepCopy(Map<String, ?> document) {
        return Jsons.mapper().convertValue(document, DOCUMENT_TYPE);
    }

    /**
     * Finds the section of {@code name}: an exact key wins, otherwise the first
     * top-level key ending with {@code name}.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> section(Map<String, Object> document, String name) {
        Object value = document.get(name);
        String matchedKey = name;
        if (value == null) {
            for (Map.Entry<String, Object> entry : document.entrySet()) {
                if (entry.getKey().endsWith(name)) {
                    value = entry.getValue();
                    matchedKey = entry.getKey();
                    break;
                }
            }
        }
        if (value == null) {
            throw new ConfigNotFoundException(name);
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("the configuration entry '" + matchedKey + "' is not a table");
        }
        return (Map<String, Object>) value;
    }
}
