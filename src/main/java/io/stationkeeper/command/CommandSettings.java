package io.stationkeeper.command;

import io.stationkeeper.config.ConfigValues;
import io.stationkeeper.config.ConfigurationException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The {@code CommandExecutor} configuration section.
 *
 * @param folder drop folder, only for the {@code file} source
 * @param url    server base url, only for the {@code http} source
 * @param token  token the server must present, only for the {@code http} source
 */
public record CommandSettings(
        Source source,
        Duration updateEvery,
        Duration commandTimeout,
        Path folder,
        String url,
        String token
) {
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(600);

    public enum Source {
        FILE,
        HTTP
    }

    public static CommandSettings from(Map<String, Object> section, Path defaultFolder) {
        Duration updateEvery = ConfigValues.requireSeconds(section, "update_every");
        Duration commandTimeout = ConfigValues.optionalSeconds(section, "command_timeout", DEFAULT_COMMAND_TIMEOUT);
        if (commandTimeout.isZero()) {
            throw new ConfigurationException("'command_timeout' must be positive");
        }
        String rawSource = ConfigValues.optionalString(section, "source").orElse("file").trim().toLowerCase(Locale.ROOT);
        switch (rawSource) {
            case "file" -> {
                Path folder = ConfigValues.optionalString(section, "folder")
                        .filter(value -> !value.isBlank())
                        .map(Paths::get)
                        .orElse(defaultFolder);
                return new CommandSettings(Source.FILE, updateEvery, commandTimeout, folder, null, null);
            }
            case "http" -> {
                String url = ConfigValues.requireString(section, "url");
                String token = ConfigValues.requireString(section, "token");
                return new CommandSettings(Source.HTTP, updateEvery, commandTimeout, null, url, token);
            }
            default -> throw new ConfigurationException(
                    "unsupported command source '" + rawSource + "' (expected 'file' or 'http')"
            );
        }
    }

    public CommandChannel openChannel() {
        return switch (source) {
            case FILE -> new FileDropCommandChannel(folder);
            case HTTP -> new HttpCommandChannel(url, token);
        };
    }

    /**
     * Same channel endpoint; polling intervals and timeouts may differ.
     */
    boolean sameChannel(CommandSettings other) {
        return other != null
                && source == other.source
                && Objects.equals(folder, other.folder)
                && Objects.equals(url, other.url)
                && Objects.equals(token, other.token);
    }
}
