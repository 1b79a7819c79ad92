package io.stationkeeper.config;

/**
 * A configuration document (or one of its sections) is missing a key, holds a
 * value of the wrong type, names an unknown worker kind or fails to parse.
 * Messages are meant for operators and never carry stack traces.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
