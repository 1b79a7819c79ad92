package io.stationkeeper.config;

public final class ConfigNotFoundException extends ConfigurationException {
    public ConfigNotFoundException(String name) {
        super("failed to find the key '" + name + "' in the configuration");
    }
}
