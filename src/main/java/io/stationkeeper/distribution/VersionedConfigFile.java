package io.stationkeeper.distribution;

import java.util.Collection;
import java.util.Optional;

/**
 * Naming rules of versioned configuration files:
 * {@code <prefix>_<free-text>_<version>.toml}, exactly three underscore
 * separated segments once the extension is stripped, the last one a
 * non-negative integer.
 */
public final class VersionedConfigFile {
    public static final String EXTENSION = ".toml";

    private VersionedConfigFile() {
    }

    public static boolean isValid(String filename, String prefix) {
        return parseVersion(filename, prefix).isPresent();
    }

    public static long version(String filename, String prefix) {
        return parseVersion(filename, prefix).orElseThrow(() -> new IllegalArgumentException(
                "can not get a version number from " + filename + ": not a valid versioned configuration file name"
        ));
    }

    /**
     * The file with the highest version; versions alone decide.
     */
    public static Optional<String> best(Collection<String> filenames, String prefix) {
        String best = null;
        long bestVersion = -1L;
        for (String filename : filenames) {
            Optional<Long> version = parseVersion(filename, prefix);
            if (version.isPresent() && version.get() > bestVersion) {
                best = filename;
                bestVersion = version.get();
            }
        }
        return Optional.ofNullable(best);
    }

    private static Optional<Long> parseVersion(String filename, String prefix) {
        if (filename == null || !filename.startsWith(prefix + "_") || !filename.endsWith(EXTENSION)) {
            return Optional.empty();
        }
        String[] parts = filename.substring(0, filename.length() - EXTENSION.length()).split("_", -1);
        if (parts.length != 3 || parts[1].isEmpty() || parts[2].isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < parts[2].length(); i++) {
            if (!Character.isDigit(parts[2].charAt(i))) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(Long.parseLong(parts[2]));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
