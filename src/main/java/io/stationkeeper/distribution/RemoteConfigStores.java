package io.stationkeeper.distribution;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public final class RemoteConfigStores {
    private RemoteConfigStores() {
    }

    /**
     * {@code http(s)://} urls are read as directory listings; {@code file:}
     * urls and plain paths as folders.
     */
    public static RemoteConfigStore forUrl(String url) {
        String lower = url.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return new HttpRemoteConfigStore(url.trim());
        }
        Path folder = lower.startsWith("file:") ? Paths.get(URI.create(url.trim())) : Paths.get(url.trim());
        return new FolderRemoteConfigStore(folder);
    }
}
