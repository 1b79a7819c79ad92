package io.stationkeeper.distribution;

/**
 * Listing, downloading or adopting a versioned configuration file failed.
 * The local configuration is left as it was.
 */
public final class DistributionException extends RuntimeException {
    public DistributionException(String message) {
        super(message);
    }

    public DistributionException(String message, Throwable cause) {
        super(message, cause);
    }
}
