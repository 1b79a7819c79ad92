package io.stationkeeper.distribution;

/**
 * What one distribution round did.
 *
 * @param action   outcome kind
 * @param filename file the action is about, null when none
 * @param detail   human readable detail, null when none
 */
public record DistributionOutcome(Action action, String filename, String detail) {
    public enum Action {
        /** the remote store publishes no versioned file */
        NO_REMOTE_FILE,
        /** the local best version is at least the remote best one */
        UP_TO_DATE,
        /** a newer remote file was downloaded, validated and adopted */
        ADOPTED,
        /** a newer remote file failed validation and was discarded */
        REJECTED
    }

    static DistributionOutcome of(Action action, String filename) {
        return new DistributionOutcome(action, filename, null);
    }
}
