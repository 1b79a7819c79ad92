package io.stationkeeper.status;

/**
 * Externally observable state of one worker. {@link #severity()} orders states
 * from healthy to broken, used to summarize a station in a single state.
 */
public enum WorkerState {
    RUNNING(0),
    STARTING(1),
    OFF(2),
    FAILURE(3);

    private final int severity;

    WorkerState(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    public static WorkerState worst(Iterable<WorkerState> states) {
        WorkerState worst = RUNNING;
        for (WorkerState state : states) {
            if (state.severity > worst.severity) {
                worst = state;
            }
        }
        return worst;
    }
}
