package io.stationkeeper.status;

/**
 * Push-style sink for worker state transitions. Implementations are invoked
 * synchronously, in registration order, from the thread that caused the
 * transition; exceptions they throw are logged and dropped.
 */
@FunctionalInterface
public interface StatusChangeCallback {
    void onStatusChange(StatusChange change);
}
