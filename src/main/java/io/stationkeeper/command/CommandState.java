package io.stationkeeper.command;

public enum CommandState {
    PENDING,
    RUNNING,
    DONE
}
