package io.stationkeeper.command;

/**
 * A command channel could not be polled or could not take a result.
 */
public final class CommandException extends RuntimeException {
    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
