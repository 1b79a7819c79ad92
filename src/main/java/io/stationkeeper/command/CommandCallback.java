package io.stationkeeper.command;

/**
 * Receives the result of every command the executor ran, once per command.
 */
@FunctionalInterface
public interface CommandCallback {
    void onCommandResult(CommandResult result);
}
