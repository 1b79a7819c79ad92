package io.stationkeeper.command;

/**
 * A shell command a station was asked to run.
 *
 * @param authToken token the sender presented, null for local requests
 */
public record CommandRequest(String commandId, String commandText, String authToken) {
    public CommandRequest {
        if (commandId == null || commandId.isBlank()) {
            throw new IllegalArgumentException("command id cannot be empty");
        }
        commandText = commandText == null ? "" : commandText;
    }
}
