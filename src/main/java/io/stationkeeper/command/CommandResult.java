package io.stationkeeper.command;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one command. A command that could not be spawned or ran out of
 * time reports exit code -1.
 */
public record CommandResult(String commandId, String commandText, int exitCode, String stdout, String stderr) {
    public static final int NO_EXIT_CODE = -1;

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static CommandResult failed(CommandRequest request, String error) {
        return new CommandResult(request.commandId(), request.commandText(), NO_EXIT_CODE, "", error);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    /**
     * Field names of the result wire format.
     */
    public Map<String, Object> toWire() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("command_id", commandId);
        out.put("command_text", commandText);
        out.put("exit_code", exitCode);
        out.put("stdout", stdout);
        out.put("stderr", stderr);
        return out;
    }
}
