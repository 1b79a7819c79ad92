package io.stationkeeper.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingCommandCallback implements CommandCallback {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingCommandCallback.class);

    @Override
    public void onCommandResult(CommandResult result) {
        if (result.succeeded()) {
            LOG.info("executed command {} with return code 0", result.commandId());
        } else {
            LOG.error("executed command {} with return code {}: {}",
                    result.commandId(), result.exitCode(), result.stderr().strip());
        }
    }
}
