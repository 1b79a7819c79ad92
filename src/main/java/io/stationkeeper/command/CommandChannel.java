package io.stationkeeper.command;

import java.util.Optional;

/**
 * Where command requests come from and where their results go back to.
 */
public interface CommandChannel extends AutoCloseable {
    /**
     * The next request not consumed yet. A returned request counts as consumed.
     *
     * @param previous the last request the caller consumed from this endpoint, or null. Channels
     *                 without durable memory of their own use it to skip a request served again.
     * @throws io.stationkeeper.worker.AuthenticationException if the sender's token does not match
     */
    Optional<CommandRequest> poll(CommandRequest previous);

    void report(CommandResult result);

    /**
     * Checks the channel is reachable without consuming anything.
     */
    void probe();

    String describe();

    @Override
    default void close() {
    }
}
