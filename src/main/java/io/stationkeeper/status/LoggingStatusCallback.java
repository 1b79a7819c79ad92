package io.stationkeeper.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingStatusCallback implements StatusChangeCallback {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingStatusCallback.class);

    @Override
    public void onStatusChange(StatusChange change) {
        String previous = change.previous().map(Enum::name).orElse("-");
        if (change.state() == WorkerState.FAILURE) {
            LOG.error("{}: {} -> {} ({})", change.name(), previous, change.state(), change.errorMessage().orElse("no error message"));
        } else {
            LOG.info("{}: {} -> {}", change.name(), previous, change.state());
        }
    }
}
