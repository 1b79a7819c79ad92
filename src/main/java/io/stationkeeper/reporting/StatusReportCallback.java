package io.stationkeeper.reporting;

import io.stationkeeper.status.StatusReport;

/**
 * Receives every periodic status report (for instance to push it to a
 * notification service).
 */
@FunctionalInterface
public interface StatusReportCallback {
    void onReport(StatusReport report);
}
