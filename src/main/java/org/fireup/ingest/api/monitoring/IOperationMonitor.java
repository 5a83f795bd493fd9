package org.fireup.ingest.api.monitoring;

import java.util.Map;

/**
 * Progress and audit sink for long-running operations.
 * <p>
 * Injected into components that report progress so that they carry no global monitoring
 * state. Calls are fire-and-forget from the caller's perspective: a failing monitor must not
 * change the outcome of the monitored operation.
 */
public interface IOperationMonitor {

    /** Monitor that discards everything. */
    IOperationMonitor NOOP = new IOperationMonitor() {
        @Override
        public IOperationTracker startOperation(String operationName, Map<String, String> metadata) {
            return new IOperationTracker() {
                @Override
                public String operationId() {
                    return "noop";
                }

                @Override
                public void updateProgress(long recordsProcessed) {
                }

                @Override
                public void completeSuccess() {
                }

                @Override
                public void completeFailure(Throwable cause) {
                }
            };
        }

        @Override
        public void logAudit(AuditLogEntry entry) {
        }
    };

    /**
     * Starts tracking a new operation.
     *
     * @param operationName logical name, e.g. {@code parse_backup}
     * @param metadata      initial key/value metadata attached to the operation
     * @return a tracker for reporting progress and completion
     */
    IOperationTracker startOperation(String operationName, Map<String, String> metadata);

    /**
     * Records an audit entry.
     *
     * @param entry the entry to record
     */
    void logAudit(AuditLogEntry entry);
}
