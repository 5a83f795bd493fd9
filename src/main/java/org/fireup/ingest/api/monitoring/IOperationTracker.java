package org.fireup.ingest.api.monitoring;

/**
 * Handle for a single tracked operation, obtained from {@link IOperationMonitor#startOperation}.
 * <p>
 * Exactly one of {@link #completeSuccess()} or {@link #completeFailure(Throwable)} is expected
 * per operation; later completions are ignored by implementations.
 */
public interface IOperationTracker {

    String operationId();

    /**
     * Reports how many items the operation has produced so far.
     *
     * @param recordsProcessed cumulative item count
     */
    void updateProgress(long recordsProcessed);

    void completeSuccess();

    void completeFailure(Throwable cause);
}
