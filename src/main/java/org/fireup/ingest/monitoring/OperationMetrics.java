package org.fireup.ingest.monitoring;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a tracked operation.
 *
 * @param operationId      unique id
 * @param operationName    logical operation name
 * @param startTime        when the operation started
 * @param endTime          when it completed, {@code null} while running
 * @param recordsProcessed last reported progress count
 * @param status           current status
 * @param failureMessage   message of the failure cause for {@link Status#FAILED}, otherwise {@code null}
 * @param metadata         metadata attached at start
 */
public record OperationMetrics(
        String operationId,
        String operationName,
        Instant startTime,
        Instant endTime,
        long recordsProcessed,
        Status status,
        String failureMessage,
        Map<String, String> metadata) {

    public enum Status {
        STARTED,
        IN_PROGRESS,
        COMPLETED,
        FAILED
    }

    public OperationMetrics {
        metadata = Map.copyOf(metadata);
    }

    /**
     * @return elapsed time, up to now for a running operation
     */
    public Duration duration() {
        return Duration.between(startTime, endTime != null ? endTime : Instant.now());
    }

    /**
     * @return records per second, 0 if no time has elapsed
     */
    public double throughput() {
        long millis = duration().toMillis();
        return millis > 0 ? recordsProcessed * 1000.0 / millis : 0.0;
    }
}
