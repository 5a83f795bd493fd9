package org.fireup.ingest.monitoring;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.fireup.ingest.api.monitoring.AuditLogEntry;
import org.fireup.ingest.api.monitoring.AuditResult;
import org.fireup.ingest.api.monitoring.IOperationMonitor;
import org.fireup.ingest.api.monitoring.IOperationTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * {@link IOperationMonitor} that logs every event through SLF4J and keeps bounded in-memory
 * histories of completed operations and audit entries.
 * <p>
 * When a history exceeds its limit the oldest entries are evicted. Thread-safe: independent
 * parses may report to the same monitor concurrently.
 */
public class InMemoryOperationMonitor implements IOperationMonitor {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOperationMonitor.class);

    private final int maxCompletedOperations;
    private final int maxAuditEntries;
    private final boolean auditEnabled;

    private final Map<String, OperationMetrics> activeOperations = new ConcurrentHashMap<>();
    // Guarded by their own monitors.
    private final Deque<OperationMetrics> completedOperations = new ArrayDeque<>();
    private final Deque<AuditLogEntry> auditLog = new ArrayDeque<>();

    public InMemoryOperationMonitor(int maxCompletedOperations, int maxAuditEntries, boolean auditEnabled) {
        if (maxCompletedOperations < 1 || maxAuditEntries < 1) {
            throw new IllegalArgumentException("History limits must be positive");
        }
        this.maxCompletedOperations = maxCompletedOperations;
        this.maxAuditEntries = maxAuditEntries;
        this.auditEnabled = auditEnabled;
    }

    /**
     * Creates a monitor from the {@code fireup.monitoring} configuration block.
     *
     * @param config block containing {@code maxCompletedOperations}, {@code maxAuditEntries}
     *               and {@code auditEnabled}
     * @return the monitor
     */
    public static InMemoryOperationMonitor fromConfig(Config config) {
        return new InMemoryOperationMonitor(
            config.getInt("maxCompletedOperations"),
            config.getInt("maxAuditEntries"),
            config.getBoolean("auditEnabled"));
    }

    @Override
    public IOperationTracker startOperation(String operationName, Map<String, String> metadata) {
        String id = UUID.randomUUID().toString();
        OperationMetrics metrics = new OperationMetrics(id, operationName, Instant.now(), null, 0,
            OperationMetrics.Status.STARTED, null, metadata);
        activeOperations.put(id, metrics);
        log.info("Started operation {} ({}) {}", operationName, id, metadata);
        return new Tracker(id);
    }

    @Override
    public void logAudit(AuditLogEntry entry) {
        if (!auditEnabled) {
            return;
        }
        appendBounded(auditLog, entry, maxAuditEntries);
        if (entry.result() == AuditResult.SUCCESS) {
            log.info("Audit: {} {} {} -> {} {}", entry.action(), entry.resourceType(), entry.resourceId(),
                entry.result(), entry.details());
        } else {
            log.warn("Audit: {} {} {} -> {} ({}) {}", entry.action(), entry.resourceType(), entry.resourceId(),
                entry.result(), entry.reason(), entry.details());
        }
    }

    public Optional<OperationMetrics> getActiveOperation(String operationId) {
        return Optional.ofNullable(activeOperations.get(operationId));
    }

    /**
     * @return completed operations, oldest first
     */
    public List<OperationMetrics> getCompletedOperations() {
        synchronized (completedOperations) {
            return new ArrayList<>(completedOperations);
        }
    }

    /**
     * Returns the most recent audit entries.
     *
     * @param limit maximum number of entries
     * @return up to {@code limit} entries, oldest first
     */
    public List<AuditLogEntry> getRecentAuditEntries(int limit) {
        List<AuditLogEntry> all;
        synchronized (auditLog) {
            all = new ArrayList<>(auditLog);
        }
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    private void complete(String id, OperationMetrics.Status status, String failureMessage) {
        OperationMetrics active = activeOperations.remove(id);
        if (active == null) {
            return;
        }
        OperationMetrics done = new OperationMetrics(active.operationId(), active.operationName(),
            active.startTime(), Instant.now(), active.recordsProcessed(), status, failureMessage, active.metadata());
        appendBounded(completedOperations, done, maxCompletedOperations);
        if (status == OperationMetrics.Status.COMPLETED) {
            log.info("Completed operation {} ({}) in {} ms, {} records ({} records/s)", done.operationName(), id,
                done.duration().toMillis(), done.recordsProcessed(), String.format("%.1f", done.throughput()));
        } else {
            log.warn("Operation {} ({}) failed after {} ms: {}", done.operationName(), id,
                done.duration().toMillis(), failureMessage);
        }
    }

    private static <T> void appendBounded(Deque<T> history, T item, int limit) {
        synchronized (history) {
            history.addLast(item);
            if (history.size() > limit) {
                history.pollFirst();
            }
        }
    }

    private final class Tracker implements IOperationTracker {

        private final String id;
        private final AtomicBoolean completed = new AtomicBoolean();

        private Tracker(String id) {
            this.id = id;
        }

        @Override
        public String operationId() {
            return id;
        }

        @Override
        public void updateProgress(long recordsProcessed) {
            activeOperations.computeIfPresent(id, (key, m) -> new OperationMetrics(m.operationId(),
                m.operationName(), m.startTime(), null, recordsProcessed, OperationMetrics.Status.IN_PROGRESS,
                null, m.metadata()));
            log.debug("Operation {} progress: {} records", id, recordsProcessed);
        }

        @Override
        public void completeSuccess() {
            if (completed.compareAndSet(false, true)) {
                complete(id, OperationMetrics.Status.COMPLETED, null);
            }
        }

        @Override
        public void completeFailure(Throwable cause) {
            if (completed.compareAndSet(false, true)) {
                complete(id, OperationMetrics.Status.FAILED, cause != null ? cause.toString() : "unknown");
            }
        }
    }
}
