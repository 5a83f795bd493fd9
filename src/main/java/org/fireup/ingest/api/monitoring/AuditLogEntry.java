package org.fireup.ingest.api.monitoring;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One audit record describing access to a resource.
 *
 * @param entryId      unique id of the entry
 * @param timestamp    when the entry was created
 * @param resourceType kind of resource, e.g. {@code backup_file}
 * @param resourceId   identifier of the resource, e.g. its path
 * @param action       what was done, e.g. {@code parse}
 * @param result       outcome classification
 * @param reason       failure or partial-success description, {@code null} on success
 * @param details      free-form key/value details
 */
public record AuditLogEntry(
        String entryId,
        Instant timestamp,
        String resourceType,
        String resourceId,
        String action,
        AuditResult result,
        String reason,
        Map<String, String> details) {

    public AuditLogEntry {
        details = Map.copyOf(details);
    }

    public static AuditLogEntry of(String resourceType, String resourceId, String action,
                                   AuditResult result, String reason, Map<String, String> details) {
        return new AuditLogEntry(UUID.randomUUID().toString(), Instant.now(),
            resourceType, resourceId, action, result, reason, details);
    }
}
