package org.fireup.ingest.api;

import java.time.Instant;

/**
 * Metadata attached to a decoded {@link FirestoreDocument}.
 *
 * @param createdAt creation time from {@code createTime}, or {@code null} if absent or unparseable
 * @param updatedAt update time from {@code updateTime}, or {@code null} if absent or unparseable
 * @param path      the document's resource path, {@code "unknown"} when the payload carries none
 * @param sizeBytes serialized size of the document, {@code null} when not computed
 */
public record DocumentMetadata(Instant createdAt, Instant updatedAt, String path, Long sizeBytes) {
}
