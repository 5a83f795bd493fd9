package org.fireup.ingest.api;

/**
 * Statistics computed once at the end of a parse.
 *
 * @param fileSize         size of the backup file in bytes
 * @param documentCount    number of documents produced
 * @param collectionCount  number of distinct collections among those documents
 * @param blocksProcessed  number of log blocks read (0 for JSON lines input)
 * @param recordsProcessed number of valid log records, or non-blank lines for JSON lines input
 * @param format           the detected input encoding
 * @param totalErrors      number of local decode errors seen, including any not retained
 */
public record BackupMetadata(
        long fileSize,
        long documentCount,
        long collectionCount,
        long blocksProcessed,
        long recordsProcessed,
        BackupFormat format,
        long totalErrors) {
}
