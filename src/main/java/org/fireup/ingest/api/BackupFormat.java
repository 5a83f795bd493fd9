package org.fireup.ingest.api;

/**
 * Physical encoding of a Firestore export backup file.
 */
public enum BackupFormat {
    /** Fixed-size block log with checksummed, possibly fragmented records. */
    LEVELDB_LOG,
    /** One JSON document per line. */
    JSON_LINES
}
