package org.fireup.ingest.services;

import java.time.Instant;
import java.util.List;

import org.fireup.ingest.api.BackupFormat;

/**
 * Outcome of {@link BackupValidator#validate}.
 *
 * @param valid         {@code true} if no errors were found
 * @param errors        problems that make the backup unusable
 * @param warnings      problems that degrade the backup
 * @param fileInfo      file level facts
 * @param structureInfo block and record counts
 * @param integrityInfo corruption counts and score
 */
public record ValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        FileInfo fileInfo,
        StructureInfo structureInfo,
        IntegrityInfo integrityInfo) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /**
     * @param path         the validated path
     * @param size         file size in bytes
     * @param readable     whether the file could be opened
     * @param lastModified last modification time, {@code null} if unknown
     * @param format       detected format, {@code null} if the file was not accessible
     */
    public record FileInfo(String path, long size, boolean readable, Instant lastModified, BackupFormat format) {
    }

    /**
     * @param totalBlocks      blocks read (0 for JSON lines)
     * @param validRecords     records with a valid header and checksum, or non-blank lines
     * @param corruptedRegions corrupted regions skipped by record resynchronization
     * @param documentRecords  payloads that decoded to a document
     * @param metadataRecords  payloads skipped as metadata or non-documents
     */
    public record StructureInfo(
            long totalBlocks,
            long validRecords,
            long corruptedRegions,
            long documentRecords,
            long metadataRecords) {

        static final StructureInfo EMPTY = new StructureInfo(0, 0, 0, 0, 0);
    }

    /**
     * @param checksumFailures  records rejected for a checksum mismatch
     * @param incompleteRecords fragments that were dropped before completion
     * @param parsingErrors     payloads that could not be decoded
     * @param integrityScore    {@code 1 - failures / total}, between 0 and 1
     */
    public record IntegrityInfo(
            long checksumFailures,
            long incompleteRecords,
            long parsingErrors,
            double integrityScore) {

        static final IntegrityInfo EMPTY = new IntegrityInfo(0, 0, 0, 0.0);
    }
}
