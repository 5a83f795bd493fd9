package org.fireup.ingest.api;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes a single Firestore backup file into documents.
 */
public interface IBackupParser {

    /**
     * Parses the given backup file.
     * <p>
     * Record-level corruption (bad checksums, unparseable payloads) is reported through
     * {@link ParseResult#errors()}. Only I/O failures and structural corruption of the
     * record fragmentation protocol abort the parse.
     *
     * @param file the backup file, which must be a regular file
     * @return the decoded documents and statistics
     * @throws IOException if the file cannot be read, or if a continuation record
     *                     appears without a preceding first fragment
     */
    ParseResult parse(Path file) throws IOException;
}
