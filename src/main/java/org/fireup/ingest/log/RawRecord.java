package org.fireup.ingest.log;

/**
 * A checksum-verified record found inside a block.
 *
 * @param header     parsed header
 * @param payload    the {@code header.length()} payload bytes
 * @param blockIndex block the record was read from
 * @param offset     in-block offset of the header
 */
public record RawRecord(RecordHeader header, byte[] payload, long blockIndex, int offset) {

    public RecordType type() {
        return header.type();
    }
}
