package org.fireup.ingest.log;

import java.io.IOException;

/**
 * Thrown when the record fragmentation protocol of a log file is violated, i.e. a
 * {@link RecordType#MIDDLE} or {@link RecordType#LAST} record arrives while no fragment is open.
 * <p>
 * Unlike checksum or payload corruption this is not recoverable: the whole parse is aborted.
 */
public class LogStructureException extends IOException {

    private final long blockIndex;
    private final int offset;
    private final RecordType recordType;

    public LogStructureException(RecordType recordType, long blockIndex, int offset) {
        super(String.format("%s record without preceding FIRST record at block %d, offset %d",
            recordType, blockIndex, offset));
        this.recordType = recordType;
        this.blockIndex = blockIndex;
        this.offset = offset;
    }

    public long getBlockIndex() {
        return blockIndex;
    }

    public int getOffset() {
        return offset;
    }

    public RecordType getRecordType() {
        return recordType;
    }
}
