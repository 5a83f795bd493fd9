package org.fireup.ingest.api;

/**
 * A local, non-fatal failure encountered while decoding a backup.
 * <p>
 * Local errors never abort a parse; they are collected into {@link ParseResult#errors()}.
 * Location fields that do not apply to the failure are {@code -1}.
 *
 * @param code        failure category
 * @param message     human-readable description
 * @param blockIndex  index of the block the failure was found in
 * @param offset      byte offset inside that block
 * @param recordIndex ordinal of the logical record handed to the document decoder
 */
public record DecodeError(Code code, String message, long blockIndex, int offset, long recordIndex) {

    public enum Code {
        INVALID_RECORD_TYPE,
        TRUNCATED_RECORD,
        CHECKSUM_MISMATCH,
        UNPARSEABLE_RECORD
    }

    public static DecodeError inBlock(Code code, String message, long blockIndex, int offset) {
        return new DecodeError(code, message, blockIndex, offset, -1);
    }

    public static DecodeError forRecord(Code code, String message, long recordIndex) {
        return new DecodeError(code, message, -1, -1, recordIndex);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(code.name()).append(": ").append(message);
        if (blockIndex >= 0) {
            sb.append(" [block ").append(blockIndex).append(", offset ").append(offset).append(']');
        }
        if (recordIndex >= 0) {
            sb.append(" [record ").append(recordIndex).append(']');
        }
        return sb.toString();
    }
}
