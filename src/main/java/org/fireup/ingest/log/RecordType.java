package org.fireup.ingest.log;

/**
 * Fragmentation marker of a log record, stored as the last byte of the record header.
 */
public enum RecordType {
    FULL(1),
    FIRST(2),
    MIDDLE(3),
    LAST(4);

    private final int code;

    RecordType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a header type byte.
     *
     * @param code the unsigned type byte
     * @return the record type, or {@code null} if the byte is not a known type
     */
    public static RecordType fromCode(int code) {
        return switch (code) {
            case 1 -> FULL;
            case 2 -> FIRST;
            case 3 -> MIDDLE;
            case 4 -> LAST;
            default -> null;
        };
    }
}
