package org.fireup.ingest.log;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * The 7-byte little-endian header preceding every log record payload:
 * <pre>
 *   checksum : uint32  CRC-32 of the type byte followed by the payload
 *   length   : uint16  payload length in bytes
 *   type     : uint8   {@link RecordType} code
 * </pre>
 *
 * @param checksum stored checksum, unsigned
 * @param length   payload length, unsigned
 * @param type     record type
 */
public record RecordHeader(long checksum, int length, RecordType type) {

    public static final int SIZE = 7;

    /**
     * Serializes this header.
     *
     * @return the 7 header bytes
     */
    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt((int) checksum);
        buf.putShort((short) length);
        buf.put((byte) type.code());
        return buf.array();
    }
}
