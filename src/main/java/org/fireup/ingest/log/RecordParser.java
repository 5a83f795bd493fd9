package org.fireup.ingest.log;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.CRC32;

import org.fireup.ingest.api.DecodeError;
import org.fireup.ingest.api.DecodeError.Code;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a block into its back-to-back records and verifies each record's checksum.
 * <p>
 * <b>Scan rules:</b>
 * <ul>
 *   <li>If every byte from the current offset to the end of the block is zero, the rest of
 *       the block is padding and the scan stops.</li>
 *   <li>A header with an unknown type byte, a payload running past the end of the block, or a
 *       checksum mismatch is a local error. The scan then resynchronizes by retrying at the
 *       next byte offset.</li>
 *   <li>A resynchronizing scan only reports the first failure of a corrupted region. A
 *       checksum mismatch under a sound header spans exactly that record, so a failure at or
 *       after its end starts a new region. Any other failure has no known extent; the next
 *       successfully parsed record ends it.</li>
 * </ul>
 * Stateless and thread-safe.
 */
public class RecordParser {

    private static final Logger log = LoggerFactory.getLogger(RecordParser.class);

    /**
     * Computes the checksum stored in a record header: CRC-32 of the type byte followed by
     * the payload.
     *
     * @param type    record type
     * @param payload buffer holding the payload
     * @param offset  payload start in {@code payload}
     * @param length  payload length
     * @return the unsigned CRC-32 value
     */
    public static long checksum(RecordType type, byte[] payload, int offset, int length) {
        CRC32 crc = new CRC32();
        crc.update(type.code());
        crc.update(payload, offset, length);
        return crc.getValue();
    }

    /**
     * Scans a block.
     *
     * @param block the block to scan
     * @return the valid records and local errors of the block
     */
    public BlockScan scan(RawBlock block) {
        byte[] data = block.data();
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        int lastNonZero = lastNonZeroIndex(data);

        List<RawRecord> records = new ArrayList<>();
        List<DecodeError> errors = new ArrayList<>();
        boolean resynchronizing = false;
        int regionEnd = Integer.MAX_VALUE;
        int offset = 0;

        while (offset < data.length && offset <= lastNonZero) {
            DecodeError failure = null;
            RawRecord record = null;
            int failureEnd = Integer.MAX_VALUE;

            if (data.length - offset < RecordHeader.SIZE) {
                failure = DecodeError.inBlock(Code.TRUNCATED_RECORD,
                    "Record header truncated by end of block", block.index(), offset);
            } else {
                long storedChecksum = Integer.toUnsignedLong(buf.getInt(offset));
                int length = Short.toUnsignedInt(buf.getShort(offset + 4));
                int typeCode = Byte.toUnsignedInt(data[offset + 6]);
                RecordType type = RecordType.fromCode(typeCode);
                int payloadStart = offset + RecordHeader.SIZE;

                if (type == null) {
                    failure = DecodeError.inBlock(Code.INVALID_RECORD_TYPE,
                        "Invalid record type " + typeCode, block.index(), offset);
                } else if (payloadStart + length > data.length) {
                    failure = DecodeError.inBlock(Code.TRUNCATED_RECORD,
                        String.format("Record length %d exceeds block bounds", length), block.index(), offset);
                } else {
                    long expected = checksum(type, data, payloadStart, length);
                    if (expected != storedChecksum) {
                        failure = DecodeError.inBlock(Code.CHECKSUM_MISMATCH,
                            String.format("Checksum mismatch: stored %08x, computed %08x", storedChecksum, expected),
                            block.index(), offset);
                        failureEnd = payloadStart + length;
                    } else {
                        byte[] payload = Arrays.copyOfRange(data, payloadStart, payloadStart + length);
                        record = new RawRecord(new RecordHeader(storedChecksum, length, type), payload,
                            block.index(), offset);
                    }
                }
            }

            if (record != null) {
                records.add(record);
                resynchronizing = false;
                offset += RecordHeader.SIZE + record.header().length();
            } else {
                if (!resynchronizing || offset >= regionEnd) {
                    log.debug("{}", failure);
                    errors.add(failure);
                    resynchronizing = true;
                    regionEnd = failureEnd;
                }
                offset++;
            }
        }
        return new BlockScan(records, errors);
    }

    private static int lastNonZeroIndex(byte[] data) {
        for (int i = data.length - 1; i >= 0; i--) {
            if (data[i] != 0) {
                return i;
            }
        }
        return -1;
    }
}
