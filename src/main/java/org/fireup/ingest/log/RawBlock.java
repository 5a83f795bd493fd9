package org.fireup.ingest.log;

/**
 * One block-aligned chunk of a log file.
 * <p>
 * The data array has the configured block size, except for the final block of a file whose
 * length is not a multiple of it.
 *
 * @param index  zero-based block number
 * @param offset absolute file offset of the first byte
 * @param data   block contents
 */
public record RawBlock(long index, long offset, byte[] data) {

    public int length() {
        return data.length;
    }
}
