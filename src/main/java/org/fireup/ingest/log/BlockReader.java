package org.fireup.ingest.log;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a log file as a sequence of fixed-size, block-aligned chunks.
 * <p>
 * Block {@code n} always starts at file offset {@code n * blockSize}. The last block is cut
 * to the number of bytes actually present, so file lengths need not be a multiple of the
 * block size. An empty file yields no blocks.
 * <p>
 * Not thread-safe; one reader serves a single parse.
 */
public class BlockReader implements Closeable {

    /** Block size used by Firestore export logs. */
    public static final int DEFAULT_BLOCK_SIZE = 32768;

    private static final Logger log = LoggerFactory.getLogger(BlockReader.class);

    private final Path file;
    private final int blockSize;
    private final FileChannel channel;
    private final long fileSize;
    private long blocksRead;

    /**
     * Opens the file for block reading.
     *
     * @param file      the log file
     * @param blockSize block size in bytes
     * @throws IOException if the file does not exist or cannot be opened
     */
    public BlockReader(Path file, int blockSize) throws IOException {
        if (blockSize <= RecordHeader.SIZE) {
            throw new IllegalArgumentException("blockSize must be larger than a record header: " + blockSize);
        }
        this.file = file;
        this.blockSize = blockSize;
        this.channel = FileChannel.open(file, StandardOpenOption.READ);
        try {
            this.fileSize = channel.size();
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        log.debug("Opened {} ({} bytes, block size {})", file, fileSize, blockSize);
    }

    public long fileSize() {
        return fileSize;
    }

    public long blocksRead() {
        return blocksRead;
    }

    /**
     * Reads the next block.
     *
     * @return the next block, or empty once the end of the file is reached
     * @throws IOException if seeking or reading fails
     */
    public Optional<RawBlock> nextBlock() throws IOException {
        long position = blocksRead * blockSize;
        if (position >= fileSize) {
            return Optional.empty();
        }
        channel.position(position);
        ByteBuffer buffer = ByteBuffer.allocate(blockSize);
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer);
            if (n < 0) {
                break;
            }
        }
        if (buffer.position() == 0) {
            return Optional.empty();
        }
        byte[] data = buffer.position() == blockSize
            ? buffer.array()
            : Arrays.copyOf(buffer.array(), buffer.position());
        RawBlock block = new RawBlock(blocksRead, position, data);
        blocksRead++;
        return Optional.of(block);
    }

    /**
     * Reads all remaining blocks into memory.
     *
     * @return the remaining blocks in file order
     * @throws IOException if seeking or reading fails
     */
    public List<RawBlock> readAll() throws IOException {
        List<RawBlock> blocks = new ArrayList<>();
        Optional<RawBlock> block;
        while ((block = nextBlock()).isPresent()) {
            blocks.add(block.get());
        }
        return blocks;
    }

    @Override
    public void close() throws IOException {
        channel.close();
        log.debug("Closed {} after {} blocks", file, blocksRead);
    }
}
