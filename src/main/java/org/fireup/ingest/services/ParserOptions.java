package org.fireup.ingest.services;

import org.fireup.ingest.decoding.FirestoreDocumentDecoder;
import org.fireup.ingest.format.FormatDetector;
import org.fireup.ingest.log.BlockReader;
import org.fireup.ingest.log.RecordHeader;

import com.typesafe.config.Config;

/**
 * Tuning knobs of {@link FirestoreBackupParser}.
 *
 * @param blockSize              log block size in bytes
 * @param detectionSampleBytes   number of leading bytes sampled by format detection
 * @param printableRatio         minimum share of printable characters for a JSON lines sample
 * @param minDocumentBytes       log payloads shorter than this are metadata records
 * @param maxErrors              maximum number of local errors retained in a result
 */
public record ParserOptions(
        int blockSize,
        int detectionSampleBytes,
        double printableRatio,
        int minDocumentBytes,
        int maxErrors) {

    public ParserOptions {
        if (blockSize <= RecordHeader.SIZE) {
            throw new IllegalArgumentException("blockSize must be larger than " + RecordHeader.SIZE + ": " + blockSize);
        }
        if (detectionSampleBytes <= 0) {
            throw new IllegalArgumentException("detection.sampleBytes must be positive: " + detectionSampleBytes);
        }
        if (printableRatio <= 0 || printableRatio > 1) {
            throw new IllegalArgumentException("detection.printableRatio must be in (0, 1]: " + printableRatio);
        }
        if (minDocumentBytes < 0) {
            throw new IllegalArgumentException("minDocumentBytes must not be negative: " + minDocumentBytes);
        }
        if (maxErrors < 0) {
            throw new IllegalArgumentException("maxErrors must not be negative: " + maxErrors);
        }
    }

    public static ParserOptions defaults() {
        return new ParserOptions(
            BlockReader.DEFAULT_BLOCK_SIZE,
            FormatDetector.DEFAULT_SAMPLE_BYTES,
            FormatDetector.DEFAULT_PRINTABLE_RATIO,
            FirestoreDocumentDecoder.DEFAULT_MIN_DOCUMENT_BYTES,
            10000);
    }

    /**
     * Reads options from the {@code fireup.parser} configuration block.
     *
     * @param config the {@code fireup.parser} block
     * @return the validated options
     * @throws IllegalArgumentException if a value is out of range
     * @throws com.typesafe.config.ConfigException if a value is missing or has the wrong type
     */
    public static ParserOptions fromConfig(Config config) {
        return new ParserOptions(
            config.getInt("blockSize"),
            config.getInt("detection.sampleBytes"),
            config.getDouble("detection.printableRatio"),
            config.getInt("minDocumentBytes"),
            config.getInt("maxErrors"));
    }
}
