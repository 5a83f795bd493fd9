package org.fireup.ingest.format;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.fireup.ingest.api.BackupFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sniffs the first bytes of a backup file to decide between the binary log format and
 * newline-delimited JSON.
 * <p>
 * A sample is classified as {@link BackupFormat#JSON_LINES} only if all of the following hold:
 * <ul>
 *   <li>it is valid UTF-8 (a multi-byte character cut off by the sample limit is tolerated)</li>
 *   <li>it contains at least one {@code '{'} or {@code '['}</li>
 *   <li>it contains at least one newline</li>
 *   <li>at least {@code printableRatio} of its characters are printable or one of
 *       {@code \n}, {@code \r}, {@code \t}</li>
 * </ul>
 * Anything else, including an unreadable file, is {@link BackupFormat#LEVELDB_LOG}.
 */
public class FormatDetector {

    public static final int DEFAULT_SAMPLE_BYTES = 8192;
    public static final double DEFAULT_PRINTABLE_RATIO = 0.95;

    private static final Logger log = LoggerFactory.getLogger(FormatDetector.class);

    private final int sampleBytes;
    private final double printableRatio;

    public FormatDetector() {
        this(DEFAULT_SAMPLE_BYTES, DEFAULT_PRINTABLE_RATIO);
    }

    public FormatDetector(int sampleBytes, double printableRatio) {
        if (sampleBytes <= 0) {
            throw new IllegalArgumentException("sampleBytes must be positive: " + sampleBytes);
        }
        if (printableRatio <= 0 || printableRatio > 1) {
            throw new IllegalArgumentException("printableRatio must be in (0, 1]: " + printableRatio);
        }
        this.sampleBytes = sampleBytes;
        this.printableRatio = printableRatio;
    }

    /**
     * Detects the format of a file from its leading bytes. Never fails.
     *
     * @param file the backup file
     * @return the detected format, {@link BackupFormat#LEVELDB_LOG} if the file cannot be sampled
     */
    public BackupFormat detect(Path file) {
        byte[] sample;
        boolean truncated;
        try (InputStream in = Files.newInputStream(file)) {
            sample = in.readNBytes(sampleBytes);
            truncated = sample.length == sampleBytes && in.read() >= 0;
        } catch (IOException e) {
            log.debug("Cannot sample {}, assuming log format: {}", file, e.getMessage());
            return BackupFormat.LEVELDB_LOG;
        }
        BackupFormat format = classify(sample, truncated);
        log.debug("Detected {} for {}", format, file);
        return format;
    }

    /**
     * Classifies a complete sample.
     *
     * @param sample leading bytes of a file
     * @return the detected format
     */
    public BackupFormat classify(byte[] sample) {
        return classify(sample, false);
    }

    /**
     * Classifies a sample.
     *
     * @param sample    leading bytes of a file
     * @param truncated whether the file continues past the sample, in which case a trailing
     *                  incomplete UTF-8 sequence is not treated as invalid
     * @return the detected format
     */
    public BackupFormat classify(byte[] sample, boolean truncated) {
        String text = decodeUtf8(sample, truncated);
        if (text == null) {
            return BackupFormat.LEVELDB_LOG;
        }
        boolean hasBracket = text.indexOf('{') >= 0 || text.indexOf('[') >= 0;
        boolean hasNewline = text.indexOf('\n') >= 0;
        if (!hasBracket || !hasNewline) {
            return BackupFormat.LEVELDB_LOG;
        }

        long total = text.codePoints().count();
        long printable = text.codePoints().filter(FormatDetector::isTextual).count();
        return printable >= printableRatio * total ? BackupFormat.JSON_LINES : BackupFormat.LEVELDB_LOG;
    }

    private static boolean isTextual(int codePoint) {
        return codePoint == '\n' || codePoint == '\r' || codePoint == '\t' || !Character.isISOControl(codePoint);
    }

    private static String decodeUtf8(byte[] sample, boolean truncated) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(sample);
        CharBuffer out = CharBuffer.allocate(sample.length);
        CoderResult result = decoder.decode(in, out, !truncated);
        if (result.isError()) {
            return null;
        }
        if (!truncated) {
            result = decoder.flush(out);
            if (result.isError()) {
                return null;
            }
        } else if (in.remaining() > 3) {
            return null;
        }
        out.flip();
        return out.toString();
    }
}
