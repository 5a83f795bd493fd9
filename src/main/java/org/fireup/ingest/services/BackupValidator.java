package org.fireup.ingest.services;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.fireup.ingest.api.BackupFormat;
import org.fireup.ingest.api.DecodeError;
import org.fireup.ingest.decoding.DecodeOutcome;
import org.fireup.ingest.decoding.FirestoreDocumentDecoder;
import org.fireup.ingest.format.FormatDetector;
import org.fireup.ingest.log.BlockReader;
import org.fireup.ingest.log.BlockScan;
import org.fireup.ingest.log.FragmentReconstructor;
import org.fireup.ingest.log.LogStructureException;
import org.fireup.ingest.log.RawBlock;
import org.fireup.ingest.log.RawRecord;
import org.fireup.ingest.log.RecordParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks whether a backup file is usable before a full import, and how damaged it is.
 * <p>
 * <b>Validation steps:</b>
 * <ol>
 *   <li>File access: the path exists, is a regular readable file and, for the log format, is at
 *       least {@value #MIN_LOG_FILE_SIZE} bytes long.</li>
 *   <li>Structure and integrity: every block and record is walked with the same components the
 *       parser uses, counting checksum failures, corrupted regions and dropped fragments.</li>
 *   <li>Document format: every complete payload is decoded, counting documents, metadata
 *       records and undecodable payloads.</li>
 * </ol>
 * Data problems never throw; they end up in {@link ValidationResult#errors()} or
 * {@link ValidationResult#warnings()}.
 */
public class BackupValidator {

    public static final long MIN_LOG_FILE_SIZE = 1024;
    static final double LOW_INTEGRITY_THRESHOLD = 0.9;

    private static final Logger log = LoggerFactory.getLogger(BackupValidator.class);

    private final ParserOptions options;
    private final ProgressListener progressListener;

    public BackupValidator(ParserOptions options) {
        this(options, (step, current, total) -> log.debug("Progress: {} ({}/{})", step, current, total));
    }

    public BackupValidator(ParserOptions options, ProgressListener progressListener) {
        this.options = options;
        this.progressListener = progressListener;
    }

    /**
     * Validates a backup file.
     *
     * @param file the backup file
     * @return the validation result; {@link ValidationResult#valid()} is {@code false} if any error was found
     */
    public ValidationResult validate(Path file) {
        log.info("Validating backup {}", file);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        progressListener.onProgress("Validating file access", 0, 4);
        ValidationResult.FileInfo fileInfo = checkFileAccess(file, errors);
        if (!errors.isEmpty()) {
            return finish(false, errors, warnings, fileInfo,
                ValidationResult.StructureInfo.EMPTY, ValidationResult.IntegrityInfo.EMPTY);
        }

        progressListener.onProgress("Validating structure", 1, 4);
        Counters counters = new Counters();
        try {
            if (fileInfo.format() == BackupFormat.JSON_LINES) {
                walkJsonLines(file, counters);
            } else {
                walkLog(file, counters, errors);
            }
        } catch (IOException e) {
            errors.add("Failed to read backup: " + e.getMessage());
        }

        progressListener.onProgress("Validating document format", 3, 4);
        if (fileInfo.format() == BackupFormat.LEVELDB_LOG) {
            if (counters.blocks == 0) {
                errors.add("No blocks found in log file");
            } else if (counters.validRecords == 0) {
                errors.add("No records found in log file");
            }
            if (counters.corruptedRegions > counters.validRecords / 10) {
                warnings.add(String.format("High number of corrupted regions: %d against %d valid records",
                    counters.corruptedRegions, counters.validRecords));
            }
        }
        if (counters.documents == 0) {
            warnings.add("No Firestore documents found in backup");
        }
        if (counters.parsingErrors > 0) {
            warnings.add(counters.parsingErrors + " payloads could not be decoded");
        }
        if (counters.droppedFragments > 0) {
            warnings.add(counters.droppedFragments + " fragmented records were incomplete and dropped");
        }

        double score = counters.integrityScore();
        if (counters.total() > 0 && score < LOW_INTEGRITY_THRESHOLD) {
            warnings.add(String.format("Low integrity score: %.1f%% - consider using a different backup file",
                score * 100));
        }

        progressListener.onProgress("Validation complete", 4, 4);
        return finish(errors.isEmpty(), errors, warnings, fileInfo,
            new ValidationResult.StructureInfo(counters.blocks, counters.validRecords, counters.corruptedRegions,
                counters.documents, counters.skipped),
            new ValidationResult.IntegrityInfo(counters.checksumFailures, counters.droppedFragments,
                counters.parsingErrors, score));
    }

    /**
     * Renders a plain text report of a validation result.
     *
     * @param result the result to render
     * @return the multi-line report
     */
    public String summaryReport(ValidationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Firestore Backup Validation Report ===\n\n");
        sb.append("Overall Status: ").append(result.valid() ? "VALID" : "INVALID").append('\n');

        ValidationResult.FileInfo file = result.fileInfo();
        sb.append("\n--- File Information ---\n");
        sb.append("Path: ").append(file.path()).append('\n');
        sb.append(String.format("Size: %d bytes (%.2f MB)%n", file.size(), file.size() / 1024.0 / 1024.0));
        sb.append("Readable: ").append(file.readable()).append('\n');
        if (file.format() != null) {
            sb.append("Format: ").append(file.format()).append('\n');
        }
        if (file.lastModified() != null) {
            sb.append("Last Modified: ").append(file.lastModified()).append('\n');
        }

        ValidationResult.StructureInfo structure = result.structureInfo();
        sb.append("\n--- Structure Information ---\n");
        sb.append("Total Blocks: ").append(structure.totalBlocks()).append('\n');
        sb.append("Valid Records: ").append(structure.validRecords()).append('\n');
        sb.append("Corrupted Regions: ").append(structure.corruptedRegions()).append('\n');
        sb.append("Document Records: ").append(structure.documentRecords()).append('\n');
        sb.append("Metadata Records: ").append(structure.metadataRecords()).append('\n');

        ValidationResult.IntegrityInfo integrity = result.integrityInfo();
        sb.append("\n--- Integrity Information ---\n");
        sb.append(String.format("Integrity Score: %.1f%%%n", integrity.integrityScore() * 100));
        sb.append("Checksum Failures: ").append(integrity.checksumFailures()).append('\n');
        sb.append("Incomplete Records: ").append(integrity.incompleteRecords()).append('\n');
        sb.append("Parsing Errors: ").append(integrity.parsingErrors()).append('\n');

        appendNumbered(sb, "Errors", result.errors());
        appendNumbered(sb, "Warnings", result.warnings());
        sb.append("\n=== End of Report ===\n");
        return sb.toString();
    }

    private ValidationResult.FileInfo checkFileAccess(Path file, List<String> errors) {
        if (!Files.exists(file)) {
            errors.add("File does not exist: " + file);
            return new ValidationResult.FileInfo(file.toString(), 0, false, null, null);
        }
        if (!Files.isRegularFile(file)) {
            errors.add("Path is not a file: " + file);
            return new ValidationResult.FileInfo(file.toString(), 0, false, null, null);
        }
        long size;
        Instant lastModified;
        try {
            size = Files.size(file);
            lastModified = Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            errors.add("Failed to read file metadata: " + e.getMessage());
            return new ValidationResult.FileInfo(file.toString(), 0, false, null, null);
        }
        boolean readable = isReadable(file);
        if (!readable) {
            errors.add("File is not readable: " + file);
            return new ValidationResult.FileInfo(file.toString(), size, false, lastModified, null);
        }
        BackupFormat format = new FormatDetector(options.detectionSampleBytes(), options.printableRatio())
            .detect(file);
        if (format == BackupFormat.LEVELDB_LOG && size < MIN_LOG_FILE_SIZE) {
            errors.add(String.format("File too small to be a valid log backup: %d bytes", size));
        }
        return new ValidationResult.FileInfo(file.toString(), size, true, lastModified, format);
    }

    private void walkLog(Path file, Counters counters, List<String> errors) throws IOException {
        RecordParser recordParser = new RecordParser();
        FirestoreDocumentDecoder decoder = new FirestoreDocumentDecoder(options.minDocumentBytes());
        FragmentReconstructor reconstructor = new FragmentReconstructor();
        try (BlockReader reader = new BlockReader(file, options.blockSize())) {
            long totalBlocks = (reader.fileSize() + options.blockSize() - 1) / options.blockSize();
            long payloadIndex = 0;
            Optional<RawBlock> block;
            while ((block = reader.nextBlock()).isPresent()) {
                progressListener.onProgress("Validating block structure", block.get().index(), totalBlocks);
                BlockScan scan = recordParser.scan(block.get());
                counters.corruptedRegions += scan.errors().size();
                counters.checksumFailures += scan.errors().stream()
                    .filter(e -> e.code() == DecodeError.Code.CHECKSUM_MISMATCH)
                    .count();
                for (RawRecord record : scan.records()) {
                    counters.validRecords++;
                    Optional<byte[]> payload = reconstructor.accept(record);
                    if (payload.isPresent()) {
                        counters.count(decoder.decodeRecord(payload.get(), payloadIndex++));
                    }
                }
            }
            reconstructor.finish();
            counters.blocks = reader.blocksRead();
        } catch (LogStructureException e) {
            errors.add("Broken record fragmentation: " + e.getMessage());
        } finally {
            counters.droppedFragments = reconstructor.droppedFragments();
        }
    }

    private void walkJsonLines(Path file, Counters counters) throws IOException {
        FirestoreDocumentDecoder decoder = new FirestoreDocumentDecoder(options.minDocumentBytes());
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            long lineIndex = 0;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                counters.validRecords++;
                DecodeOutcome outcome = decoder.decodeLine(line, lineIndex++);
                if (FirestoreDocumentDecoder.REASON_INVALID_JSON_LINE.equals(outcome.reason())) {
                    counters.parsingErrors++;
                } else {
                    counters.count(outcome);
                }
            }
        }
    }

    private static boolean isReadable(Path file) {
        try (FileChannel ignored = FileChannel.open(file, StandardOpenOption.READ)) {
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static void appendNumbered(StringBuilder sb, String title, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        sb.append("\n--- ").append(title).append(" ---\n");
        for (int i = 0; i < lines.size(); i++) {
            sb.append(i + 1).append(". ").append(lines.get(i)).append('\n');
        }
    }

    private ValidationResult finish(boolean valid, List<String> errors, List<String> warnings,
                                    ValidationResult.FileInfo fileInfo,
                                    ValidationResult.StructureInfo structureInfo,
                                    ValidationResult.IntegrityInfo integrityInfo) {
        log.info("Validation of {} complete: {} ({} errors, {} warnings)", fileInfo.path(),
            valid ? "VALID" : "INVALID", errors.size(), warnings.size());
        return new ValidationResult(valid, errors, warnings, fileInfo, structureInfo, integrityInfo);
    }

    private static final class Counters {
        long blocks;
        long validRecords;
        long corruptedRegions;
        long checksumFailures;
        long droppedFragments;
        long documents;
        long skipped;
        long parsingErrors;

        void count(DecodeOutcome outcome) {
            switch (outcome.kind()) {
                case DOCUMENT -> documents++;
                case SKIPPED -> skipped++;
                case ERROR -> parsingErrors++;
            }
        }

        long total() {
            return validRecords + corruptedRegions;
        }

        double integrityScore() {
            long total = total();
            if (total == 0) {
                return 0.0;
            }
            long failures = corruptedRegions + droppedFragments + parsingErrors;
            return Math.max(0.0, 1.0 - (double) failures / total);
        }
    }
}
