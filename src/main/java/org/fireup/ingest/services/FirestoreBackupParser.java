package org.fireup.ingest.services;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.fireup.ingest.api.BackupFormat;
import org.fireup.ingest.api.BackupMetadata;
import org.fireup.ingest.api.DecodeError;
import org.fireup.ingest.api.FirestoreDocument;
import org.fireup.ingest.api.IBackupParser;
import org.fireup.ingest.api.ParseResult;
import org.fireup.ingest.api.monitoring.AuditLogEntry;
import org.fireup.ingest.api.monitoring.AuditResult;
import org.fireup.ingest.api.monitoring.IOperationMonitor;
import org.fireup.ingest.api.monitoring.IOperationTracker;
import org.fireup.ingest.decoding.DecodeOutcome;
import org.fireup.ingest.decoding.FirestoreDocumentDecoder;
import org.fireup.ingest.format.FormatDetector;
import org.fireup.ingest.log.BlockReader;
import org.fireup.ingest.log.BlockScan;
import org.fireup.ingest.log.FragmentReconstructor;
import org.fireup.ingest.log.RawBlock;
import org.fireup.ingest.log.RawRecord;
import org.fireup.ingest.log.RecordParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a Firestore export backup file into documents.
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 *   <li>{@link FormatDetector} samples the file once.</li>
 *   <li>For the log format, {@link BlockReader} streams blocks, {@link RecordParser} splits each
 *       block into verified records and {@link FragmentReconstructor} reassembles logical
 *       payloads, which are handed to {@link FirestoreDocumentDecoder} as they complete.</li>
 *   <li>For JSON lines, every non-blank line goes straight to the decoder.</li>
 * </ol>
 * Only I/O failures and fragmentation protocol violations abort a parse; every other problem is
 * collected as a {@link DecodeError}.
 * <p>
 * <b>Monitoring:</b> each parse is reported to the injected {@link IOperationMonitor} as one
 * operation (start, document count, success/failure) plus one audit entry. Monitor failures are
 * logged and never affect the parse.
 * <p>
 * Holds no per-parse state, so one instance may parse several files concurrently.
 */
public class FirestoreBackupParser implements IBackupParser {

    static final String OPERATION_NAME = "parse_backup";
    static final String AUDIT_RESOURCE_TYPE = "backup_file";
    static final String AUDIT_ACTION = "parse";

    private static final Logger log = LoggerFactory.getLogger(FirestoreBackupParser.class);

    private final ParserOptions options;
    private final IOperationMonitor monitor;
    private final FormatDetector formatDetector;
    private final RecordParser recordParser;
    private final FirestoreDocumentDecoder decoder;

    public FirestoreBackupParser() {
        this(ParserOptions.defaults(), IOperationMonitor.NOOP);
    }

    public FirestoreBackupParser(ParserOptions options, IOperationMonitor monitor) {
        this.options = options;
        this.monitor = monitor;
        this.formatDetector = new FormatDetector(options.detectionSampleBytes(), options.printableRatio());
        this.recordParser = new RecordParser();
        this.decoder = new FirestoreDocumentDecoder(options.minDocumentBytes());
    }

    @Override
    public ParseResult parse(Path file) throws IOException {
        IOperationTracker tracker = startTracking(file);
        long startNanos = System.nanoTime();
        try {
            ParseResult result = doParse(file);
            BackupMetadata metadata = result.metadata();
            log.info("Parsed {} ({}): {} documents in {} collections, {} blocks, {} records, {} errors in {} ms",
                file, metadata.format(), metadata.documentCount(), metadata.collectionCount(),
                metadata.blocksProcessed(), metadata.recordsProcessed(), metadata.totalErrors(),
                (System.nanoTime() - startNanos) / 1_000_000);
            notifyMonitor(() -> tracker.updateProgress(metadata.documentCount()));
            notifyMonitor(tracker::completeSuccess);
            notifyMonitor(() -> monitor.logAudit(auditEntry(file, result)));
            return result;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to parse {}: {}", file, e.getMessage());
            notifyMonitor(() -> tracker.completeFailure(e));
            notifyMonitor(() -> monitor.logAudit(AuditLogEntry.of(AUDIT_RESOURCE_TYPE, file.toString(),
                AUDIT_ACTION, AuditResult.FAILURE, e.getMessage(), Map.of("file_path", file.toString()))));
            throw e;
        }
    }

    private ParseResult doParse(Path file) throws IOException {
        BackupFormat format = formatDetector.detect(file);
        log.info("Parsing {} as {}", file, format);
        ParseState state = new ParseState(options.maxErrors());
        if (format == BackupFormat.JSON_LINES) {
            parseJsonLines(file, state);
        } else {
            parseLog(file, state);
        }
        BackupMetadata metadata = new BackupMetadata(
            state.fileSize,
            state.documents.size(),
            state.collections.size(),
            state.blocksProcessed,
            state.recordsProcessed,
            format,
            state.totalErrors);
        return new ParseResult(state.documents, state.collections, metadata, state.errors);
    }

    private void parseLog(Path file, ParseState state) throws IOException {
        try (BlockReader reader = new BlockReader(file, options.blockSize())) {
            state.fileSize = reader.fileSize();
            FragmentReconstructor reconstructor = new FragmentReconstructor();
            long payloadIndex = 0;
            Optional<RawBlock> block;
            while ((block = reader.nextBlock()).isPresent()) {
                BlockScan scan = recordParser.scan(block.get());
                scan.errors().forEach(state::addError);
                for (RawRecord record : scan.records()) {
                    state.recordsProcessed++;
                    Optional<byte[]> payload = reconstructor.accept(record);
                    if (payload.isPresent()) {
                        state.accept(decoder.decodeRecord(payload.get(), payloadIndex++));
                    }
                }
            }
            reconstructor.finish();
            state.blocksProcessed = reader.blocksRead();
        }
    }

    private void parseJsonLines(Path file, ParseState state) throws IOException {
        state.fileSize = Files.size(file);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            long lineIndex = 0;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                state.recordsProcessed++;
                state.accept(decoder.decodeLine(line, lineIndex++));
            }
        }
    }

    private IOperationTracker startTracking(Path file) {
        try {
            return monitor.startOperation(OPERATION_NAME, Map.of("file_path", file.toString()));
        } catch (RuntimeException e) {
            log.warn("Operation monitor failed to start tracking {}", file, e);
            return IOperationMonitor.NOOP.startOperation(OPERATION_NAME, Map.of());
        }
    }

    private static void notifyMonitor(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Operation monitor call failed", e);
        }
    }

    private static AuditLogEntry auditEntry(Path file, ParseResult result) {
        BackupMetadata metadata = result.metadata();
        AuditResult auditResult = AuditResult.classify(metadata.documentCount(), metadata.totalErrors());
        String reason = auditResult == AuditResult.SUCCESS
            ? null
            : metadata.totalErrors() + " records could not be decoded";
        return AuditLogEntry.of(AUDIT_RESOURCE_TYPE, file.toString(), AUDIT_ACTION, auditResult, reason, Map.of(
            "file_path", file.toString(),
            "documents_parsed", Long.toString(metadata.documentCount()),
            "collections_found", Long.toString(metadata.collectionCount()),
            "blocks_processed", Long.toString(metadata.blocksProcessed()),
            "file_size", Long.toString(metadata.fileSize())));
    }

    /**
     * Accumulator for a single parse call.
     */
    private static final class ParseState {

        private final int maxErrors;
        private final List<FirestoreDocument> documents = new ArrayList<>();
        private final Set<String> collections = new LinkedHashSet<>();
        private final List<DecodeError> errors = new ArrayList<>();
        private long totalErrors;
        private long fileSize;
        private long blocksProcessed;
        private long recordsProcessed;

        private ParseState(int maxErrors) {
            this.maxErrors = maxErrors;
        }

        void accept(DecodeOutcome outcome) {
            switch (outcome.kind()) {
                case DOCUMENT -> {
                    documents.add(outcome.document());
                    collections.add(outcome.document().collection());
                }
                case ERROR -> addError(outcome.error());
                case SKIPPED -> {
                    // metadata records and non-documents are not errors
                }
            }
        }

        void addError(DecodeError error) {
            totalErrors++;
            if (errors.size() < maxErrors) {
                errors.add(error);
            } else if (errors.size() == maxErrors && totalErrors == maxErrors + 1L) {
                log.warn("More than {} decode errors, further errors are counted but not retained", maxErrors);
            }
        }
    }
}
