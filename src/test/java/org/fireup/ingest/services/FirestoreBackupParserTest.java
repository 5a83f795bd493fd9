package org.fireup.ingest.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;

import org.fireup.ingest.api.BackupFormat;
import org.fireup.ingest.api.DecodeError;
import org.fireup.ingest.api.FirestoreDocument;
import org.fireup.ingest.api.ParseResult;
import org.fireup.ingest.api.monitoring.AuditLogEntry;
import org.fireup.ingest.api.monitoring.AuditResult;
import org.fireup.ingest.api.monitoring.IOperationMonitor;
import org.fireup.ingest.api.monitoring.IOperationTracker;
import org.fireup.ingest.log.LogFileBuilder;
import org.fireup.ingest.log.LogStructureException;
import org.fireup.ingest.log.RecordType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.google.gson.JsonPrimitive;

/**
 * Tests for {@link FirestoreBackupParser} against small log and JSON lines files.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class FirestoreBackupParserTest {

    private static final String USER_DOC =
        "{\"name\":\"projects/p/databases/(default)/documents/users/u1\",\"fields\":{\"age\":{\"integerValue\":\"30\"}}}";
    private static final String ORDER_DOC =
        "{\"name\":\"projects/p/databases/(default)/documents/orders/o1\",\"fields\":{\"total\":{\"doubleValue\":\"12.5\"}}}";

    private static final int SMALL_BLOCK = 64;

    @TempDir
    Path tempDir;

    @Mock
    IOperationMonitor monitor;

    @Mock
    IOperationTracker tracker;

    private ParserOptions smallBlocks(int maxErrors) {
        return new ParserOptions(SMALL_BLOCK, 8192, 0.95, 10, maxErrors);
    }

    private void stubTracker() {
        when(monitor.startOperation(eq(FirestoreBackupParser.OPERATION_NAME), anyMap())).thenReturn(tracker);
    }

    private AuditLogEntry capturedAudit() {
        ArgumentCaptor<AuditLogEntry> captor = ArgumentCaptor.forClass(AuditLogEntry.class);
        verify(monitor).logAudit(captor.capture());
        return captor.getValue();
    }

    private Path writeText(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    void parse_SingleFullRecord_DecodesDocument() throws IOException {
        Path file = new LogFileBuilder().full(USER_DOC).padToBlockEnd().writeTo(tempDir.resolve("output-0"));

        ParseResult result = new FirestoreBackupParser().parse(file);

        assertThat(result.errors()).isEmpty();
        assertThat(result.documents()).hasSize(1);
        FirestoreDocument doc = result.documents().get(0);
        assertThat(doc.id()).isEqualTo("u1");
        assertThat(doc.collection()).isEqualTo("users");
        assertThat(doc.data().get("age")).isEqualTo(new JsonPrimitive(30));
        assertThat(result.collections()).containsExactly("users");
        assertThat(result.metadata().format()).isEqualTo(BackupFormat.LEVELDB_LOG);
        assertThat(result.metadata().documentCount()).isEqualTo(1);
        assertThat(result.metadata().collectionCount()).isEqualTo(1);
        assertThat(result.metadata().blocksProcessed()).isEqualTo(1);
        assertThat(result.metadata().recordsProcessed()).isEqualTo(1);
        assertThat(result.metadata().fileSize()).isEqualTo(Files.size(file));
    }

    @Test
    void parse_EmptyFile_YieldsEmptyResult() throws IOException {
        Path file = Files.createFile(tempDir.resolve("empty"));

        ParseResult result = new FirestoreBackupParser().parse(file);

        assertThat(result.documents()).isEmpty();
        assertThat(result.collections()).isEmpty();
        assertThat(result.errors()).isEmpty();
        assertThat(result.metadata().blocksProcessed()).isZero();
        assertThat(result.metadata().fileSize()).isZero();
    }

    @Test
    void parse_JsonLines_EachLineIndependent() throws IOException {
        Path file = writeText("export.jsonl", "{\"a\":1}\n\nnot json\n{\"b\":2}\n");

        ParseResult result = new FirestoreBackupParser().parse(file);

        assertThat(result.metadata().format()).isEqualTo(BackupFormat.JSON_LINES);
        assertThat(result.documents()).hasSize(2);
        assertThat(result.documents().get(0).data()).containsOnlyKeys("a");
        assertThat(result.documents().get(1).data()).containsOnlyKeys("b");
        assertThat(result.errors()).isEmpty();
        assertThat(result.metadata().recordsProcessed()).isEqualTo(3);
        assertThat(result.metadata().blocksProcessed()).isZero();
    }

    @Test
    void parse_RecordFragmentedAcrossBlocks_Reassembled() throws IOException {
        byte[] payload = LogFileBuilder.utf8(USER_DOC);
        int chunk = SMALL_BLOCK - 7;
        LogFileBuilder builder = new LogFileBuilder(SMALL_BLOCK);
        int offset = 0;
        while (offset < payload.length) {
            int end = Math.min(payload.length, offset + chunk);
            RecordType type = offset == 0 ? RecordType.FIRST
                : end == payload.length ? RecordType.LAST : RecordType.MIDDLE;
            builder.record(type, Arrays.copyOfRange(payload, offset, end));
            offset = end;
        }
        Path file = builder.full("{\"path\":\"tags/t1\",\"v\":true}")
            .padToBlockEnd().writeTo(tempDir.resolve("fragmented"));

        ParseResult result = new FirestoreBackupParser(smallBlocks(100), IOperationMonitor.NOOP).parse(file);

        assertThat(result.errors()).isEmpty();
        assertThat(result.documents()).extracting(FirestoreDocument::id).containsExactly("u1", "t1");
        assertThat(result.collections()).containsExactly("users", "tags");
        assertThat(result.metadata().blocksProcessed()).isGreaterThan(2);
    }

    @Test
    void parse_MiddleWithoutFirst_AbortsAndReportsFailure() throws IOException {
        stubTracker();
        Path file = new LogFileBuilder()
            .full(USER_DOC)
            .record(RecordType.MIDDLE, LogFileBuilder.utf8("orphan continuation"))
            .padToBlockEnd().writeTo(tempDir.resolve("broken"));
        FirestoreBackupParser parser = new FirestoreBackupParser(ParserOptions.defaults(), monitor);

        assertThatThrownBy(() -> parser.parse(file))
            .isInstanceOf(LogStructureException.class)
            .satisfies(e -> assertThat(((LogStructureException) e).getRecordType()).isEqualTo(RecordType.MIDDLE));

        verify(tracker).completeFailure(any(LogStructureException.class));
        verify(tracker, never()).completeSuccess();
        AuditLogEntry audit = capturedAudit();
        assertThat(audit.result()).isEqualTo(AuditResult.FAILURE);
        assertThat(audit.details()).containsEntry("file_path", file.toString());
    }

    @Test
    void parse_CorruptedChecksum_OneErrorAndLaterRecordsKept() throws IOException {
        Path file = new LogFileBuilder()
            .full(USER_DOC)
            .corruptedRecord(RecordType.FULL, LogFileBuilder.utf8(ORDER_DOC))
            .full("{\"name\":\"users/u2\",\"fields\":{}}")
            .padToBlockEnd().writeTo(tempDir.resolve("corrupt"));

        ParseResult result = new FirestoreBackupParser().parse(file);

        assertThat(result.documents()).extracting(FirestoreDocument::id).containsExactly("u1", "u2");
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).code()).isEqualTo(DecodeError.Code.CHECKSUM_MISMATCH);
        assertThat(result.metadata().totalErrors()).isEqualTo(1);
        assertThat(result.metadata().recordsProcessed()).isEqualTo(2);
    }

    @Test
    void parse_MetadataRecords_FilteredSilently() throws IOException {
        Path file = new LogFileBuilder()
            .full("{\"a\":1}")
            .full("{\"__internal\":{\"state\":\"x\"}}")
            .full(USER_DOC)
            .padToBlockEnd().writeTo(tempDir.resolve("with-metadata"));

        ParseResult result = new FirestoreBackupParser().parse(file);

        assertThat(result.errors()).isEmpty();
        assertThat(result.metadata().documentCount()).isEqualTo(1);
        assertThat(result.metadata().recordsProcessed()).isEqualTo(3);
    }

    @Test
    void parse_CleanFile_ReportsSuccessToMonitor() throws IOException {
        stubTracker();
        Path file = new LogFileBuilder().full(USER_DOC).full(ORDER_DOC).padToBlockEnd().writeTo(tempDir.resolve("clean"));

        new FirestoreBackupParser(ParserOptions.defaults(), monitor).parse(file);

        verify(tracker).updateProgress(2);
        verify(tracker).completeSuccess();
        AuditLogEntry audit = capturedAudit();
        assertThat(audit.result()).isEqualTo(AuditResult.SUCCESS);
        assertThat(audit.reason()).isNull();
        assertThat(audit.resourceType()).isEqualTo(FirestoreBackupParser.AUDIT_RESOURCE_TYPE);
        assertThat(audit.action()).isEqualTo(FirestoreBackupParser.AUDIT_ACTION);
        assertThat(audit.details())
            .containsEntry("documents_parsed", "2")
            .containsEntry("collections_found", "2")
            .containsEntry("blocks_processed", "1")
            .containsEntry("file_size", Long.toString(Files.size(file)));
    }

    @Test
    void parse_ErrorsWithDocuments_AuditedAsPartialSuccess() throws IOException {
        stubTracker();
        Path file = new LogFileBuilder()
            .full(USER_DOC)
            .full("this payload is definitely not json")
            .padToBlockEnd().writeTo(tempDir.resolve("partial"));

        ParseResult result = new FirestoreBackupParser(ParserOptions.defaults(), monitor).parse(file);

        assertThat(result.errors()).extracting(DecodeError::code).containsExactly(DecodeError.Code.UNPARSEABLE_RECORD);
        verify(tracker).completeSuccess();
        assertThat(capturedAudit().result()).isEqualTo(AuditResult.PARTIAL_SUCCESS);
    }

    @Test
    void parse_ErrorsWithoutDocuments_AuditedAsFailure() throws IOException {
        stubTracker();
        Path file = new LogFileBuilder()
            .corruptedRecord(RecordType.FULL, LogFileBuilder.utf8(USER_DOC))
            .padToBlockEnd().writeTo(tempDir.resolve("all-bad"));

        ParseResult result = new FirestoreBackupParser(ParserOptions.defaults(), monitor).parse(file);

        assertThat(result.documents()).isEmpty();
        assertThat(result.hasErrors()).isTrue();
        AuditLogEntry audit = capturedAudit();
        assertThat(audit.result()).isEqualTo(AuditResult.FAILURE);
        assertThat(audit.reason()).isNotBlank();
    }

    @Test
    void parse_FailingMonitor_DoesNotAffectResult() throws IOException {
        stubTracker();
        doThrow(new IllegalStateException("tracker down")).when(tracker).completeSuccess();
        doThrow(new IllegalStateException("audit down")).when(monitor).logAudit(any());
        Path file = new LogFileBuilder().full(USER_DOC).padToBlockEnd().writeTo(tempDir.resolve("monitored"));

        ParseResult result = new FirestoreBackupParser(ParserOptions.defaults(), monitor).parse(file);

        assertThat(result.documents()).hasSize(1);
        verify(monitor).logAudit(any());
    }

    @Test
    void parse_MonitorFailsToStart_ParsesWithoutTracking() throws IOException {
        when(monitor.startOperation(any(), anyMap())).thenThrow(new IllegalStateException("no monitor"));
        Path file = new LogFileBuilder().full(USER_DOC).padToBlockEnd().writeTo(tempDir.resolve("untracked"));

        ParseResult result = new FirestoreBackupParser(ParserOptions.defaults(), monitor).parse(file);

        assertThat(result.documents()).hasSize(1);
    }

    @Test
    void parse_MissingFile_Throws() {
        Path missing = tempDir.resolve("does-not-exist");

        assertThatThrownBy(() -> new FirestoreBackupParser().parse(missing))
            .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void parse_ErrorsBeyondCap_CountedButNotRetained() throws IOException {
        Path file = new LogFileBuilder()
            .corruptedRecord(RecordType.FULL, LogFileBuilder.utf8(USER_DOC))
            .full(ORDER_DOC)
            .corruptedRecord(RecordType.FULL, LogFileBuilder.utf8(USER_DOC))
            .full(USER_DOC)
            .corruptedRecord(RecordType.FULL, LogFileBuilder.utf8(ORDER_DOC))
            .padToBlockEnd().writeTo(tempDir.resolve("many-errors"));
        ParserOptions options = new ParserOptions(32768, 8192, 0.95, 10, 1);

        ParseResult result = new FirestoreBackupParser(options, IOperationMonitor.NOOP).parse(file);

        assertThat(result.errors()).hasSize(1);
        assertThat(result.metadata().totalErrors()).isEqualTo(3);
        assertThat(result.documents()).hasSize(2);
    }
}
