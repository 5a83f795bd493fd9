package org.fireup.ingest.decoding;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.fireup.ingest.api.DecodeError;
import org.fireup.ingest.api.FirestoreDocument;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Unit tests for {@link FirestoreDocumentDecoder}.
 */
@Tag("unit")
class FirestoreDocumentDecoderTest {

    private final FirestoreDocumentDecoder decoder = new FirestoreDocumentDecoder();

    private DecodeOutcome decode(String payload) {
        return decoder.decodeRecord(payload.getBytes(StandardCharsets.UTF_8), 0);
    }

    private FirestoreDocument decodeDocument(String payload) {
        DecodeOutcome outcome = decode(payload);
        assertThat(outcome.kind()).isEqualTo(DecodeOutcome.Kind.DOCUMENT);
        return outcome.document();
    }

    @Test
    void decodeRecord_ResourceName_ResolvesCollectionAndId() {
        FirestoreDocument doc = decodeDocument(
            "{\"name\":\"projects/p/databases/(default)/documents/users/u1\","
                + "\"fields\":{\"age\":{\"integerValue\":\"30\"}}}");

        assertThat(doc.id()).isEqualTo("u1");
        assertThat(doc.collection()).isEqualTo("users");
        assertThat(doc.data()).containsOnlyKeys("age");
        assertThat(doc.data().get("age")).isEqualTo(new JsonPrimitive(30L));
        assertThat(doc.subcollections()).isEmpty();
        assertThat(doc.metadata().path()).isEqualTo("projects/p/databases/(default)/documents/users/u1");
        assertThat(doc.metadata().sizeBytes()).isNull();
    }

    @Test
    void decodeRecord_PathField_UsedWhenNameMissing() {
        FirestoreDocument doc = decodeDocument("{\"path\":\"orders/o-17\",\"total\":12}");

        assertThat(doc.collection()).isEqualTo("orders");
        assertThat(doc.id()).isEqualTo("o-17");
        assertThat(doc.metadata().path()).isEqualTo("orders/o-17");
        assertThat(doc.data()).containsOnlyKeys("total");
    }

    @Test
    void decodeRecord_NameWithoutSlash_FallsBackToPath() {
        FirestoreDocument doc = decodeDocument("{\"name\":\"flat\",\"path\":\"items/i9\",\"v\":1}");

        assertThat(doc.collection()).isEqualTo("items");
        assertThat(doc.id()).isEqualTo("i9");
    }

    @Test
    void decodeRecord_ExplicitIdAndCollection() {
        FirestoreDocument doc = decodeDocument("{\"id\":\"p1\",\"collection\":\"products\",\"price\":9.99}");

        assertThat(doc.id()).isEqualTo("p1");
        assertThat(doc.collection()).isEqualTo("products");
        assertThat(doc.metadata().path()).isEqualTo(FirestoreDocumentDecoder.UNKNOWN);
        assertThat(doc.data()).containsOnlyKeys("price");
    }

    @Test
    void decodeRecord_NoIdentity_DefaultsToUnknown() {
        FirestoreDocument doc = decodeDocument("{\"title\":\"anonymous\",\"id\":\"only-id\"}");

        assertThat(doc.id()).isEqualTo(FirestoreDocumentDecoder.UNKNOWN);
        assertThat(doc.collection()).isEqualTo(FirestoreDocumentDecoder.UNKNOWN);
        assertThat(doc.data()).containsOnlyKeys("title");
    }

    @Test
    void decodeRecord_ReservedKeysExcludedWithoutFieldsObject() {
        FirestoreDocument doc = decodeDocument("{\"name\":\"c/d\",\"createTime\":\"2024-01-01T00:00:00Z\","
            + "\"updateTime\":\"x\",\"readTime\":\"y\",\"kept\":{\"nested\":true}}");

        assertThat(doc.data()).containsOnlyKeys("kept");
        assertThat(doc.data().get("kept")).isEqualTo(JsonParser.parseString("{\"nested\":true}"));
    }

    @Test
    void decodeRecord_Timestamps_PopulateMetadata() {
        FirestoreDocument doc = decodeDocument("{\"name\":\"users/u2\","
            + "\"createTime\":\"2024-03-01T12:30:00.123456Z\","
            + "\"updateTime\":\"2024-03-02T08:00:00+02:00\","
            + "\"fields\":{}}");

        assertThat(doc.metadata().createdAt()).isEqualTo(Instant.parse("2024-03-01T12:30:00.123456Z"));
        assertThat(doc.metadata().updatedAt()).isEqualTo(Instant.parse("2024-03-02T06:00:00Z"));
    }

    @Test
    void decodeRecord_UnparseableTimestamp_LeftUnset() {
        FirestoreDocument doc = decodeDocument("{\"name\":\"users/u3\",\"createTime\":\"yesterday\",\"fields\":{}}");

        assertThat(doc.metadata().createdAt()).isNull();
        assertThat(doc.metadata().updatedAt()).isNull();
    }

    @Test
    void decodeRecord_ShortPayload_SkippedWithoutError() {
        DecodeOutcome outcome = decode("{\"a\":1}");

        assertThat(outcome.kind()).isEqualTo(DecodeOutcome.Kind.SKIPPED);
        assertThat(outcome.error()).isNull();
    }

    @Test
    void decodeRecord_MetadataMarkers_Skipped() {
        assertThat(decode("__internal_state_record").kind()).isEqualTo(DecodeOutcome.Kind.SKIPPED);
        assertThat(decode("{\"__internal\":{\"version\":3}}").kind()).isEqualTo(DecodeOutcome.Kind.SKIPPED);
        assertThat(decode("{\"name\":\"_metadata/schema\",\"v\":1}").kind()).isEqualTo(DecodeOutcome.Kind.SKIPPED);
        assertThat(decode("binary _system header").kind()).isEqualTo(DecodeOutcome.Kind.SKIPPED);
    }

    @Test
    void decodeRecord_DoubleUnderscoreKeysAndValues_KeptAsData() {
        FirestoreDocument doc = decodeDocument("{\"name\":\"projects/p/databases/(default)/documents/users/u1\","
            + "\"fields\":{\"tag\":{\"stringValue\":\"__init__\"},\"__typename\":{\"stringValue\":\"User\"}}}");

        assertThat(doc.id()).isEqualTo("u1");
        assertThat(doc.data().get("tag")).isEqualTo(new JsonPrimitive("__init__"));
        assertThat(doc.data().get("__typename")).isEqualTo(new JsonPrimitive("User"));
    }

    @Test
    void decodeLine_DoubleUnderscoreKey_KeptAsData() {
        DecodeOutcome outcome = decoder.decodeLine("{\"__typename\":\"Order\",\"total\":3}", 0);

        assertThat(outcome.kind()).isEqualTo(DecodeOutcome.Kind.DOCUMENT);
        assertThat(outcome.document().data()).containsOnlyKeys("__typename", "total");
    }

    @Test
    void decodeRecord_NonObjectJson_Skipped() {
        assertThat(decode("[1, 2, 3, 4, 5, 6]").kind()).isEqualTo(DecodeOutcome.Kind.SKIPPED);
        assertThat(decode("\"just a long string\"").kind()).isEqualTo(DecodeOutcome.Kind.SKIPPED);
    }

    @Test
    void decodeRecord_InvalidJson_ReportsUnparseableRecord() {
        DecodeOutcome outcome = decoder.decodeRecord("not json at all, sorry".getBytes(StandardCharsets.UTF_8), 7);

        assertThat(outcome.kind()).isEqualTo(DecodeOutcome.Kind.ERROR);
        assertThat(outcome.error().code()).isEqualTo(DecodeError.Code.UNPARSEABLE_RECORD);
        assertThat(outcome.error().recordIndex()).isEqualTo(7);
    }

    @Test
    void decodeRecord_TrailingGarbage_ReportsUnparseableRecord() {
        assertThat(decode("{\"name\":\"a/b\"} trailing").kind()).isEqualTo(DecodeOutcome.Kind.ERROR);
    }

    @Test
    void decodeRecord_InvalidUtf8_ReportsUnparseableRecord() {
        byte[] payload = {(byte) 0xFF, (byte) 0xFE, 0x7B, 0x22, 0x61, 0x22, 0x3A, 0x31, 0x7D, 0x0A, 0x0B};

        DecodeOutcome outcome = decoder.decodeRecord(payload, 0);

        assertThat(outcome.kind()).isEqualTo(DecodeOutcome.Kind.ERROR);
    }

    @Test
    void decodeLine_ShortLine_StillDecoded() {
        DecodeOutcome outcome = decoder.decodeLine("{\"a\":1}", 0);

        assertThat(outcome.kind()).isEqualTo(DecodeOutcome.Kind.DOCUMENT);
        assertThat(outcome.document().data().get("a")).isEqualTo(new JsonPrimitive(1));
    }

    @Test
    void decodeLine_InvalidJson_SkippedWithoutError() {
        DecodeOutcome outcome = decoder.decodeLine("{broken", 3);

        assertThat(outcome.kind()).isEqualTo(DecodeOutcome.Kind.SKIPPED);
        assertThat(outcome.reason()).isEqualTo(FirestoreDocumentDecoder.REASON_INVALID_JSON_LINE);
    }

    @Test
    void decodeLine_MetadataLine_Skipped() {
        assertThat(decoder.decodeLine("{\"_metadata\":{\"exported\":true}}", 0).kind())
            .isEqualTo(DecodeOutcome.Kind.SKIPPED);
    }
}
