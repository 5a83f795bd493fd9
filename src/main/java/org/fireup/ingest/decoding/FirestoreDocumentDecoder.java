package org.fireup.ingest.decoding;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.fireup.ingest.api.DecodeError;
import org.fireup.ingest.api.DocumentMetadata;
import org.fireup.ingest.api.FirestoreDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

/**
 * Turns a reconstructed log payload or a JSON line into a {@link FirestoreDocument}.
 * <p>
 * <b>Decoding steps:</b>
 * <ol>
 *   <li>Parse the text as strict JSON. Unparseable log payloads are either metadata records
 *       (skipped) or {@link DecodeError.Code#UNPARSEABLE_RECORD} errors; unparseable JSON lines
 *       are skipped.</li>
 *   <li>Skip values that are not JSON objects.</li>
 *   <li>Skip metadata records: log payloads shorter than {@code minDocumentBytes}, and any text
 *       containing {@code _metadata}, {@code _system} or {@code __internal}, or starting with
 *       {@code __}. Other {@code __}-prefixed keys and values belong to the document.</li>
 *   <li>Resolve identity from {@code name}, then {@code path} (last two resource path segments
 *       are collection and id), then explicit {@code id} + {@code collection}, else
 *       {@code "unknown"}.</li>
 *   <li>Take fields from the {@code fields} object through {@link TypedValueUnwrapper}, or else
 *       every non-reserved top-level key verbatim.</li>
 *   <li>Read {@code createTime}/{@code updateTime} as RFC 3339 timestamps.</li>
 * </ol>
 * Stateless and thread-safe.
 */
public class FirestoreDocumentDecoder {

    public static final int DEFAULT_MIN_DOCUMENT_BYTES = 10;
    public static final String UNKNOWN = "unknown";
    public static final String REASON_INVALID_JSON_LINE = "invalid JSON line";
    static final String INTERNAL_MARKER = "__internal";

    /** Top-level keys that describe a document rather than hold its data. */
    public static final Set<String> RESERVED_KEYS = Set.of(
        "name", "path", "id", "collection", "createTime", "updateTime", "readTime");

    private static final Logger log = LoggerFactory.getLogger(FirestoreDocumentDecoder.class);

    /** Reads with the strictness of the given reader, unlike {@code JsonParser.parseReader}. */
    private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER = new Gson().getAdapter(JsonElement.class);

    private final int minDocumentBytes;

    public FirestoreDocumentDecoder() {
        this(DEFAULT_MIN_DOCUMENT_BYTES);
    }

    public FirestoreDocumentDecoder(int minDocumentBytes) {
        if (minDocumentBytes < 0) {
            throw new IllegalArgumentException("minDocumentBytes must not be negative: " + minDocumentBytes);
        }
        this.minDocumentBytes = minDocumentBytes;
    }

    /**
     * Decodes a complete payload reconstructed from the log.
     *
     * @param payload     the payload bytes
     * @param recordIndex ordinal of the payload within the file
     * @return the outcome; never {@code null}
     */
    public DecodeOutcome decodeRecord(byte[] payload, long recordIndex) {
        String text = decodeUtf8(payload);
        if (text == null) {
            String lossy = new String(payload, StandardCharsets.UTF_8);
            if (isMetadataRecord(lossy, payload.length, true)) {
                return skipped(recordIndex, "metadata record");
            }
            return DecodeOutcome.error(DecodeError.forRecord(DecodeError.Code.UNPARSEABLE_RECORD,
                "Payload of " + payload.length + " bytes is not valid UTF-8", recordIndex));
        }

        JsonElement json;
        try {
            json = parseStrict(text);
        } catch (JsonParseException | IOException e) {
            if (isMetadataRecord(text, payload.length, true)) {
                return skipped(recordIndex, "metadata record");
            }
            return DecodeOutcome.error(DecodeError.forRecord(DecodeError.Code.UNPARSEABLE_RECORD,
                "Payload of " + payload.length + " bytes is not valid JSON: " + e.getMessage(), recordIndex));
        }
        if (!json.isJsonObject()) {
            return skipped(recordIndex, "not a JSON object");
        }
        if (isMetadataRecord(text, payload.length, true)) {
            return skipped(recordIndex, "metadata record");
        }
        return DecodeOutcome.document(toDocument(json.getAsJsonObject()));
    }

    /**
     * Decodes one line of a JSON lines export. Lines that are not valid JSON are skipped
     * rather than reported as errors.
     *
     * @param line      a non-blank line
     * @param lineIndex ordinal of the line among non-blank lines
     * @return the outcome; never an error
     */
    public DecodeOutcome decodeLine(String line, long lineIndex) {
        String text = line.strip();
        JsonElement json;
        try {
            json = parseStrict(text);
        } catch (JsonParseException | IOException e) {
            return skipped(lineIndex, REASON_INVALID_JSON_LINE);
        }
        if (!json.isJsonObject()) {
            return skipped(lineIndex, "not a JSON object");
        }
        if (isMetadataRecord(text, text.length(), false)) {
            return skipped(lineIndex, "metadata record");
        }
        return DecodeOutcome.document(toDocument(json.getAsJsonObject()));
    }

    /**
     * Builds a document from a parsed top-level object.
     *
     * @param object the top-level JSON object
     * @return the document
     */
    public FirestoreDocument toDocument(JsonObject object) {
        String[] identity = resolveIdentity(object);
        Map<String, JsonElement> data = extractFields(object);
        DocumentMetadata metadata = new DocumentMetadata(
            parseTimestamp(object.get("createTime")),
            parseTimestamp(object.get("updateTime")),
            resolvePath(object),
            null);
        return new FirestoreDocument(identity[1], identity[0], data, List.of(), metadata);
    }

    /**
     * Heuristic for non-document records.
     *
     * @param text         payload text
     * @param byteLength   payload size in bytes
     * @param applySizeRule whether payloads shorter than {@code minDocumentBytes} count as metadata
     * @return {@code true} if the record carries no document
     */
    boolean isMetadataRecord(String text, int byteLength, boolean applySizeRule) {
        if (applySizeRule && byteLength < minDocumentBytes) {
            return true;
        }
        return text.contains("_metadata")
            || text.contains("_system")
            || text.contains(INTERNAL_MARKER)
            || text.startsWith("__");
    }

    /**
     * @return {@code {collection, id}}
     */
    private static String[] resolveIdentity(JsonObject object) {
        String[] fromName = fromResourcePath(object.get("name"));
        if (fromName != null) {
            return fromName;
        }
        String[] fromPath = fromResourcePath(object.get("path"));
        if (fromPath != null) {
            return fromPath;
        }
        String id = stringOrNull(object.get("id"));
        String collection = stringOrNull(object.get("collection"));
        if (id != null && collection != null) {
            return new String[] {collection, id};
        }
        return new String[] {UNKNOWN, UNKNOWN};
    }

    private static String[] fromResourcePath(JsonElement value) {
        String path = stringOrNull(value);
        if (path == null || path.indexOf('/') < 0) {
            return null;
        }
        String[] segments = Arrays.stream(path.split("/"))
            .filter(s -> !s.isEmpty())
            .toArray(String[]::new);
        if (segments.length < 2) {
            return null;
        }
        return new String[] {segments[segments.length - 2], segments[segments.length - 1]};
    }

    private static String resolvePath(JsonObject object) {
        String name = stringOrNull(object.get("name"));
        if (name != null) {
            return name;
        }
        String path = stringOrNull(object.get("path"));
        return path != null ? path : UNKNOWN;
    }

    private static Map<String, JsonElement> extractFields(JsonObject object) {
        Map<String, JsonElement> data = new LinkedHashMap<>();
        JsonElement fields = object.get("fields");
        if (fields != null && fields.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : fields.getAsJsonObject().entrySet()) {
                data.put(entry.getKey(), TypedValueUnwrapper.unwrap(entry.getValue()));
            }
            return data;
        }
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            if (!RESERVED_KEYS.contains(entry.getKey())) {
                data.put(entry.getKey(), entry.getValue());
            }
        }
        return data;
    }

    private static Instant parseTimestamp(JsonElement value) {
        String text = stringOrNull(value);
        if (text == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp '{}'", text);
            return null;
        }
    }

    private static String stringOrNull(JsonElement value) {
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            return null;
        }
        return value.getAsString();
    }

    private static JsonElement parseStrict(String text) throws IOException {
        JsonReader reader = new JsonReader(new StringReader(text));
        reader.setStrictness(Strictness.STRICT);
        JsonElement element = ELEMENT_ADAPTER.read(reader);
        if (reader.peek() != JsonToken.END_DOCUMENT) {
            throw new JsonParseException("Trailing data after JSON value");
        }
        return element;
    }

    private static String decodeUtf8(byte[] payload) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(payload))
                .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static DecodeOutcome skipped(long index, String reason) {
        log.debug("Skipping record {}: {}", index, reason);
        return DecodeOutcome.skipped(reason);
    }
}
