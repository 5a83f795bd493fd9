package org.fireup.ingest.decoding;

import java.util.Map;
import java.util.Set;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Resolves Firestore typed-value wrappers into plain JSON.
 * <p>
 * A wrapper is an object with exactly one key from {@link #WRAPPER_KEYS}:
 * <pre>
 *   {"stringValue": "a"}                              -> "a"
 *   {"booleanValue": true}                            -> true
 *   {"timestampValue": "2024-01-01T00:00:00Z"}        -> "2024-01-01T00:00:00Z"
 *   {"integerValue": "30"}                            -> 30
 *   {"doubleValue": "1.5"}                            -> 1.5
 *   {"arrayValue": {"values": [w1, w2]}}              -> [unwrap(w1), unwrap(w2)]
 *   {"mapValue": {"fields": {"k": w}}}                -> {"k": unwrap(w)}
 * </pre>
 * Every other value is returned unchanged, so unwrapping plain JSON is a no-op.
 * Pure function; thread-safe.
 */
public final class TypedValueUnwrapper {

    public static final Set<String> WRAPPER_KEYS = Set.of(
        "stringValue", "integerValue", "doubleValue", "booleanValue",
        "timestampValue", "arrayValue", "mapValue");

    private TypedValueUnwrapper() {
        // Utility class
    }

    /**
     * Unwraps a value recursively.
     *
     * @param value any JSON value
     * @return the plain JSON equivalent of {@code value}
     */
    public static JsonElement unwrap(JsonElement value) {
        if (!isWrapper(value)) {
            return value;
        }
        Map.Entry<String, JsonElement> tag = value.getAsJsonObject().entrySet().iterator().next();
        JsonElement inner = tag.getValue();
        return switch (tag.getKey()) {
            case "stringValue", "booleanValue", "timestampValue" -> inner;
            case "integerValue" -> parseInteger(inner);
            case "doubleValue" -> parseDouble(inner);
            case "arrayValue" -> unwrapArray(value, inner);
            case "mapValue" -> unwrapMap(value, inner);
            default -> value;
        };
    }

    /**
     * Unwraps every field of a Firestore {@code fields} object.
     *
     * @param fields the {@code fields} object
     * @return a new object holding the unwrapped values
     */
    public static JsonObject unwrapFields(JsonObject fields) {
        JsonObject result = new JsonObject();
        for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
            result.add(entry.getKey(), unwrap(entry.getValue()));
        }
        return result;
    }

    static boolean isWrapper(JsonElement value) {
        if (!value.isJsonObject()) {
            return false;
        }
        JsonObject object = value.getAsJsonObject();
        return object.size() == 1 && WRAPPER_KEYS.contains(object.keySet().iterator().next());
    }

    private static JsonElement parseInteger(JsonElement inner) {
        if (!inner.isJsonPrimitive()) {
            return inner;
        }
        try {
            return new JsonPrimitive(Long.parseLong(inner.getAsString().trim()));
        } catch (NumberFormatException e) {
            return inner;
        }
    }

    private static JsonElement parseDouble(JsonElement inner) {
        if (!inner.isJsonPrimitive()) {
            return inner;
        }
        try {
            return new JsonPrimitive(Double.parseDouble(inner.getAsString().trim()));
        } catch (NumberFormatException e) {
            return inner;
        }
    }

    private static JsonElement unwrapArray(JsonElement wrapper, JsonElement inner) {
        if (!inner.isJsonObject()) {
            return wrapper;
        }
        JsonElement values = inner.getAsJsonObject().get("values");
        JsonArray result = new JsonArray();
        if (values == null || values.isJsonNull()) {
            return result;
        }
        if (!values.isJsonArray()) {
            return wrapper;
        }
        for (JsonElement element : values.getAsJsonArray()) {
            result.add(unwrap(element));
        }
        return result;
    }

    private static JsonElement unwrapMap(JsonElement wrapper, JsonElement inner) {
        if (!inner.isJsonObject()) {
            return wrapper;
        }
        JsonElement fields = inner.getAsJsonObject().get("fields");
        if (fields == null || fields.isJsonNull()) {
            return new JsonObject();
        }
        if (!fields.isJsonObject()) {
            return wrapper;
        }
        return unwrapFields(fields.getAsJsonObject());
    }
}
