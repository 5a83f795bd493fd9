package org.fireup.ingest.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.gson.JsonElement;

/**
 * A single document recovered from a backup.
 * <p>
 * Field values are plain JSON: Firestore typed-value wrappers such as
 * {@code {"integerValue": "30"}} have already been resolved to {@code 30}.
 * Subcollections are reserved in the model but are not populated by the decoder.
 *
 * @param id             document id (last segment of the resource path)
 * @param collection     owning collection (second to last segment of the resource path)
 * @param data           field name to plain JSON value
 * @param subcollections nested documents, currently always empty
 * @param metadata       timestamps and path of the document
 */
public record FirestoreDocument(
        String id,
        String collection,
        Map<String, JsonElement> data,
        List<FirestoreDocument> subcollections,
        DocumentMetadata metadata) {

    public FirestoreDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(metadata, "metadata");
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        subcollections = List.copyOf(subcollections);
    }
}
