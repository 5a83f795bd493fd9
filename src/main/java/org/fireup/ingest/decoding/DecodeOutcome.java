package org.fireup.ingest.decoding;

import org.fireup.ingest.api.DecodeError;
import org.fireup.ingest.api.FirestoreDocument;

/**
 * Result of decoding one payload: a document, a skipped non-document record, or a local error.
 *
 * @param kind     which of the three outcomes this is
 * @param document the decoded document for {@link Kind#DOCUMENT}, otherwise {@code null}
 * @param error    the error for {@link Kind#ERROR}, otherwise {@code null}
 * @param reason   why the record was skipped for {@link Kind#SKIPPED}, otherwise {@code null}
 */
public record DecodeOutcome(Kind kind, FirestoreDocument document, DecodeError error, String reason) {

    public enum Kind {
        DOCUMENT,
        SKIPPED,
        ERROR
    }

    public static DecodeOutcome document(FirestoreDocument document) {
        return new DecodeOutcome(Kind.DOCUMENT, document, null, null);
    }

    public static DecodeOutcome skipped(String reason) {
        return new DecodeOutcome(Kind.SKIPPED, null, null, reason);
    }

    public static DecodeOutcome error(DecodeError error) {
        return new DecodeOutcome(Kind.ERROR, null, error, null);
    }
}
