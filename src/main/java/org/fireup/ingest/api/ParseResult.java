package org.fireup.ingest.api;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of parsing one backup file.
 * <p>
 * A parse that returns a result may still carry local {@link #errors()}; partial progress
 * is never discarded because of a single bad record.
 *
 * @param documents   decoded documents in file order
 * @param collections distinct collection names in first-seen order
 * @param metadata    statistics about the parse
 * @param errors      local decode errors in the order they occurred
 */
public record ParseResult(
        List<FirestoreDocument> documents,
        Set<String> collections,
        BackupMetadata metadata,
        List<DecodeError> errors) {

    public ParseResult {
        documents = List.copyOf(documents);
        collections = Collections.unmodifiableSet(new LinkedHashSet<>(collections));
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
