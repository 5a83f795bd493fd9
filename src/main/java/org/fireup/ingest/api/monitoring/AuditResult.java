package org.fireup.ingest.api.monitoring;

/**
 * Classification of an audited operation.
 */
public enum AuditResult {
    /** Completed without any errors. */
    SUCCESS,
    /** Produced output but also reported errors. */
    PARTIAL_SUCCESS,
    /** Produced no output. */
    FAILURE;

    /**
     * Classifies a parse from its output and error counts.
     *
     * @param documents number of documents produced
     * @param errors    number of local errors reported
     * @return SUCCESS without errors, PARTIAL_SUCCESS with errors and at least one document,
     *         FAILURE with errors and no documents
     */
    public static AuditResult classify(long documents, long errors) {
        if (errors == 0) {
            return SUCCESS;
        }
        return documents > 0 ? PARTIAL_SUCCESS : FAILURE;
    }
}
