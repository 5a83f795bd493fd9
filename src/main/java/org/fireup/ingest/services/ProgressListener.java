package org.fireup.ingest.services;

/**
 * Receives step progress from long-running operations such as {@link BackupValidator}.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param step    description of the current step
     * @param current units completed
     * @param total   units in the step, 0 if unknown
     */
    void onProgress(String step, long current, long total);
}
