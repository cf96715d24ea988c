package com.example.payanalyzer.application.service;

/**
 * Receives batch progress. Within one batch {@code current} never decreases.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (current, total, currentFile) -> { };

    /**
     * @param current     files finished so far
     * @param total       files in the batch
     * @param currentFile file just finished, {@code null} for the start and blocked-batch events
     */
    void onProgress(int current, int total, String currentFile);
}
