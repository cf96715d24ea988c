package com.example.payanalyzer.application.worker;

/**
 * Receives worker progress events on the worker thread.
 */
@FunctionalInterface
public interface ProcessingProgressListener {

    ProcessingProgressListener NONE = progress -> { };

    void onProgress(ProcessingProgress progress);
}
