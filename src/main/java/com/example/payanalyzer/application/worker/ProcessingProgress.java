package com.example.payanalyzer.application.worker;

/**
 * Progress event for one worker request. {@code current} strictly increases from one event to
 * the next; {@code percentage} is truncated to whole percent, so with more than 100 files two
 * consecutive events can carry the same percentage.
 *
 * @param requestId   request the event belongs to
 * @param current     files finished so far
 * @param total       files in the request
 * @param percentage  whole percent complete
 * @param currentFile file just finished, {@code null} for start and blocked-batch events
 */
public record ProcessingProgress(String requestId, int current, int total, int percentage, String currentFile) {

    public static ProcessingProgress of(String requestId, int current, int total, String currentFile) {
        int percentage = total == 0 ? 100 : (int) ((long) current * 100 / total);
        return new ProcessingProgress(requestId, current, total, percentage, currentFile);
    }
}
