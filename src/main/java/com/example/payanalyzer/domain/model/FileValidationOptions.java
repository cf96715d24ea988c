package com.example.payanalyzer.domain.model;

import java.util.List;

/**
 * Limits applied when validating a batch.
 *
 * @param maxFileSize        largest accepted file in bytes
 * @param maxFiles           largest accepted batch
 * @param allowedTypes       accepted MIME types
 * @param checkForUpdates    compare against prior submissions
 * @param checkForDuplicates look for repeated files inside the batch
 */
public record FileValidationOptions(
        long maxFileSize,
        int maxFiles,
        List<String> allowedTypes,
        boolean checkForUpdates,
        boolean checkForDuplicates
) {

    public static final long DEFAULT_MAX_FILE_SIZE = 50L * 1024 * 1024;
    public static final int DEFAULT_MAX_FILES = 50;

    public FileValidationOptions {
        allowedTypes = List.copyOf(allowedTypes);
    }

    public static FileValidationOptions defaults() {
        return new FileValidationOptions(DEFAULT_MAX_FILE_SIZE, DEFAULT_MAX_FILES, List.of("application/pdf"), true, true);
    }
}
