package com.example.payanalyzer.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Aggregate facts hashed into a file-set fingerprint.
 *
 * @param fileCount number of files
 * @param totalSize sum of file sizes
 * @param fileTypes distinct file types, sorted
 */
@JsonPropertyOrder({"fileCount", "totalSize", "fileTypes"})
public record FileSetMetadata(int fileCount, long totalSize, List<String> fileTypes) {

    public FileSetMetadata {
        fileTypes = List.copyOf(fileTypes);
    }
}
