package com.example.payanalyzer.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything a batch run produced.
 *
 * @param files        per-file outcomes in submission order
 * @param errors       file-level errors, one per file and problem
 * @param summary      batch counters
 * @param validation   batch-level validation outcome
 * @param fileMetadata metadata of every supplied file, in submission order
 */
public record ProcessingResult(
        List<ProcessedFile> files,
        List<FileError> errors,
        ProcessingSummary summary,
        FileValidationResult validation,
        List<FileMetadata> fileMetadata
) {

    public ProcessingResult {
        files = List.copyOf(files);
        errors = List.copyOf(errors);
        fileMetadata = List.copyOf(fileMetadata);
    }

    @JsonProperty("runsheets")
    public List<ProcessedFile> runsheets() {
        return files.stream().filter(file -> file.type() == DocumentType.RUNSHEET).toList();
    }

    @JsonProperty("invoices")
    public List<ProcessedFile> invoices() {
        return files.stream().filter(file -> file.type() == DocumentType.INVOICE).toList();
    }
}
