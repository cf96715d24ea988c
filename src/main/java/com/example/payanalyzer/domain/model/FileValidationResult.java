package com.example.payanalyzer.domain.model;

import java.util.List;

/**
 * Batch-level validation of a set of uploaded files.
 *
 * @param errors             blocking problems; any error keeps the batch from being parsed
 * @param warnings           advisory findings
 * @param updated            whether any file looks like a newer version of a previously submitted file
 * @param updatedFiles       names of those files
 * @param duplicateFiles     files appearing more than once by name and size
 * @param existingAnalysisId analysis whose file list matches this batch exactly, or {@code null}
 */
public record FileValidationResult(
        List<String> errors,
        List<String> warnings,
        boolean updated,
        List<String> updatedFiles,
        List<FileMetadata> duplicateFiles,
        String existingAnalysisId
) {

    public FileValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        updatedFiles = List.copyOf(updatedFiles);
        duplicateFiles = List.copyOf(duplicateFiles);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
