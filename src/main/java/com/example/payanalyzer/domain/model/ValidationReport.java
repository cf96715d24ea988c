package com.example.payanalyzer.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Errors block, warnings only inform.
 *
 * @param errors   blocking issues
 * @param warnings advisory issues
 */
public record ValidationReport(List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    @JsonProperty("valid")
    public boolean valid() {
        return errors.isEmpty();
    }

    public ValidationReport merge(ValidationReport other) {
        List<ValidationIssue> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors);
        List<ValidationIssue> mergedWarnings = new ArrayList<>(warnings);
        mergedWarnings.addAll(other.warnings);
        return new ValidationReport(mergedErrors, mergedWarnings);
    }
}
