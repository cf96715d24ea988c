package com.example.payanalyzer.application.exception;

import com.example.payanalyzer.domain.model.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a payment rule set is rejected before any calculation runs.
 */
public class RulesValidationException extends UseCaseValidationException {

    private final transient List<ValidationIssue> issues;

	/**
	 * Creates the exception from the blocking issues reported by the validator.
	 *
	 * @param issues validation errors, never empty
	 */
    public RulesValidationException(List<ValidationIssue> issues) {
        super("Payment rules rejected: " + issues.stream()
                .map(ValidationIssue::message)
                .collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
