package com.example.payanalyzer.domain.model;

/**
 * Single validation finding with a stable code.
 *
 * @param code    stable machine-readable code, for example {@code NEGATIVE_PAYMENT}
 * @param message human readable explanation
 * @param field   offending field, may be {@code null}
 * @param value   offending value, may be {@code null}
 */
public record ValidationIssue(String code, String message, String field, Object value) {

    public static ValidationIssue of(String code, String message) {
        return new ValidationIssue(code, message, null, null);
    }
}
