package com.example.payanalyzer.domain.model;

/**
 * Outcome of checking computed invoice totals against the printed total.
 */
public enum TotalVerification {
    MATCHED,
    MISMATCHED,
    /** No printed total was found. */
    UNVERIFIED
}
