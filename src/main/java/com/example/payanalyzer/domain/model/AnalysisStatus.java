package com.example.payanalyzer.domain.model;

/**
 * Lifecycle state of an analysis.
 */
public enum AnalysisStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    ERROR
}
