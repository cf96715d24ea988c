package com.example.payanalyzer.domain.model;

/**
 * Where the data of an analysis came from.
 */
public enum AnalysisSource {
    UPLOAD,
    MANUAL,
    IMPORT
}
