package com.example.payanalyzer.domain.model;

/**
 * Kind of document a PDF was recognised as.
 */
public enum DocumentType {
    RUNSHEET,
    INVOICE
}
