package com.example.payanalyzer.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Structured facts extracted from one PDF.
 */
public interface ExtractedDocument {

    DocumentType documentType();

    /**
     * @return number of structured items found, used to pick between competing extractions
     */
    int dataPoints();

    /**
     * @return distinct dates covered by the document, chronological
     */
    List<LocalDate> dates();
}
