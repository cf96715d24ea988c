package com.example.payanalyzer.infrastructure.pdf;

import com.example.payanalyzer.domain.model.ExtractedText;
import com.example.payanalyzer.domain.model.PdfDocumentInfo;

/**
 * Everything read from one PDF in a single pass.
 *
 * @param text         per-page text
 * @param documentInfo document-level facts
 */
public record PdfContent(ExtractedText text, PdfDocumentInfo documentInfo) {
}
