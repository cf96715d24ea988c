package com.example.payanalyzer.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Optional;

/**
 * Outcome of processing one file of a batch.
 *
 * @param id           identifier of this processing run for the file
 * @param metadata     file metadata including the content hash
 * @param type         document type the outcome belongs to
 * @param inferred     {@code true} when neither extractor claimed the file and the type was
 *                     chosen by comparing both extractions
 * @param outcome      extractor verdict
 * @param documentInfo PDF document facts, {@code null} when the PDF could not be read
 */
public record ProcessedFile(
        String id,
        FileMetadata metadata,
        DocumentType type,
        boolean inferred,
        ParseOutcome<? extends ExtractedDocument> outcome,
        PdfDocumentInfo documentInfo
) {

    @JsonIgnore
    public boolean isSuccess() {
        return outcome.success();
    }

    public Optional<RunsheetRecord> runsheet() {
        return outcome.data() instanceof RunsheetRecord runsheet ? Optional.of(runsheet) : Optional.empty();
    }

    public Optional<InvoiceRecord> invoice() {
        return outcome.data() instanceof InvoiceRecord invoice ? Optional.of(invoice) : Optional.empty();
    }
}
