package com.example.payanalyzer.domain.model;

import java.util.List;

/**
 * Verdict of one extractor over one document. Extractors report expected failures through
 * this type instead of throwing.
 *
 * @param success  whether usable data was extracted
 * @param data     extracted data, {@code null} on failure
 * @param error    failure reason, {@code null} on success
 * @param warnings non-fatal findings
 * @param rawText  text the extractor worked on
 * @param <T>      extracted document type
 */
public record ParseOutcome<T extends ExtractedDocument>(
        boolean success,
        T data,
        String error,
        List<String> warnings,
        ExtractedText rawText
) {

    public ParseOutcome {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static <T extends ExtractedDocument> ParseOutcome<T> success(T data, List<String> warnings, ExtractedText rawText) {
        return new ParseOutcome<>(true, data, null, warnings, rawText);
    }

    public static <T extends ExtractedDocument> ParseOutcome<T> failure(String error, List<String> warnings, ExtractedText rawText) {
        return new ParseOutcome<>(false, null, error, warnings, rawText);
    }

    /**
     * @return number of data points, zero for a failure
     */
    public int dataPoints() {
        return success && data != null ? data.dataPoints() : 0;
    }
}
