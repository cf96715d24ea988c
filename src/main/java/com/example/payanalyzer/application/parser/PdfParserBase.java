package com.example.payanalyzer.application.parser;

import com.example.payanalyzer.domain.model.DocumentType;
import com.example.payanalyzer.domain.model.ExtractedDocument;
import com.example.payanalyzer.domain.model.ExtractedText;
import com.example.payanalyzer.domain.model.ParseOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Template for document extractors. Subclasses turn already extracted PDF text into a typed
 * record and judge whether the result is usable; this class turns that judgement, or any
 * unexpected failure, into a {@link ParseOutcome}.
 *
 * @param <T> extracted document type
 */
public abstract class PdfParserBase<T extends ExtractedDocument> {

    private static final Logger log = LoggerFactory.getLogger(PdfParserBase.class);
    private static final String UNKNOWN_ERROR = "Unknown error occurred";

    /**
     * Extracts and validates data from the given text. Never throws for content problems.
     *
     * @param text     text of the whole document, per page
     * @param fileName original file name, used as a fallback source of facts
     * @return success with data and warnings, or failure with a reason
     */
    public ParseOutcome<T> parse(ExtractedText text, String fileName) {
        ExtractedText source = text != null ? text : ExtractedText.EMPTY;
        try {
            T data = extractData(source, fileName);
            DataCheck check = validateData(data);
            if (!check.valid()) {
                log.debug("{} extraction rejected for {}: {}", documentType(), fileName, check.error());
                return ParseOutcome.failure(check.error(), check.warnings(), source);
            }
            return ParseOutcome.success(data, check.warnings(), source);
        } catch (RuntimeException ex) {
            log.warn("{} extraction failed for {}", documentType(), fileName, ex);
            String message = ex.getMessage() != null ? ex.getMessage() : UNKNOWN_ERROR;
            return ParseOutcome.failure(message, List.of(), source);
        }
    }

    /**
     * Cheap classification from the file name and, when present, a preview of the content.
     *
     * @param fileName       file name
     * @param contentPreview beginning of the document text, may be {@code null}
     * @return whether this extractor looks responsible for the document
     */
    public boolean canParse(String fileName, String contentPreview) {
        String lowerName = fileName != null ? fileName.toLowerCase(Locale.ROOT) : "";
        boolean nameMatches = fileTypeIdentifiers().stream().anyMatch(lowerName::contains);
        if (contentPreview != null && !contentPreview.isEmpty()) {
            return nameMatches || checkContentPatterns(contentPreview);
        }
        return nameMatches;
    }

    /**
     * @return the document type this extractor produces
     */
    public abstract DocumentType documentType();

    /**
     * @return lower-case substrings that identify the document type in a file name
     */
    protected abstract List<String> fileTypeIdentifiers();

    protected abstract T extractData(ExtractedText text, String fileName);

    protected abstract DataCheck validateData(T data);

    protected abstract boolean checkContentPatterns(String content);

    /**
     * Usability verdict on extracted data.
     *
     * @param valid    whether the data may be returned
     * @param error    rejection reason when not valid
     * @param warnings non-fatal findings
     */
    protected record DataCheck(boolean valid, String error, List<String> warnings) {

        protected DataCheck {
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
        }

        static DataCheck accepted(List<String> warnings) {
            return new DataCheck(true, null, warnings);
        }

        static DataCheck rejected(String error) {
            return new DataCheck(false, error, List.of());
        }
    }

    static boolean containsAny(String content, List<String> indicators) {
        String lower = content.toLowerCase(Locale.ROOT);
        return indicators.stream().anyMatch(lower::contains);
    }
}
