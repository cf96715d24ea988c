package com.example.payanalyzer.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw text of a whole document, kept per page for extractors that work page by page.
 *
 * @param text  concatenated text of every page
 * @param pages per-page text in page order
 */
public record ExtractedText(String text, List<PageText> pages) {

    public static final ExtractedText EMPTY = new ExtractedText("", List.of());

    public ExtractedText {
        text = text != null ? text : "";
        pages = pages != null ? List.copyOf(pages) : List.of();
    }

    /**
     * Builds the document text from page texts, one page after the other.
     *
     * @param pageTexts text of each page, in order
     * @return extracted text with 1-based page numbers
     */
    public static ExtractedText ofPages(List<String> pageTexts) {
        List<PageText> pages = new ArrayList<>();
        for (int i = 0; i < pageTexts.size(); i++) {
            pages.add(new PageText(i + 1, pageTexts.get(i)));
        }
        String text = pageTexts.stream().map(page -> page.endsWith("\n") ? page : page + "\n")
                .collect(Collectors.joining());
        return new ExtractedText(text, pages);
    }

    /**
     * @param maxLength maximum number of characters
     * @return the beginning of the first page, or an empty string when there is no page
     */
    public String firstPagePreview(int maxLength) {
        if (pages.isEmpty()) {
            return "";
        }
        String first = pages.get(0).text();
        return first.length() <= maxLength ? first : first.substring(0, maxLength);
    }
}
