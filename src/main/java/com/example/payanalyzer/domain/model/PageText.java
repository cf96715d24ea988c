package com.example.payanalyzer.domain.model;

/**
 * Text of one PDF page.
 *
 * @param pageNumber 1-based page number
 * @param text       page text, lines separated by {@code \n}
 */
public record PageText(int pageNumber, String text) {
}
