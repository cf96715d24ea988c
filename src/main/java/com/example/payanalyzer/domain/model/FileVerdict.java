package com.example.payanalyzer.domain.model;

/**
 * Comparison verdict for one file.
 *
 * @param fileName             compared file
 * @param verdict              {@code NEW}, {@code UNCHANGED} or {@code MODIFIED}
 * @param matchedAnalysisId    analysis holding the matching earlier file, or {@code null}
 * @param previousLastModified last-modified time of the earlier file, or {@code null}
 */
public record FileVerdict(String fileName, FingerprintVerdict verdict, String matchedAnalysisId, Long previousLastModified) {
}
