package com.example.payanalyzer.domain.model;

import java.util.List;

/**
 * Result of comparing a submission against earlier ones. Comparing never changes earlier data;
 * a caller that wants to combine them picks a {@link MergeStrategy}.
 *
 * @param verdict           overall verdict
 * @param matchedAnalysisId earlier analysis the verdict refers to, or {@code null} for {@code NEW}
 * @param fileVerdicts      per-file verdicts in submission order
 */
public record FingerprintComparison(FingerprintVerdict verdict, String matchedAnalysisId, List<FileVerdict> fileVerdicts) {

    public FingerprintComparison {
        fileVerdicts = List.copyOf(fileVerdicts);
    }

    public boolean requiresMergeDecision() {
        return verdict != FingerprintVerdict.NEW;
    }
}
