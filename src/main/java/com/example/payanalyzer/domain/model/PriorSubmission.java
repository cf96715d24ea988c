package com.example.payanalyzer.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * A submission remembered from an earlier analysis.
 *
 * @param analysisId  analysis the submission produced
 * @param userId      submitting user
 * @param fingerprint fingerprint of the submission
 * @param files       files of the submission, empty for manual entry
 * @param recordedAt  when the submission was remembered
 */
public record PriorSubmission(
        String analysisId,
        String userId,
        String fingerprint,
        List<FileMetadata> files,
        Instant recordedAt
) {

    public PriorSubmission {
        files = files != null ? List.copyOf(files) : List.of();
    }
}
