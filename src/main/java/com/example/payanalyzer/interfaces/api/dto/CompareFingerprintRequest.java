package com.example.payanalyzer.interfaces.api.dto;

import com.example.payanalyzer.domain.model.FileMetadata;
import com.example.payanalyzer.domain.model.PriorSubmission;

import java.util.List;

/**
 * @param fingerprint fingerprint of the current submission
 * @param files       files of the current submission, empty for manual entry
 * @param priors      earlier submissions to compare against
 */
public record CompareFingerprintRequest(String fingerprint, List<FileMetadata> files, List<PriorSubmission> priors) {
}
