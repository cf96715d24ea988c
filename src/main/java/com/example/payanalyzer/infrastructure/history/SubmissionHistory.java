package com.example.payanalyzer.infrastructure.history;

import com.example.payanalyzer.domain.model.PriorSubmission;

import java.util.List;

/**
 * Store of earlier submissions, consulted for duplicate and update detection.
 */
public interface SubmissionHistory {

    /**
     * @param userId submitting user
     * @return that user's submissions, oldest first
     * @throws com.example.payanalyzer.infrastructure.exception.HistoryUnavailableException when the store cannot be read
     */
    List<PriorSubmission> listPriorSubmissions(String userId);

    /**
     * @param submission submission to remember
     * @throws com.example.payanalyzer.infrastructure.exception.HistoryUnavailableException when the store cannot be written
     */
    void record(PriorSubmission submission);
}
