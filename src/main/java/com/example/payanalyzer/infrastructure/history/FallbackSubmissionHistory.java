package com.example.payanalyzer.infrastructure.history;

import com.example.payanalyzer.domain.model.PriorSubmission;
import com.example.payanalyzer.infrastructure.exception.HistoryUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reads from a primary store and keeps a cache copy. When the primary cannot be read the cached
 * submissions are served instead; writes always reach the cache and are attempted on the primary.
 */
public class FallbackSubmissionHistory implements SubmissionHistory {

    private static final Logger log = LoggerFactory.getLogger(FallbackSubmissionHistory.class);

    private final SubmissionHistory primary;
    private final InMemorySubmissionHistory cache;

    public FallbackSubmissionHistory(SubmissionHistory primary, InMemorySubmissionHistory cache) {
        this.primary = primary;
        this.cache = cache;
    }

    @Override
    public List<PriorSubmission> listPriorSubmissions(String userId) {
        try {
            List<PriorSubmission> submissions = primary.listPriorSubmissions(userId);
            cache.replace(userId, submissions);
            return submissions;
        } catch (HistoryUnavailableException ex) {
            log.warn("Primary submission history unavailable for user {}, serving cached entries: {}",
                    userId, ex.getMessage());
            return cache.listPriorSubmissions(userId);
        }
    }

    @Override
    public void record(PriorSubmission submission) {
        cache.record(submission);
        try {
            primary.record(submission);
        } catch (HistoryUnavailableException ex) {
            log.warn("Submission {} kept in cache only: {}", submission.analysisId(), ex.getMessage());
        }
    }
}
