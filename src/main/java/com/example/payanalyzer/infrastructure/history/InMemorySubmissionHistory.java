package com.example.payanalyzer.infrastructure.history;

import com.example.payanalyzer.domain.model.PriorSubmission;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local history. Also serves as the cache behind {@link FallbackSubmissionHistory}.
 */
public class InMemorySubmissionHistory implements SubmissionHistory {

    private final Map<String, List<PriorSubmission>> submissionsByUser = new ConcurrentHashMap<>();

    @Override
    public List<PriorSubmission> listPriorSubmissions(String userId) {
        return List.copyOf(submissionsByUser.getOrDefault(userId, List.of()));
    }

    @Override
    public void record(PriorSubmission submission) {
        submissionsByUser.computeIfAbsent(submission.userId(), key -> new CopyOnWriteArrayList<>()).add(submission);
    }

    /**
     * Replaces everything known about a user with a fresher copy.
     *
     * @param userId      user whose entries are replaced
     * @param submissions new entries, oldest first
     */
    void replace(String userId, List<PriorSubmission> submissions) {
        submissionsByUser.put(userId, new CopyOnWriteArrayList<>(new ArrayList<>(submissions)));
    }
}
