package com.example.payanalyzer.infrastructure.history;

import com.example.payanalyzer.domain.model.PriorSubmission;
import com.example.payanalyzer.infrastructure.exception.HistoryUnavailableException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * History persisted as a JSON array in a single file. Reads and writes are serialized.
 */
public class JsonFileSubmissionHistory implements SubmissionHistory {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSubmissionHistory.class);
    private static final TypeReference<List<PriorSubmission>> SUBMISSIONS = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    /**
     * @param file         JSON file, created on first write
     * @param objectMapper mapper able to handle {@code java.time} values
     */
    public JsonFileSubmissionHistory(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized List<PriorSubmission> listPriorSubmissions(String userId) {
        return readAll().stream()
                .filter(submission -> Objects.equals(submission.userId(), userId))
                .toList();
    }

    @Override
    public synchronized void record(PriorSubmission submission) {
        List<PriorSubmission> all = new ArrayList<>(readAll());
        all.add(submission);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), all);
            log.debug("Recorded submission {} in {}", submission.analysisId(), file);
        } catch (IOException e) {
            throw new HistoryUnavailableException("Unable to write submission history " + file + ".", e);
        }
    }

    private List<PriorSubmission> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(file.toFile(), SUBMISSIONS);
        } catch (IOException e) {
            throw new HistoryUnavailableException("Unable to read submission history " + file + ".", e);
        }
    }
}
