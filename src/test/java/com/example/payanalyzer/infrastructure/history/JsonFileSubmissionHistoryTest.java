package com.example.payanalyzer.infrastructure.history;

import com.example.payanalyzer.domain.model.FileMetadata;
import com.example.payanalyzer.domain.model.PriorSubmission;
import com.example.payanalyzer.infrastructure.exception.HistoryUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonFileSubmissionHistoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @TempDir
    Path tempDir;

    private static PriorSubmission submission(String analysisId, String userId) {
        FileMetadata file = new FileMetadata("DV_0427.pdf", 2048, "application/pdf", 1_000L, "abc");
        return new PriorSubmission(analysisId, userId, "fp-" + analysisId, List.of(file),
                Instant.parse("2025-07-01T10:15:30Z"));
    }

    @Test
    void recordsSurviveANewInstance() {
        Path file = tempDir.resolve("history").resolve("submissions.json");
        new JsonFileSubmissionHistory(file, objectMapper).record(submission("a-1", "driver-1"));
        new JsonFileSubmissionHistory(file, objectMapper).record(submission("a-2", "driver-2"));

        List<PriorSubmission> restored = new JsonFileSubmissionHistory(file, objectMapper).listPriorSubmissions("driver-1");

        assertThat(restored).containsExactly(submission("a-1", "driver-1"));
        assertThat(Files.exists(file)).isTrue();
    }

    @Test
    void missingFileIsAnEmptyHistory() {
        JsonFileSubmissionHistory history = new JsonFileSubmissionHistory(tempDir.resolve("none.json"), objectMapper);

        assertThat(history.listPriorSubmissions("driver-1")).isEmpty();
    }

    @Test
    void corruptFileIsUnavailable() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);
        JsonFileSubmissionHistory history = new JsonFileSubmissionHistory(file, objectMapper);

        assertThrows(HistoryUnavailableException.class, () -> history.listPriorSubmissions("driver-1"));
        assertThrows(HistoryUnavailableException.class, () -> history.record(submission("a-1", "driver-1")));
    }
}
