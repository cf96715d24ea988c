package com.example.payanalyzer.application.config;

import com.example.payanalyzer.application.parser.InvoiceParser;
import com.example.payanalyzer.application.parser.RunsheetParser;
import com.example.payanalyzer.domain.model.FileValidationOptions;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.ValidationThresholds;
import com.example.payanalyzer.domain.service.FileFingerprintService;
import com.example.payanalyzer.domain.service.FileValidationService;
import com.example.payanalyzer.domain.service.ValidationService;
import com.example.payanalyzer.infrastructure.history.FallbackSubmissionHistory;
import com.example.payanalyzer.infrastructure.history.InMemorySubmissionHistory;
import com.example.payanalyzer.infrastructure.history.JsonFileSubmissionHistory;
import com.example.payanalyzer.infrastructure.history.SubmissionHistory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the framework-free domain services and extractors with the configured thresholds.
 */
@Configuration
public class AnalyzerConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ValidationService validationService(AnalyzerProperties properties) {
        AnalyzerProperties.Validation validation = properties.getValidation();
        return new ValidationService(new ValidationThresholds(
                validation.getHighConsignmentCount(),
                Money.of(validation.getHighPaymentAmount()),
                Money.of(validation.getLargeDiscrepancy()),
                Money.of(validation.getHighWeekdayRate()),
                Money.of(validation.getHighSaturdayRate())));
    }

    @Bean
    public FileValidationService fileValidationService(AnalyzerProperties properties) {
        AnalyzerProperties.Upload upload = properties.getUpload();
        return new FileValidationService(new FileValidationOptions(
                upload.getMaxFileSize(),
                upload.getMaxFiles(),
                upload.getAllowedTypes(),
                upload.isCheckForUpdates(),
                upload.isCheckForDuplicates()));
    }

    @Bean
    public FileFingerprintService fileFingerprintService() {
        return new FileFingerprintService();
    }

    @Bean
    public RunsheetParser runsheetParser(AnalyzerProperties properties, Clock clock) {
        return new RunsheetParser(properties.getExtraction().getHighConsignmentCount(), clock);
    }

    @Bean
    public InvoiceParser invoiceParser(AnalyzerProperties properties) {
        AnalyzerProperties.Extraction extraction = properties.getExtraction();
        return new InvoiceParser(
                Money.of(extraction.getMinInvoiceAmount()),
                Money.of(extraction.getMaxInvoiceAmount()),
                Money.of(extraction.getHighInvoiceAmount()));
    }

    /**
     * In-memory history, or a JSON file backed one with an in-memory fallback when
     * {@code payanalyzer.history.file} is set.
     */
    @Bean
    public SubmissionHistory submissionHistory(AnalyzerProperties properties, ObjectMapper objectMapper) {
        String file = properties.getHistory().getFile();
        if (file == null || file.isBlank()) {
            return new InMemorySubmissionHistory();
        }
        log.info("Submission history persisted to {}", file);
        ObjectMapper historyMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return new FallbackSubmissionHistory(new JsonFileSubmissionHistory(Path.of(file), historyMapper),
                new InMemorySubmissionHistory());
    }
}
