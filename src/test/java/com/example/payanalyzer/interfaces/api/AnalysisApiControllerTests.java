package com.example.payanalyzer.interfaces.api;

import com.example.payanalyzer.application.exception.RulesValidationException;
import com.example.payanalyzer.application.exception.UseCaseValidationException;
import com.example.payanalyzer.application.exception.WorkerTerminatedException;
import com.example.payanalyzer.application.service.AnalysisService;
import com.example.payanalyzer.application.service.PaymentRulesFactory;
import com.example.payanalyzer.application.service.ReconciliationService;
import com.example.payanalyzer.domain.exception.FingerprintComputationException;
import com.example.payanalyzer.domain.model.FileSetMetadata;
import com.example.payanalyzer.domain.model.FingerprintResult;
import com.example.payanalyzer.domain.model.PaymentRules;
import com.example.payanalyzer.domain.model.ValidationIssue;
import com.example.payanalyzer.domain.model.ValidationReport;
import com.example.payanalyzer.domain.service.FileFingerprintService;
import com.example.payanalyzer.domain.service.ValidationService;
import com.example.payanalyzer.infrastructure.exception.PdfProcessingException;
import com.example.payanalyzer.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = AnalysisApiController.class)
@Import(GlobalExceptionHandler.class)
class AnalysisApiControllerTests {

    private static final PaymentRules DEFAULT_RULES = PaymentRules.defaults("anonymous", Clock.systemUTC());

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnalysisService analysisService;

    @MockBean
    private PaymentRulesFactory rulesFactory;

    @MockBean
    private ReconciliationService reconciliationService;

    @MockBean
    private FileFingerprintService fingerprintService;

    @MockBean
    private ValidationService validationService;

    /**
     * Verifies that an uploaded file set is fingerprinted and returned as JSON.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void fingerprintsUploadedFiles() throws Exception {
        MockMultipartFile file = new MockMultipartFile("files", "DV_runsheet.pdf", "application/pdf", "data".getBytes());
        given(fingerprintService.createFingerprint(anyList()))
                .willReturn(new FingerprintResult("abc123", List.of("h1"), new FileSetMetadata(1, 4, List.of("application/pdf"))));

        mockMvc.perform(multipart("/api/fingerprints/files").file(file).param("lastModified", "1720000000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fingerprint").value("abc123"))
                .andExpect(jsonPath("$.metadata.fileCount").value(1))
                .andExpect(jsonPath("$.metadata.fileTypes[0]").value("application/pdf"));
    }

    /**
     * Verifies that a hashing failure is reported as a server error rather than a bad request.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void fingerprintComputationFailureMappedToServerError() throws Exception {
        given(fingerprintService.createManualFingerprint(any()))
                .willThrow(new FingerprintComputationException("Unable to serialize fingerprint payload",
                        new IllegalStateException("boom")));

        mockMvc.perform(post("/api/fingerprints/manual")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\": \"2025-06-30\", \"end\": \"2025-07-05\", \"entries\": []}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("FINGERPRINT_ERROR"));
    }

    /**
     * Verifies that a request without any file part is rejected before reaching the services.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingFilePartMappedToBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/files/parse"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MISSING_INPUT"));

        verify(analysisService, never()).parseFiles(any(), anyList(), any());
    }

    /**
     * Verifies that a terminated worker translates to HTTP 503 and that the user id is forwarded.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void workerTerminatedMappedToServiceUnavailable() throws Exception {
        MockMultipartFile file = new MockMultipartFile("files", "DV_invoice.pdf", "application/pdf", "data".getBytes());
        given(analysisService.parseFiles(eq("driver-7"), anyList(), any()))
                .willThrow(new WorkerTerminatedException("req-1"));

        mockMvc.perform(multipart("/api/files/parse").file(file).param("userId", "driver-7"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("WORKER_TERMINATED"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        MockMultipartFile file = new MockMultipartFile("files", "DV_invoice.pdf", "application/pdf", "data".getBytes());
        given(analysisService.parseFiles(any(), anyList(), any()))
                .willThrow(new PdfProcessingException("Unable", new RuntimeException("boom")));

        mockMvc.perform(multipart("/api/files/parse").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    /**
     * Verifies that use-case validation errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void useCaseValidationExceptionMappedToBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("files", "DV_runsheet.pdf", "application/pdf", "data".getBytes());
        given(rulesFactory.create(any(), any(), any(), any(), any(), any())).willReturn(DEFAULT_RULES);
        given(analysisService.analyzeUpload(any(), anyList(), any()))
                .willThrow(new UseCaseValidationException("No dated runsheet or invoice data was found."));

        mockMvc.perform(multipart("/api/analyses").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("No dated runsheet or invoice data was found."));
    }

    /**
     * Verifies that a daily calculation applies the weekday rate and every Tuesday bonus.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void calculatesDailyPayment() throws Exception {
        given(rulesFactory.create(any(), any(), any(), any(), any(), any())).willReturn(DEFAULT_RULES);

        mockMvc.perform(post("/api/payments/daily")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"day": {"date": "2025-07-01", "consignments": 20, "paidAmount": 145.00}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dayName").value("Tuesday"))
                .andExpect(jsonPath("$.basePayment").value(40.0))
                .andExpect(jsonPath("$.expectedTotal").value(145.0))
                .andExpect(jsonPath("$.status").value("BALANCED"));
    }

    /**
     * Verifies that a fractional consignment count is rejected as a domain error.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void fractionalCountMappedToDomainError() throws Exception {
        given(rulesFactory.create(any(), any(), any(), any(), any(), any())).willReturn(DEFAULT_RULES);

        mockMvc.perform(post("/api/payments/daily")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"day": {"date": "2025-07-01", "consignments": 2.5}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    /**
     * Verifies that a day without a date is rejected.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void dailyPaymentWithoutDateRejected() throws Exception {
        mockMvc.perform(post("/api/payments/daily")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"day\": {\"consignments\": 10}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    /**
     * Verifies that rejected rule sets list their issues in the error details.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void rulesValidationExceptionListsIssues() throws Exception {
        given(rulesFactory.create(any(), any(), any(), any(), any(), any()))
                .willThrow(new RulesValidationException(List.of(
                        ValidationIssue.of("NEGATIVE_RATE", "Weekday rate cannot be negative"))));

        mockMvc.perform(post("/api/payments/weekly-stats")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rules\": {\"weekdayRate\": -1}, \"days\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("RULES_VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.issues[0].code").value("NEGATIVE_RATE"));
    }

    @Test
    void validatesRulesWithoutRejectingWarnings() throws Exception {
        given(rulesFactory.build(any(), any(), any(), any(), any(), any())).willReturn(DEFAULT_RULES);
        given(validationService.validatePaymentRules(DEFAULT_RULES))
                .willReturn(new ValidationReport(List.of(), List.of(ValidationIssue.of("HIGH_RATE", "Weekday rate looks high"))));

        mockMvc.perform(post("/api/rules/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weekdayRate\": 12.00}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.warnings[0].code").value("HIGH_RATE"));
    }

    @Test
    void blankFingerprintRejected() throws Exception {
        mockMvc.perform(post("/api/fingerprints/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fingerprint\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    /**
     * Verifies that unreadable JSON bodies translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void malformedJsonMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/payments/merge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entries\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }
}
