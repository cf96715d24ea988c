package com.example.payanalyzer.application.service;

import com.example.payanalyzer.application.config.AnalyzerProperties;
import com.example.payanalyzer.application.exception.UseCaseValidationException;
import com.example.payanalyzer.application.parser.InvoiceParser;
import com.example.payanalyzer.application.parser.RunsheetParser;
import com.example.payanalyzer.application.worker.PdfProcessingWorker;
import com.example.payanalyzer.domain.model.AnalysisSource;
import com.example.payanalyzer.domain.model.ConsignmentCount;
import com.example.payanalyzer.domain.model.DailyEntrySnapshot;
import com.example.payanalyzer.domain.model.DateRange;
import com.example.payanalyzer.domain.model.FileValidationOptions;
import com.example.payanalyzer.domain.model.FingerprintVerdict;
import com.example.payanalyzer.domain.model.ManualEntry;
import com.example.payanalyzer.domain.model.ManualSubmission;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.PaymentRules;
import com.example.payanalyzer.domain.model.PaymentStatus;
import com.example.payanalyzer.domain.model.PriorSubmission;
import com.example.payanalyzer.domain.model.UploadedPdf;
import com.example.payanalyzer.domain.model.ValidationIssue;
import com.example.payanalyzer.domain.model.ValidationThresholds;
import com.example.payanalyzer.domain.service.FileFingerprintService;
import com.example.payanalyzer.domain.service.FileValidationService;
import com.example.payanalyzer.domain.service.ValidationService;
import com.example.payanalyzer.infrastructure.exception.HistoryUnavailableException;
import com.example.payanalyzer.infrastructure.history.InMemorySubmissionHistory;
import com.example.payanalyzer.infrastructure.history.SubmissionHistory;
import com.example.payanalyzer.infrastructure.pdf.PdfDocumentInfoReader;
import com.example.payanalyzer.infrastructure.pdf.PdfTextExtractor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.example.payanalyzer.TestPdfs.createPdf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * End-to-end tests of the analysis use cases over generated PDFs.
 */
class AnalysisServiceTest {

    private static final LocalDate TUESDAY = LocalDate.of(2025, 7, 1);

    private final Clock clock = Clock.fixed(Instant.parse("2025-07-09T12:00:00Z"), ZoneOffset.UTC);
    private final AnalyzerProperties properties = new AnalyzerProperties();
    private final PdfProcessor processor = new PdfProcessor(
            new FileValidationService(FileValidationOptions.defaults()),
            new PdfTextExtractor(new PdfDocumentInfoReader()),
            new RunsheetParser(200, clock),
            new InvoiceParser(Money.of(3), Money.of(500), Money.of(500)),
            properties);
    private final PdfProcessingWorker worker = new PdfProcessingWorker(processor, properties);
    private final InMemorySubmissionHistory history = new InMemorySubmissionHistory();
    private final PaymentRules rules = PaymentRules.defaults("driver-1", clock);

    private AnalysisService service(SubmissionHistory submissionHistory) {
        return new AnalysisService(worker, processor, new ReconciliationService(), new FileFingerprintService(),
                new ValidationService(ValidationThresholds.defaults()), submissionHistory, clock);
    }

    private static List<UploadedPdf> tuesdayBatch() throws IOException {
        return List.of(
                new UploadedPdf("DV_0427.pdf", "application/pdf", 1_000L, createPdf("""
                        Runsheet DV_0427
                        Date: 01/07/2025
                        1 1234567 Delivery Mill Road
                        2 7654321 Delivery Park Lane""")),
                new UploadedPdf("Self Bill 0427.pdf", "application/pdf", 2_000L, createPdf("""
                        Self Bill Invoice
                        01/07/25 08:15 Standard 45.50
                        01/07/25 12:00 -PickUp Parcel 5.00""")));
    }

    @AfterEach
    void stopWorker() {
        worker.terminate();
    }

    /**
     * Verifies that a runsheet and an invoice reconcile into one underpaid Tuesday.
     *
     * @throws Exception when the sample PDFs cannot be created
     */
    @Test
    void analyzeUploadReconcilesRunsheetAgainstInvoice() throws Exception {
        AnalysisReport report = service(history).analyzeUpload("driver-1", tuesdayBatch(), rules);

        assertThat(report.source()).isEqualTo(AnalysisSource.UPLOAD);
        assertThat(report.period()).isEqualTo(DateRange.of(TUESDAY, TUESDAY));
        assertThat(report.fingerprint()).hasSize(64);
        assertThat(report.comparison().verdict()).isEqualTo(FingerprintVerdict.NEW);
        assertThat(report.rulesVersion()).isEqualTo(1);

        DailyEntrySnapshot tuesday = report.entries().get(0);
        assertThat(tuesday.consignments()).isEqualTo(2);
        assertThat(tuesday.pickups()).isEqualTo(1);
        assertThat(tuesday.expectedTotal()).isEqualByComparingTo(new BigDecimal("114.00"));
        assertThat(tuesday.paidAmount()).isEqualByComparingTo(new BigDecimal("45.50"));
        assertThat(tuesday.status()).isEqualTo(PaymentStatus.UNDERPAID);

        assertThat(report.overallStatus()).isEqualTo(PaymentStatus.UNDERPAID);
        assertThat(report.totals().workingDays()).isEqualTo(1);
        assertThat(report.validation().valid()).isTrue();
        assertThat(report.validation().warnings()).extracting(ValidationIssue::code)
                .contains("LARGE_DISCREPANCIES");
        assertThat(report.processing().summary().successfulFiles()).isEqualTo(2);
        assertThat(history.listPriorSubmissions("driver-1")).singleElement()
                .extracting(PriorSubmission::analysisId).isEqualTo(report.analysisId());
    }

    @Test
    void resubmittingSameFilesIsDuplicateAndNotRecordedAgain() throws Exception {
        AnalysisService service = service(history);
        List<UploadedPdf> files = tuesdayBatch();
        AnalysisReport first = service.analyzeUpload("driver-1", files, rules);

        AnalysisReport second = service.analyzeUpload("driver-1", files, rules);

        assertThat(second.fingerprint()).isEqualTo(first.fingerprint());
        assertThat(second.comparison().verdict()).isEqualTo(FingerprintVerdict.DUPLICATE);
        assertThat(second.comparison().matchedAnalysisId()).isEqualTo(first.analysisId());
        assertThat(history.listPriorSubmissions("driver-1")).hasSize(1);
    }

    @Test
    void rejectedBatchFailsTheUseCase() {
        List<UploadedPdf> files = List.of(
                new UploadedPdf("fake.pdf", "application/pdf", 0L, "nope".getBytes(StandardCharsets.US_ASCII)));

        UseCaseValidationException ex = assertThrows(UseCaseValidationException.class,
                () -> service(history).analyzeUpload("driver-1", files, rules));

        assertThat(ex.getMessage()).isEqualTo("File \"fake.pdf\" is not a valid PDF file");
        assertThat(history.listPriorSubmissions("driver-1")).isEmpty();
    }

    @Test
    void batchWithoutDatedDataFailsTheUseCase() throws Exception {
        List<UploadedPdf> files = List.of(
                new UploadedPdf("runsheet.pdf", "application/pdf", 0L, createPdf("Runsheet\nNo jobs today")));

        UseCaseValidationException ex = assertThrows(UseCaseValidationException.class,
                () -> service(history).analyzeUpload("driver-1", files, rules));

        assertThat(ex.getMessage()).isEqualTo("No dated runsheet or invoice entries were extracted.");
    }

    @Test
    void analyzeManualReportsMissingWorkingDays() {
        DateRange week = DateRange.of(LocalDate.of(2025, 6, 30), LocalDate.of(2025, 7, 5));
        ManualSubmission submission = new ManualSubmission("driver-1", week, List.of(
                new ManualEntry(LocalDate.of(2025, 6, 30), ConsignmentCount.of(10), Money.of(95)),
                new ManualEntry(TUESDAY, ConsignmentCount.of(20), Money.of(145))));

        AnalysisReport report = service(history).analyzeManual(submission, rules);

        assertThat(report.source()).isEqualTo(AnalysisSource.MANUAL);
        assertThat(report.processing()).isNull();
        assertThat(report.entries()).hasSize(2);
        assertThat(report.overallStatus()).isEqualTo(PaymentStatus.BALANCED);
        assertThat(report.validation().warnings()).extracting(ValidationIssue::code)
                .containsExactly("MISSING_WORKING_DAYS");
        assertThat(report.totals().paidTotal()).isEqualTo(Money.of(240));
        assertThat(history.listPriorSubmissions("driver-1")).hasSize(1);
    }

    @Test
    void unavailableHistoryDoesNotBlockAnalysis() {
        SubmissionHistory broken = mock(SubmissionHistory.class);
        given(broken.listPriorSubmissions(anyString()))
                .willThrow(new HistoryUnavailableException("disk gone", null));
        willThrow(new HistoryUnavailableException("disk gone", null)).given(broken).record(any());
        ManualSubmission submission = new ManualSubmission("driver-1", DateRange.of(TUESDAY, TUESDAY),
                List.of(new ManualEntry(TUESDAY, ConsignmentCount.of(20), Money.of(145))));

        AnalysisReport report = service(broken).analyzeManual(submission, rules);

        assertThat(report.comparison().verdict()).isEqualTo(FingerprintVerdict.NEW);
        verify(broken).record(any());
    }
}
