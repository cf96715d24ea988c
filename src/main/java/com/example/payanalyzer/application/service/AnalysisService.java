package com.example.payanalyzer.application.service;

import com.example.payanalyzer.application.exception.UseCaseValidationException;
import com.example.payanalyzer.application.worker.PdfProcessingWorker;
import com.example.payanalyzer.application.worker.ProcessingProgressListener;
import com.example.payanalyzer.domain.model.Analysis;
import com.example.payanalyzer.domain.model.AnalysisSource;
import com.example.payanalyzer.domain.model.AnalysisStatus;
import com.example.payanalyzer.domain.model.DailyEntry;
import com.example.payanalyzer.domain.model.DateRange;
import com.example.payanalyzer.domain.model.FileMetadata;
import com.example.payanalyzer.domain.model.FingerprintComparison;
import com.example.payanalyzer.domain.model.FingerprintVerdict;
import com.example.payanalyzer.domain.model.ManualSubmission;
import com.example.payanalyzer.domain.model.PaymentRules;
import com.example.payanalyzer.domain.model.PriorSubmission;
import com.example.payanalyzer.domain.model.ProcessingResult;
import com.example.payanalyzer.domain.model.UploadedPdf;
import com.example.payanalyzer.domain.model.ValidationIssue;
import com.example.payanalyzer.domain.model.ValidationReport;
import com.example.payanalyzer.domain.service.FileFingerprintService;
import com.example.payanalyzer.domain.service.PaymentCalculator;
import com.example.payanalyzer.domain.service.ValidationService;
import com.example.payanalyzer.infrastructure.exception.HistoryUnavailableException;
import com.example.payanalyzer.infrastructure.history.SubmissionHistory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Application-layer entry point for analyses. It loads the user's history, runs extraction on
 * the worker, reconciles, validates and remembers new submissions.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final PdfProcessingWorker worker;
    private final PdfProcessor processor;
    private final ReconciliationService reconciliationService;
    private final FileFingerprintService fingerprintService;
    private final ValidationService validationService;
    private final SubmissionHistory submissionHistory;
    private final Clock clock;

    public AnalysisService(PdfProcessingWorker worker,
                           PdfProcessor processor,
                           ReconciliationService reconciliationService,
                           FileFingerprintService fingerprintService,
                           ValidationService validationService,
                           SubmissionHistory submissionHistory,
                           Clock clock) {
        this.worker = worker;
        this.processor = processor;
        this.reconciliationService = reconciliationService;
        this.fingerprintService = fingerprintService;
        this.validationService = validationService;
        this.submissionHistory = submissionHistory;
        this.clock = clock;
    }

    /**
     * Extracts a batch on the worker, checked against the user's earlier submissions.
     *
     * @param userId   submitting user
     * @param files    uploaded files
     * @param listener progress callback
     * @return batch result
     */
    public ProcessingResult parseFiles(String userId, List<UploadedPdf> files, ProcessingProgressListener listener) {
        return await(worker.submit(files, loadPriors(userId), listener));
    }

    /**
     * Full upload analysis.
     *
     * @param userId submitting user
     * @param files  uploaded runsheets and invoices
     * @param rules  rules to apply
     * @return analysis report
     * @throws UseCaseValidationException when the batch is rejected or yields no dated data
     */
    public AnalysisReport analyzeUpload(String userId, List<UploadedPdf> files, PaymentRules rules) {
        List<PriorSubmission> priors = loadPriors(userId);
        ProcessingResult result = await(worker.submit(files, priors));
        if (!result.validation().isValid()) {
            throw new UseCaseValidationException(String.join("; ", result.validation().errors()));
        }
        ValidationReport fileSetReport = processor.validateFileSet(result);
        if (!fileSetReport.valid()) {
            throw new UseCaseValidationException(fileSetReport.errors().get(0).message());
        }

        String fingerprint = fingerprintService.createFingerprint(files.stream().map(UploadedPdf::toFileInfo).toList())
                .fingerprint();
        FingerprintComparison comparison = fingerprintService.compareFingerprint(fingerprint, result.fileMetadata(), priors);

        String analysisId = UUID.randomUUID().toString();
        PaymentCalculator calculator = new PaymentCalculator(rules);
        List<DailyEntry> entries = reconciliationService.buildDailyEntries(analysisId, result, calculator);
        if (entries.isEmpty()) {
            throw new UseCaseValidationException("No dated runsheet or invoice entries were extracted.");
        }
        DateRange period = DateRange.of(entries.get(0).getDate(), entries.get(entries.size() - 1).getDate());
        Analysis analysis = new Analysis(analysisId, userId, fingerprint, AnalysisSource.UPLOAD, period, rules.version(), clock);
        entries.forEach(analysis::addDailyEntry);

        return complete(analysis, calculator, comparison, fileSetReport, result.fileMetadata(), result);
    }

    /**
     * Analysis of manually entered days.
     *
     * @param submission entered days and their period
     * @param rules      rules to apply
     * @return analysis report
     * @throws com.example.payanalyzer.domain.exception.InvalidDateRangeException when a day lies outside the period
     */
    public AnalysisReport analyzeManual(ManualSubmission submission, PaymentRules rules) {
        List<PriorSubmission> priors = loadPriors(submission.userId());
        String fingerprint = fingerprintService.createManualFingerprint(submission);
        FingerprintComparison comparison = fingerprintService.compareFingerprint(fingerprint, List.of(), priors);

        String analysisId = UUID.randomUUID().toString();
        PaymentCalculator calculator = new PaymentCalculator(rules);
        Analysis analysis = new Analysis(analysisId, submission.userId(), fingerprint, AnalysisSource.MANUAL,
                submission.period(), rules.version(), clock);
        reconciliationService.buildManualEntries(analysisId, submission.entries(), calculator)
                .forEach(analysis::addDailyEntry);

        ValidationReport none = new ValidationReport(List.<ValidationIssue>of(), List.<ValidationIssue>of());
        return complete(analysis, calculator, comparison, none, List.of(), null);
    }

    /**
     * Reads the user's history. An unavailable history degrades to an empty one.
     *
     * @param userId user whose submissions are needed
     * @return earlier submissions, possibly empty
     */
    List<PriorSubmission> loadPriors(String userId) {
        try {
            return submissionHistory.listPriorSubmissions(userId);
        } catch (HistoryUnavailableException ex) {
            log.warn("Submission history unavailable for {}; duplicate detection skipped: {}", userId, ex.getMessage());
            return List.of();
        }
    }

    private AnalysisReport complete(Analysis analysis,
                                    PaymentCalculator calculator,
                                    FingerprintComparison comparison,
                                    ValidationReport fileSetReport,
                                    List<FileMetadata> files,
                                    ProcessingResult processing) {
        ValidationReport validation = fileSetReport.merge(validationService.validateAnalysis(analysis));
        analysis.updateStatus(validation.valid() ? AnalysisStatus.COMPLETED : AnalysisStatus.ERROR);
        remember(analysis, comparison, files);

        List<DailyEntry> entries = analysis.getDailyEntries();
        log.info("Analysis {} for {} covers {} with {} entries ({})", analysis.getId(), analysis.getUserId(),
                analysis.getPeriod().formatRange(), entries.size(), comparison.verdict());
        return new AnalysisReport(
                analysis.getId(),
                analysis.getUserId(),
                analysis.getSource(),
                analysis.getPeriod(),
                analysis.getRulesVersion(),
                analysis.getFingerprint(),
                comparison,
                entries.stream().map(DailyEntry::toSnapshot).toList(),
                calculator.calculateWeeklyStats(entries),
                analysis.getOverallStatus(),
                validation,
                processing);
    }

    private void remember(Analysis analysis, FingerprintComparison comparison, List<FileMetadata> files) {
        if (comparison.verdict() == FingerprintVerdict.DUPLICATE || comparison.verdict() == FingerprintVerdict.UNCHANGED) {
            log.debug("Submission for analysis {} matches {}; not recorded", analysis.getId(), comparison.matchedAnalysisId());
            return;
        }
        try {
            submissionHistory.record(new PriorSubmission(analysis.getId(), analysis.getUserId(),
                    analysis.getFingerprint(), files, clock.instant()));
        } catch (HistoryUnavailableException ex) {
            log.warn("Submission for analysis {} not recorded: {}", analysis.getId(), ex.getMessage());
        }
    }

    private static ProcessingResult await(CompletableFuture<ProcessingResult> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }
}
