package com.example.payanalyzer.interfaces.api;

import com.example.payanalyzer.application.exception.UseCaseValidationException;
import com.example.payanalyzer.application.service.AnalysisReport;
import com.example.payanalyzer.application.service.AnalysisService;
import com.example.payanalyzer.application.service.PaymentRulesFactory;
import com.example.payanalyzer.application.service.ReconciliationService;
import com.example.payanalyzer.application.worker.ProcessingProgressListener;
import com.example.payanalyzer.domain.model.DailyEntry;
import com.example.payanalyzer.domain.model.DailyEntrySnapshot;
import com.example.payanalyzer.domain.model.DateRange;
import com.example.payanalyzer.domain.model.FingerprintComparison;
import com.example.payanalyzer.domain.model.FingerprintResult;
import com.example.payanalyzer.domain.model.ManualEntry;
import com.example.payanalyzer.domain.model.ManualSubmission;
import com.example.payanalyzer.domain.model.MergeStrategy;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.PaymentRules;
import com.example.payanalyzer.domain.model.ProcessingResult;
import com.example.payanalyzer.domain.model.UploadedPdf;
import com.example.payanalyzer.domain.model.ValidationReport;
import com.example.payanalyzer.domain.model.WeeklyStats;
import com.example.payanalyzer.domain.service.FileFingerprintService;
import com.example.payanalyzer.domain.service.PaymentCalculator;
import com.example.payanalyzer.domain.service.ValidationService;
import com.example.payanalyzer.interfaces.api.dto.CompareFingerprintRequest;
import com.example.payanalyzer.interfaces.api.dto.DailyPaymentRequest;
import com.example.payanalyzer.interfaces.api.dto.DayInput;
import com.example.payanalyzer.interfaces.api.dto.FingerprintResponse;
import com.example.payanalyzer.interfaces.api.dto.ManualEntryPayload;
import com.example.payanalyzer.interfaces.api.dto.ManualSubmissionRequest;
import com.example.payanalyzer.interfaces.api.dto.MergePaymentsRequest;
import com.example.payanalyzer.interfaces.api.dto.Payloads;
import com.example.payanalyzer.interfaces.api.dto.RulesPayload;
import com.example.payanalyzer.interfaces.api.dto.WeeklyStatsRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interfaces-layer REST controller exposing extraction, payment calculation and fingerprinting.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class AnalysisApiController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisApiController.class);
    private static final String ANONYMOUS_USER = "anonymous";

    private final AnalysisService analysisService;
    private final PaymentRulesFactory rulesFactory;
    private final ReconciliationService reconciliationService;
    private final FileFingerprintService fingerprintService;
    private final ValidationService validationService;

    /**
     * Creates the controller with the required application services.
     *
     * @param analysisService       upload and manual analyses
     * @param rulesFactory          validated rule sets from request amounts
     * @param reconciliationService paid amount merging
     * @param fingerprintService    submission fingerprints
     * @param validationService     rule set checks
     */
    public AnalysisApiController(AnalysisService analysisService,
                                 PaymentRulesFactory rulesFactory,
                                 ReconciliationService reconciliationService,
                                 FileFingerprintService fingerprintService,
                                 ValidationService validationService) {
        this.analysisService = analysisService;
        this.rulesFactory = rulesFactory;
        this.reconciliationService = reconciliationService;
        this.fingerprintService = fingerprintService;
        this.validationService = validationService;
    }

    /**
     * Extracts runsheet and invoice data from a batch of PDFs.
     *
     * @param files        uploaded PDFs
     * @param lastModified client-side timestamps in epoch milliseconds, by position (optional)
     * @param userId       submitting user (optional)
     * @return batch result
     */
    @PostMapping(value = "/files/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProcessingResult> parseFiles(@RequestParam("files") List<MultipartFile> files,
                                                       @RequestParam(value = "lastModified", required = false) List<Long> lastModified,
                                                       @RequestParam(value = "userId", required = false) String userId) {
        List<UploadedPdf> uploads = UploadedFiles.toUploadedPdfs(files, lastModified);
        ProcessingProgressListener progress = event -> log.debug("Request {}: {}/{} ({}%) {}", event.requestId(),
                event.current(), event.total(), event.percentage(), event.currentFile());
        return ResponseEntity.ok(analysisService.parseFiles(resolveUser(userId), uploads, progress));
    }

    /**
     * Runs a full analysis over uploaded runsheets and invoices.
     */
    @PostMapping(value = "/analyses", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AnalysisReport> analyzeUpload(@RequestParam("files") List<MultipartFile> files,
                                                        @RequestParam(value = "lastModified", required = false) List<Long> lastModified,
                                                        @RequestParam(value = "userId", required = false) String userId,
                                                        @RequestParam(value = "weekdayRate", required = false) BigDecimal weekdayRate,
                                                        @RequestParam(value = "saturdayRate", required = false) BigDecimal saturdayRate,
                                                        @RequestParam(value = "unloadingBonus", required = false) BigDecimal unloadingBonus,
                                                        @RequestParam(value = "attendanceBonus", required = false) BigDecimal attendanceBonus,
                                                        @RequestParam(value = "earlyBonus", required = false) BigDecimal earlyBonus) {
        String user = resolveUser(userId);
        PaymentRules rules = rulesFactory.create(user, weekdayRate, saturdayRate, unloadingBonus, attendanceBonus, earlyBonus);
        return ResponseEntity.ok(analysisService.analyzeUpload(user, UploadedFiles.toUploadedPdfs(files, lastModified), rules));
    }

    @PostMapping(value = "/analyses/manual", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<AnalysisReport> analyzeManual(@RequestBody ManualSubmissionRequest request) {
        ManualSubmission submission = toManualSubmission(request);
        PaymentRules rules = toRules(submission.userId(), request.rules());
        return ResponseEntity.ok(analysisService.analyzeManual(submission, rules));
    }

    /**
     * Calculates the expected payment for one day and reconciles it with the paid amount.
     *
     * @param request rules and day figures
     * @return snapshot of the computed entry
     */
    @PostMapping(value = "/payments/daily", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DailyEntrySnapshot> calculateDaily(@RequestBody DailyPaymentRequest request) {
        if (request.day() == null || request.day().date() == null) {
            throw new UseCaseValidationException("A day with a date is required.");
        }
        PaymentCalculator calculator = new PaymentCalculator(toRules(resolveUser(request.userId()), request.rules()));
        return ResponseEntity.ok(toEntry(calculator, request.analysisId(), request.day()).toSnapshot());
    }

    @PostMapping(value = "/payments/weekly-stats", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WeeklyStats> calculateWeeklyStats(@RequestBody WeeklyStatsRequest request) {
        PaymentCalculator calculator = new PaymentCalculator(toRules(resolveUser(request.userId()), request.rules()));
        List<DailyEntry> entries = new ArrayList<>();
        for (DayInput day : request.days() != null ? request.days() : List.<DayInput>of()) {
            if (day.date() == null) {
                throw new UseCaseValidationException("Every day requires a date.");
            }
            entries.add(toEntry(calculator, null, day));
        }
        return ResponseEntity.ok(calculator.calculateWeeklyStats(entries));
    }

    /**
     * Applies newly extracted invoice amounts to existing entries.
     *
     * @param request entries, incoming amounts and merge strategy
     * @return updated entries
     */
    @PostMapping(value = "/payments/merge", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<DailyEntrySnapshot>> mergePayments(@RequestBody MergePaymentsRequest request) {
        List<DailyEntry> entries = (request.entries() != null ? request.entries() : List.<DailyEntrySnapshot>of())
                .stream()
                .map(DailyEntry::fromSnapshot)
                .toList();
        Map<LocalDate, List<Money>> incoming = new LinkedHashMap<>();
        if (request.incoming() != null) {
            request.incoming().forEach((date, amounts) -> incoming.put(date, amounts.stream().map(Money::of).toList()));
        }
        MergeStrategy strategy = request.strategy() != null ? request.strategy() : MergeStrategy.SMART;
        reconciliationService.mergePaidAmounts(entries, incoming, strategy);
        return ResponseEntity.ok(entries.stream().map(DailyEntry::toSnapshot).toList());
    }

    @PostMapping(value = "/rules/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ValidationReport> validateRules(@RequestBody RulesPayload request) {
        RulesPayload payload = request != null ? request : RulesPayload.DEFAULTS;
        PaymentRules rules = rulesFactory.build(ANONYMOUS_USER, payload.weekdayRate(), payload.saturdayRate(),
                payload.unloadingBonus(), payload.attendanceBonus(), payload.earlyBonus());
        return ResponseEntity.ok(validationService.validatePaymentRules(rules));
    }

    /**
     * Fingerprints a file set.
     *
     * @param files        uploaded files
     * @param lastModified client-side timestamps in epoch milliseconds, by position (optional)
     * @return fingerprint, per-file hashes and set metadata
     */
    @PostMapping(value = "/fingerprints/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<FingerprintResult> fingerprintFiles(@RequestParam("files") List<MultipartFile> files,
                                                              @RequestParam(value = "lastModified", required = false) List<Long> lastModified) {
        List<UploadedPdf> uploads = UploadedFiles.toUploadedPdfs(files, lastModified);
        return ResponseEntity.ok(fingerprintService.createFingerprint(uploads.stream().map(UploadedPdf::toFileInfo).toList()));
    }

    @PostMapping(value = "/fingerprints/manual", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FingerprintResponse> fingerprintManual(@RequestBody ManualSubmissionRequest request) {
        return ResponseEntity.ok(new FingerprintResponse(fingerprintService.createManualFingerprint(toManualSubmission(request))));
    }

    @PostMapping(value = "/fingerprints/compare", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FingerprintComparison> compareFingerprint(@RequestBody CompareFingerprintRequest request) {
        if (request.fingerprint() == null || request.fingerprint().isBlank()) {
            throw new UseCaseValidationException("A fingerprint is required.");
        }
        return ResponseEntity.ok(fingerprintService.compareFingerprint(request.fingerprint(),
                request.files() != null ? request.files() : List.of(),
                request.priors() != null ? request.priors() : List.of()));
    }

    private PaymentRules toRules(String userId, RulesPayload payload) {
        RulesPayload rules = payload != null ? payload : RulesPayload.DEFAULTS;
        return rulesFactory.create(userId, rules.weekdayRate(), rules.saturdayRate(), rules.unloadingBonus(),
                rules.attendanceBonus(), rules.earlyBonus());
    }

    private static DailyEntry toEntry(PaymentCalculator calculator, String analysisId, DayInput day) {
        return calculator.calculateDailyPayment(analysisId, day.date(), Payloads.count(day.consignments()),
                Payloads.count(day.pickups()), Payloads.money(day.pickupTotal()), Payloads.money(day.paidAmount()));
    }

    private static ManualSubmission toManualSubmission(ManualSubmissionRequest request) {
        if (request.start() == null || request.end() == null) {
            throw new UseCaseValidationException("A period start and end are required.");
        }
        List<ManualEntry> entries = (request.entries() != null ? request.entries() : List.<ManualEntryPayload>of())
                .stream()
                .map(entry -> {
                    if (entry.date() == null) {
                        throw new UseCaseValidationException("Every manual entry requires a date.");
                    }
                    return new ManualEntry(entry.date(), Payloads.count(entry.consignments()), Payloads.money(entry.paidAmount()));
                })
                .toList();
        return new ManualSubmission(resolveUser(request.userId()), DateRange.of(request.start(), request.end()), entries);
    }

    private static String resolveUser(String userId) {
        return userId == null || userId.isBlank() ? ANONYMOUS_USER : userId;
    }
}
