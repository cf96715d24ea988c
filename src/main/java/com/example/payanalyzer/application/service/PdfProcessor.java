package com.example.payanalyzer.application.service;

import com.example.payanalyzer.application.config.AnalyzerProperties;
import com.example.payanalyzer.application.parser.InvoiceParser;
import com.example.payanalyzer.application.parser.RunsheetParser;
import com.example.payanalyzer.domain.exception.UnsupportedPdfFormatException;
import com.example.payanalyzer.domain.model.DocumentType;
import com.example.payanalyzer.domain.model.ExtractedDocument;
import com.example.payanalyzer.domain.model.ExtractedText;
import com.example.payanalyzer.domain.model.FileError;
import com.example.payanalyzer.domain.model.FileMetadata;
import com.example.payanalyzer.domain.model.FileValidationResult;
import com.example.payanalyzer.domain.model.InvoiceRecord;
import com.example.payanalyzer.domain.model.ParseOutcome;
import com.example.payanalyzer.domain.model.PriorSubmission;
import com.example.payanalyzer.domain.model.ProcessedFile;
import com.example.payanalyzer.domain.model.ProcessingResult;
import com.example.payanalyzer.domain.model.ProcessingSummary;
import com.example.payanalyzer.domain.model.RunsheetRecord;
import com.example.payanalyzer.domain.model.UploadedPdf;
import com.example.payanalyzer.domain.model.ValidationIssue;
import com.example.payanalyzer.domain.model.ValidationReport;
import com.example.payanalyzer.domain.service.FileValidationService;
import com.example.payanalyzer.domain.service.Sha256;
import com.example.payanalyzer.infrastructure.pdf.PdfContent;
import com.example.payanalyzer.infrastructure.pdf.PdfTextExtractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Application-layer service that turns a batch of uploaded PDFs into extracted runsheet and
 * invoice data. It validates the batch, classifies each file and delegates to the extractors.
 * One bad file never aborts the batch.
 */
@Service
public class PdfProcessor {

    private static final Logger log = LoggerFactory.getLogger(PdfProcessor.class);
    private static final String PDF_CONTENT_TYPE = "application/pdf";

    private final FileValidationService fileValidationService;
    private final PdfTextExtractor textExtractor;
    private final RunsheetParser runsheetParser;
    private final InvoiceParser invoiceParser;
    private final int previewLength;

    /**
     * Creates the processor with its collaborators.
     *
     * @param fileValidationService batch validation
     * @param textExtractor         PDFBox backed text extraction
     * @param runsheetParser        runsheet extractor
     * @param invoiceParser         invoice extractor
     * @param properties            extraction settings
     */
    public PdfProcessor(FileValidationService fileValidationService,
                        PdfTextExtractor textExtractor,
                        RunsheetParser runsheetParser,
                        InvoiceParser invoiceParser,
                        AnalyzerProperties properties) {
        this.fileValidationService = fileValidationService;
        this.textExtractor = textExtractor;
        this.runsheetParser = runsheetParser;
        this.invoiceParser = invoiceParser;
        this.previewLength = properties.getExtraction().getPreviewLength();
    }

    public ProcessingResult processFiles(List<UploadedPdf> files) {
        return processFiles(files, List.of(), ProgressListener.NONE);
    }

    /**
     * Processes a batch in submission order.
     *
     * @param files    uploaded files
     * @param priors   earlier submissions used for update and duplicate detection
     * @param listener progress callback, invoked on the calling thread
     * @return per-file outcomes, errors, counters and the batch validation outcome
     */
    public ProcessingResult processFiles(List<UploadedPdf> files, List<PriorSubmission> priors, ProgressListener listener) {
        List<UploadedPdf> batch = files != null ? files : List.of();
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        FileValidationResult validation = fileValidationService.validateFiles(batch, priors != null ? priors : List.of());
        List<FileMetadata> fileMetadata = batch.stream()
                .map(file -> file.toMetadata(Sha256.hex(file.content())))
                .toList();

        List<ProcessedFile> processed = new ArrayList<>();
        List<FileError> errors = new ArrayList<>();

        if (!validation.isValid()) {
            log.info("Batch of {} file(s) rejected: {}", batch.size(), validation.errors());
            for (UploadedPdf file : batch) {
                validation.errors().forEach(error -> errors.add(new FileError(file.name(), error)));
            }
            report(progress, batch.size(), batch.size(), null);
            return new ProcessingResult(processed, errors, summarize(batch.size(), processed), validation, fileMetadata);
        }

        report(progress, 0, batch.size(), null);
        for (int i = 0; i < batch.size(); i++) {
            UploadedPdf file = batch.get(i);
            try {
                processed.add(processFile(file, fileMetadata.get(i)));
            } catch (RuntimeException ex) {
                log.warn("Failed to process {}", file.name(), ex);
                errors.add(new FileError(file.name(), ex.getMessage() != null ? ex.getMessage() : "Unknown error"));
            }
            report(progress, i + 1, batch.size(), file.name());
        }

        ProcessingSummary summary = summarize(batch.size(), processed);
        log.info("Processed {} file(s): {} succeeded, {} failed", summary.totalFiles(),
                summary.successfulFiles(), summary.failedFiles());
        return new ProcessingResult(processed, errors, summary, validation, fileMetadata);
    }

    /**
     * A failing listener never stops the batch.
     */
    private static void report(ProgressListener progress, int current, int total, String currentFile) {
        try {
            progress.onProgress(current, total, currentFile);
        } catch (RuntimeException ex) {
            log.warn("Progress listener failed at {}/{}", current, total, ex);
        }
    }

    /**
     * Checks whether a processed batch is usable for an analysis.
     *
     * @param result batch result
     * @return errors when nothing usable was produced, warnings for gaps
     */
    public ValidationReport validateFileSet(ProcessingResult result) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        List<ProcessedFile> runsheets = result.runsheets();
        List<ProcessedFile> invoices = result.invoices();

        if (runsheets.isEmpty() && invoices.isEmpty() && result.summary().totalFiles() > 0) {
            errors.add(ValidationIssue.of("NO_PARSEABLE_FILES",
                    "No valid runsheet or invoice files could be processed. Please check your file formats."));
        }
        if (runsheets.isEmpty()) {
            warnings.add(ValidationIssue.of("NO_RUNSHEETS",
                    "No runsheet files found. Consignment counts will need to be entered manually."));
        }
        if (invoices.isEmpty()) {
            warnings.add(ValidationIssue.of("NO_INVOICES",
                    "No invoice files found. Paid amounts will default to £0.00 for payment reconciliation."));
        }
        long failedRunsheets = runsheets.stream().filter(file -> !file.isSuccess()).count();
        if (failedRunsheets > 0) {
            warnings.add(new ValidationIssue("RUNSHEET_PARSE_FAILURES",
                    failedRunsheets + " runsheet(s) failed to parse correctly.", "runsheets", failedRunsheets));
        }
        long failedInvoices = invoices.stream().filter(file -> !file.isSuccess()).count();
        if (failedInvoices > 0) {
            warnings.add(new ValidationIssue("INVOICE_PARSE_FAILURES",
                    failedInvoices + " invoice(s) failed to parse correctly.", "invoices", failedInvoices));
        }
        int inferred = result.summary().inferredCount();
        if (inferred > 0) {
            warnings.add(new ValidationIssue("INFERRED_CLASSIFICATIONS",
                    inferred + " file(s) were classified by trying both extractors.", "files", inferred));
        }
        return new ValidationReport(errors, warnings);
    }

    /**
     * Extracts text once, then classifies and parses a single file.
     *
     * @param file     uploaded file
     * @param metadata metadata including the content hash
     * @return outcome for the file
     * @throws UnsupportedPdfFormatException when the declared type is not a PDF
     */
    ProcessedFile processFile(UploadedPdf file, FileMetadata metadata) {
        if (!PDF_CONTENT_TYPE.equalsIgnoreCase(file.contentType())) {
            throw new UnsupportedPdfFormatException(file.name());
        }
        PdfContent content = textExtractor.extract(file.content(), file.name());
        ExtractedText text = content.text();
        String preview = text.firstPagePreview(previewLength);
        if (preview.isBlank()) {
            preview = file.name();
        }

        String id = UUID.randomUUID().toString();
        if (runsheetParser.canParse(file.name(), preview)) {
            return new ProcessedFile(id, metadata, DocumentType.RUNSHEET, false,
                    runsheetParser.parse(text, file.name()), content.documentInfo());
        }
        if (invoiceParser.canParse(file.name(), preview)) {
            return new ProcessedFile(id, metadata, DocumentType.INVOICE, false,
                    invoiceParser.parse(text, file.name()), content.documentInfo());
        }

        ParseOutcome<RunsheetRecord> runsheet = runsheetParser.parse(text, file.name());
        ParseOutcome<InvoiceRecord> invoice = invoiceParser.parse(text, file.name());
        ParseOutcome<? extends ExtractedDocument> chosen = chooseOutcome(runsheet, invoice);
        DocumentType type = chosen == invoice ? DocumentType.INVOICE : DocumentType.RUNSHEET;
        log.debug("{} classified as {} by comparing both extractions", file.name(), type);
        return new ProcessedFile(id, metadata, type, true, chosen, content.documentInfo());
    }

    /**
     * A success beats a failure; two successes are compared by data points, ties and double
     * failures go to the runsheet.
     */
    static ParseOutcome<? extends ExtractedDocument> chooseOutcome(ParseOutcome<RunsheetRecord> runsheet,
                                                                   ParseOutcome<InvoiceRecord> invoice) {
        if (runsheet.success() && invoice.success()) {
            return runsheet.dataPoints() >= invoice.dataPoints() ? runsheet : invoice;
        }
        if (invoice.success()) {
            return invoice;
        }
        return runsheet;
    }

    private static ProcessingSummary summarize(int totalFiles, List<ProcessedFile> processed) {
        int successful = (int) processed.stream().filter(ProcessedFile::isSuccess).count();
        int runsheets = 0;
        int successfulRunsheets = 0;
        int invoices = 0;
        int successfulInvoices = 0;
        int inferred = 0;
        for (ProcessedFile file : processed) {
            if (file.type() == DocumentType.RUNSHEET) {
                runsheets++;
                successfulRunsheets += file.isSuccess() ? 1 : 0;
            } else {
                invoices++;
                successfulInvoices += file.isSuccess() ? 1 : 0;
            }
            inferred += file.inferred() ? 1 : 0;
        }
        return new ProcessingSummary(totalFiles, successful, totalFiles - successful, runsheets, successfulRunsheets,
                invoices, successfulInvoices, inferred);
    }
}
