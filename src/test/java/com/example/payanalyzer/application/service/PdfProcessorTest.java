package com.example.payanalyzer.application.service;

import com.example.payanalyzer.application.config.AnalyzerProperties;
import com.example.payanalyzer.application.parser.InvoiceParser;
import com.example.payanalyzer.application.parser.RunsheetParser;
import com.example.payanalyzer.domain.exception.UnsupportedPdfFormatException;
import com.example.payanalyzer.domain.model.DocumentType;
import com.example.payanalyzer.domain.model.ExtractedText;
import com.example.payanalyzer.domain.model.FileError;
import com.example.payanalyzer.domain.model.FileValidationOptions;
import com.example.payanalyzer.domain.model.InvoiceRecord;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.ParseOutcome;
import com.example.payanalyzer.domain.model.ProcessedFile;
import com.example.payanalyzer.domain.model.ProcessingResult;
import com.example.payanalyzer.domain.model.RunsheetRecord;
import com.example.payanalyzer.domain.model.UploadedPdf;
import com.example.payanalyzer.domain.model.ValidationIssue;
import com.example.payanalyzer.domain.model.ValidationReport;
import com.example.payanalyzer.domain.service.FileValidationService;
import com.example.payanalyzer.infrastructure.pdf.PdfDocumentInfoReader;
import com.example.payanalyzer.infrastructure.pdf.PdfTextExtractor;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.example.payanalyzer.TestPdfs.createPdf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Batch processing tests running real PDFBox extraction over generated PDFs.
 */
class PdfProcessorTest {

    private static final String RUNSHEET_TEXT = """
            Runsheet DV_0427
            Date: 01/07/2025
            1 1234567 Delivery Mill Road
            2 7654321 Delivery Park Lane""";

    private static final String INVOICE_TEXT = """
            Self Bill Invoice
            01/07/25 08:15 Standard 45.50
            01/07/25 12:00 -PickUp Parcel 5.00""";

    private final Clock clock = Clock.fixed(Instant.parse("2025-07-09T12:00:00Z"), ZoneOffset.UTC);

    private final PdfProcessor processor = new PdfProcessor(
            new FileValidationService(FileValidationOptions.defaults()),
            new PdfTextExtractor(new PdfDocumentInfoReader()),
            new RunsheetParser(200, clock),
            new InvoiceParser(Money.of(3), Money.of(500), Money.of(500)),
            new AnalyzerProperties());

    private record Event(int current, int total, String file) {
    }

    private static UploadedPdf pdf(String name, byte[] content) {
        return new UploadedPdf(name, "application/pdf", 1_000L, content);
    }

    /**
     * Verifies that runsheets and invoices are classified by name and content and extracted.
     *
     * @throws Exception when the sample PDFs cannot be created
     */
    @Test
    void processesRunsheetAndInvoice() throws Exception {
        List<Event> events = new ArrayList<>();
        List<UploadedPdf> files = List.of(
                pdf("DV_0427.pdf", createPdf(RUNSHEET_TEXT)),
                pdf("Self Bill 0427.pdf", createPdf(INVOICE_TEXT)));

        ProcessingResult result = processor.processFiles(files, List.of(),
                (current, total, file) -> events.add(new Event(current, total, file)));

        assertThat(result.errors()).isEmpty();
        assertThat(result.validation().isValid()).isTrue();
        assertThat(result.summary().totalFiles()).isEqualTo(2);
        assertThat(result.summary().successfulFiles()).isEqualTo(2);
        assertThat(result.summary().failedFiles()).isZero();
        assertThat(result.fileMetadata()).allSatisfy(metadata -> assertThat(metadata.hash()).hasSize(64));

        ProcessedFile runsheet = result.runsheets().get(0);
        assertThat(runsheet.inferred()).isFalse();
        assertThat(runsheet.documentInfo().pageCount()).isEqualTo(1);
        assertThat(runsheet.runsheet()).hasValueSatisfying(record -> {
            assertThat(record.dates()).containsExactly(LocalDate.of(2025, 7, 1));
            assertThat(record.totalConsignments()).isEqualTo(2);
        });

        ProcessedFile invoice = result.invoices().get(0);
        assertThat(invoice.invoice()).hasValueSatisfying(record -> {
            assertThat(record.computedTotal()).isEqualTo(Money.of(50.50));
            assertThat(record.pickupServices()).hasSize(1);
        });

        assertThat(events).containsExactly(
                new Event(0, 2, null),
                new Event(1, 2, "DV_0427.pdf"),
                new Event(2, 2, "Self Bill 0427.pdf"));
    }

    @Test
    void invalidBatchReportsEveryErrorAgainstEveryFile() throws Exception {
        List<Event> events = new ArrayList<>();
        List<UploadedPdf> files = List.of(
                pdf("DV_0427.pdf", createPdf(RUNSHEET_TEXT)),
                pdf("fake.pdf", "not a pdf".getBytes(StandardCharsets.US_ASCII)));

        ProcessingResult result = processor.processFiles(files, List.of(),
                (current, total, file) -> events.add(new Event(current, total, file)));

        assertThat(result.files()).isEmpty();
        assertThat(result.validation().isValid()).isFalse();
        assertThat(result.errors()).extracting(FileError::fileName).containsExactly("DV_0427.pdf", "fake.pdf");
        assertThat(result.errors()).extracting(FileError::message)
                .containsOnly("File \"fake.pdf\" is not a valid PDF file");
        assertThat(result.summary().failedFiles()).isEqualTo(2);
        assertThat(result.fileMetadata()).hasSize(2);
        assertThat(events).containsExactly(new Event(2, 2, null));
    }

    /**
     * Verifies that a listener throwing on every event does not cut the batch short.
     *
     * @throws Exception when the sample PDFs cannot be created
     */
    @Test
    void failingListenerDoesNotStopTheBatch() throws Exception {
        List<Event> attempts = new ArrayList<>();
        List<UploadedPdf> files = List.of(
                pdf("DV_0427.pdf", createPdf(RUNSHEET_TEXT)),
                pdf("Self Bill 0427.pdf", createPdf(INVOICE_TEXT)));

        ProcessingResult result = processor.processFiles(files, List.of(), (current, total, file) -> {
            attempts.add(new Event(current, total, file));
            throw new IllegalStateException("listener gone");
        });

        assertThat(result.errors()).isEmpty();
        assertThat(result.summary().successfulFiles()).isEqualTo(2);
        assertThat(attempts).extracting(Event::current).containsExactly(0, 1, 2);
    }

    @Test
    void untypedFileFailsBatchValidation() {
        List<Event> events = new ArrayList<>();
        UploadedPdf untyped = new UploadedPdf("scan", null, 0L, "%PDF-1.7 x".getBytes(StandardCharsets.US_ASCII));

        ProcessingResult result = processor.processFiles(List.of(untyped), List.of(),
                (current, total, file) -> events.add(new Event(current, total, file)));

        assertThat(result.validation().isValid()).isFalse();
        assertThat(result.files()).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.fileName()).isEqualTo("scan");
            assertThat(error.message()).isEqualTo("File \"scan\" has invalid type (unknown). Allowed types: application/pdf");
        });
        assertThat(events).containsExactly(new Event(1, 1, null));
    }

    /**
     * A file that neither name nor preview identifies is parsed both ways.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void unidentifiedFileIsInferredFromBothExtractions() throws Exception {
        ProcessingResult result = processor.processFiles(List.of(
                pdf("scan.pdf", createPdf("01/07/25 08:15 Standard 45.50"))));

        ProcessedFile file = result.files().get(0);
        assertThat(file.type()).isEqualTo(DocumentType.INVOICE);
        assertThat(file.inferred()).isTrue();
        assertThat(file.isSuccess()).isTrue();
        assertThat(result.summary().inferredCount()).isEqualTo(1);
        assertThat(processor.validateFileSet(result).warnings())
                .extracting(ValidationIssue::code)
                .containsExactly("NO_RUNSHEETS", "INFERRED_CLASSIFICATIONS");
    }

    @Test
    void unreadablePdfBecomesFileError() {
        ProcessingResult result = processor.processFiles(List.of(
                pdf("DV_broken.pdf", "%PDF-1.7 truncated".getBytes(StandardCharsets.US_ASCII))));

        assertThat(result.files()).isEmpty();
        assertThat(result.errors()).singleElement()
                .satisfies(error -> assertThat(error.message()).isEqualTo("Unable to read PDF file DV_broken.pdf."));

        ValidationReport report = processor.validateFileSet(result);
        assertThat(report.valid()).isFalse();
        assertThat(report.errors()).extracting(ValidationIssue::code).containsExactly("NO_PARSEABLE_FILES");
    }

    @Test
    void failedRunsheetIsCountedAndReported() throws Exception {
        ProcessingResult result = processor.processFiles(List.of(
                pdf("runsheet.pdf", createPdf("Runsheet\nNo jobs today"))));

        assertThat(result.summary().successfulFiles()).isZero();
        assertThat(result.summary().runsheetCount()).isEqualTo(1);
        assertThat(result.runsheets().get(0).outcome().error()).isEqualTo("No dates found in runsheet");
        assertThat(processor.validateFileSet(result).warnings())
                .extracting(ValidationIssue::code)
                .contains("RUNSHEET_PARSE_FAILURES", "NO_INVOICES");
    }

    @Test
    void nonPdfContentTypeIsRejected() {
        UploadedPdf text = new UploadedPdf("note.txt", "text/plain", 0L, "hello".getBytes(StandardCharsets.US_ASCII));

        assertThrows(UnsupportedPdfFormatException.class, () -> processor.processFile(text, text.toMetadata("h")));
    }

    @Test
    void chooseOutcomePrefersSuccessThenDataPoints() {
        ParseOutcome<RunsheetRecord> runsheetFailure = ParseOutcome.failure("none", List.of(), ExtractedText.EMPTY);
        ParseOutcome<InvoiceRecord> invoiceFailure = ParseOutcome.failure("none", List.of(), ExtractedText.EMPTY);
        ParseOutcome<RunsheetRecord> runsheet = ParseOutcome.success(
                new RunsheetRecord(List.of(), 2), List.of(), ExtractedText.EMPTY);
        ParseOutcome<InvoiceRecord> invoice = ParseOutcome.success(
                new InvoiceRecord(List.of(), List.of(), List.of(), null, Money.ZERO, null, "", List.of()),
                List.of(), ExtractedText.EMPTY);

        assertThat(PdfProcessor.chooseOutcome(runsheetFailure, invoice)).isSameAs(invoice);
        assertThat(PdfProcessor.chooseOutcome(runsheet, invoiceFailure)).isSameAs(runsheet);
        assertThat(PdfProcessor.chooseOutcome(runsheet, invoice)).isSameAs(runsheet);
        assertThat(PdfProcessor.chooseOutcome(runsheetFailure, invoiceFailure)).isSameAs(runsheetFailure);
    }
}
