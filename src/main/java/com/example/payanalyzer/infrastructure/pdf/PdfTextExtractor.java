package com.example.payanalyzer.infrastructure.pdf;

import com.example.payanalyzer.domain.model.ExtractedText;
import com.example.payanalyzer.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure component that turns PDF bytes into per-page text with PDFBox.
 * Hides the PDFBox loading and stripping details from the extractors.
 */
@Component
public class PdfTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    private final PdfDocumentInfoReader documentInfoReader;

    /**
     * Creates the extractor.
     *
     * @param documentInfoReader reader for document-level facts
     */
    public PdfTextExtractor(PdfDocumentInfoReader documentInfoReader) {
        this.documentInfoReader = documentInfoReader;
    }

    /**
     * Loads the PDF once and reads its text page by page together with its document info.
     *
     * @param content  PDF bytes
     * @param fileName logical name used in log and error messages
     * @return page text and document info
     * @throws PdfProcessingException when PDFBox cannot read the bytes
     */
    public PdfContent extract(byte[] content, String fileName) {
        try (PDDocument document = Loader.loadPDF(content)) {
            ExtractedText text = extractPages(document);
            log.debug("Extracted {} page(s) of text from {}", text.pages().size(), fileName);
            return new PdfContent(text, documentInfoReader.read(document));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read PDF file " + fileName + ".", e);
        }
    }

    /**
     * Strips every page separately so page boundaries survive for page-oriented extractors.
     *
     * @param document loaded PDF document
     * @return text per page
     * @throws IOException when PDFBox cannot read the page content
     */
    ExtractedText extractPages(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        configureStripper(stripper);
        List<String> pages = new ArrayList<>();
        for (int page = 1; page <= document.getNumberOfPages(); page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            pages.add(stripper.getText(document));
        }
        return ExtractedText.ofPages(pages);
    }

    /**
     * Applies the stripper configuration shared by all extraction routines.
     *
     * @param stripper stripper to configure
     */
    private void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.setLineSeparator("\n");
        stripper.setWordSeparator(" ");
    }
}
