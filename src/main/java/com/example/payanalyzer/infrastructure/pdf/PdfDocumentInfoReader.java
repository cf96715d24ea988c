package com.example.payanalyzer.infrastructure.pdf;

import com.example.payanalyzer.domain.model.PdfDocumentInfo;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.List;

/**
 * Reads document-level facts from a loaded PDF. Values missing from the info dictionary are
 * taken from the XMP packet when one is present.
 */
@Component
public class PdfDocumentInfoReader {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentInfoReader.class);
    private static final DateTimeFormatter CALENDAR_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    /**
     * Maps the info dictionary and XMP metadata of a document.
     *
     * @param document already opened PDF document
     * @return document info or {@code null} when the source is missing
     */
    public PdfDocumentInfo read(PDDocument document) {
        if (document == null) {
            return null;
        }
        PDDocumentInformation info = document.getDocumentInformation();
        XmpValues xmp = readXmp(document.getDocumentCatalog());

        return new PdfDocumentInfo(
                document.getNumberOfPages(),
                String.valueOf(document.getVersion()),
                document.isEncrypted(),
                firstNonBlank(info != null ? info.getTitle() : null, xmp.title()),
                firstNonBlank(info != null ? info.getAuthor() : null, xmp.creators()),
                info != null ? info.getProducer() : null,
                firstNonBlank(info != null ? info.getCreator() : null, xmp.creatorTool()),
                firstNonBlank(info != null ? formatCalendar(info.getCreationDate()) : null, xmp.createDate()),
                info != null ? formatCalendar(info.getModificationDate()) : null
        );
    }

    /**
     * Subset of the XMP packet used as fallback.
     */
    private record XmpValues(String title, String creators, String creatorTool, String createDate) {
        static final XmpValues NONE = new XmpValues(null, null, null, null);
    }

    /**
     * Parses the XMP packet leniently.
     *
     * @param catalog document catalog supplied by PDFBox
     * @return parsed values, {@link XmpValues#NONE} when missing or unreadable
     */
    private XmpValues readXmp(PDDocumentCatalog catalog) {
        if (catalog == null) {
            return XmpValues.NONE;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        if (pdMetadata == null) {
            return XmpValues.NONE;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return XmpValues.NONE;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            DublinCoreSchema dc = xmp.getDublinCoreSchema();
            XMPBasicSchema basic = xmp.getXMPBasicSchema();

            List<String> creators = dc != null && dc.getCreators() != null ? dc.getCreators() : List.of();
            return new XmpValues(
                    dc != null ? dc.getTitle() : null,
                    creators.isEmpty() ? null : String.join(", ", creators),
                    basic != null ? basic.getCreatorTool() : null,
                    basic != null ? formatCalendar(basic.getCreateDate()) : null
            );
        } catch (IOException | XmpParsingException | BadFieldValueException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return XmpValues.NONE;
        }
    }

    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return CALENDAR_FORMATTER.format(calendar.toInstant().atZone(ZoneId.systemDefault()));
    }

    private static String firstNonBlank(String primary, String fallback) {
        return primary != null && !primary.isBlank() ? primary : fallback;
    }
}
