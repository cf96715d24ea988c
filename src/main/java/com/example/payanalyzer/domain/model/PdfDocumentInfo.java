package com.example.payanalyzer.domain.model;

/**
 * Document-level facts read from the PDF itself.
 *
 * @param pageCount        number of pages
 * @param pdfVersion       header version, for example {@code 1.7}
 * @param encrypted        whether the document is encrypted
 * @param title            title from the info dictionary or XMP
 * @param author           author from the info dictionary or XMP
 * @param producer         producing application
 * @param creator          creating application
 * @param creationDate     creation date, formatted
 * @param modificationDate modification date, formatted
 */
public record PdfDocumentInfo(
        int pageCount,
        String pdfVersion,
        boolean encrypted,
        String title,
        String author,
        String producer,
        String creator,
        String creationDate,
        String modificationDate
) {
}
