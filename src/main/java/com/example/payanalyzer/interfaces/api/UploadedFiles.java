package com.example.payanalyzer.interfaces.api;

import com.example.payanalyzer.domain.exception.PdfFileRequiredException;
import com.example.payanalyzer.domain.model.UploadedPdf;
import com.example.payanalyzer.infrastructure.exception.PdfProcessingException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts multipart uploads into buffered domain files.
 */
final class UploadedFiles {

    private static final String PDF_CONTENT_TYPE = "application/pdf";

    private UploadedFiles() {
    }

    /**
     * @param files        multipart parts in submission order
     * @param lastModified optional client-side timestamps, matched by position
     * @return buffered files
     * @throws PdfFileRequiredException when no file was sent
     */
    static List<UploadedPdf> toUploadedPdfs(List<MultipartFile> files, List<Long> lastModified) {
        if (files == null || files.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        List<UploadedPdf> uploads = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            long modified = lastModified != null && i < lastModified.size() && lastModified.get(i) != null
                    ? lastModified.get(i)
                    : 0L;
            uploads.add(new UploadedPdf(resolveFileName(file), resolveContentType(file), modified, readBytes(file)));
        }
        return uploads;
    }

    /**
     * Some clients send PDFs as {@code application/octet-stream}; a {@code .pdf} name is enough.
     *
     * @param file uploaded file
     * @return normalized content type, the declared one when it does not look like a PDF
     */
    private static String resolveContentType(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase(PDF_CONTENT_TYPE)) {
            return PDF_CONTENT_TYPE;
        }
        String fileName = file.getOriginalFilename();
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return PDF_CONTENT_TYPE;
        }
        return contentType;
    }

    /**
     * Determines a safe file name that can be shown to the user and stored alongside the result.
     *
     * @param file uploaded file
     * @return original filename or a default placeholder
     */
    private static String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read uploaded file " + file.getOriginalFilename() + ".", e);
        }
    }
}
