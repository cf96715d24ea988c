package com.example.payanalyzer.interfaces.api;

import com.example.payanalyzer.domain.exception.PdfFileRequiredException;
import com.example.payanalyzer.domain.model.UploadedPdf;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UploadedFilesTest {

    @Test
    void emptyUploadRejected() {
        assertThrows(PdfFileRequiredException.class, () -> UploadedFiles.toUploadedPdfs(List.of(), null));
        assertThrows(PdfFileRequiredException.class, () -> UploadedFiles.toUploadedPdfs(null, null));
    }

    /**
     * Verifies that timestamps are matched by position and missing ones default to zero.
     */
    @Test
    void matchesTimestampsByPosition() {
        List<MultipartFile> files = List.of(
                new MockMultipartFile("files", "DV_a.pdf", "application/pdf", "a".getBytes()),
                new MockMultipartFile("files", "DV_b.pdf", "application/pdf", "bb".getBytes()),
                new MockMultipartFile("files", "DV_c.pdf", "application/pdf", "ccc".getBytes()));

        List<UploadedPdf> uploads = UploadedFiles.toUploadedPdfs(files, Arrays.asList(1000L, null));

        assertThat(uploads).extracting(UploadedPdf::lastModified).containsExactly(1000L, 0L, 0L);
        assertThat(uploads).extracting(UploadedPdf::size).containsExactly(1L, 2L, 3L);
    }

    @Test
    void normalizesPdfContentTypeAndBlankNames() {
        List<MultipartFile> files = List.of(
                new MockMultipartFile("files", "DV_scan.PDF", "application/octet-stream", "x".getBytes()),
                new MockMultipartFile("files", "", "APPLICATION/PDF", "y".getBytes()),
                new MockMultipartFile("files", "notes.txt", "text/plain", "z".getBytes()));

        List<UploadedPdf> uploads = UploadedFiles.toUploadedPdfs(files, null);

        assertThat(uploads).extracting(UploadedPdf::contentType)
                .containsExactly("application/pdf", "application/pdf", "text/plain");
        assertThat(uploads.get(1).name()).isEqualTo("uploaded.pdf");
    }
}
