package com.example.payanalyzer.domain.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A file handed in by the caller, fully buffered.
 *
 * @param name         original file name
 * @param contentType  declared MIME type, may be {@code null}
 * @param lastModified last-modified time in epoch milliseconds as reported by the client
 * @param content      file bytes
 */
public record UploadedPdf(String name, String contentType, long lastModified, byte[] content) {

    private static final int CONTENT_PREFIX_BYTES = 1000;

    public UploadedPdf {
        content = content != null ? content : new byte[0];
    }

    public long size() {
        return content.length;
    }

    /**
     * Fingerprint input for this file. The leading bytes are decoded one byte per character so
     * binary content maps to a stable string.
     *
     * @return name, size, timestamp and leading content
     */
    public FileInfo toFileInfo() {
        int prefixLength = Math.min(content.length, CONTENT_PREFIX_BYTES);
        return new FileInfo(name, size(), lastModified, new String(content, 0, prefixLength, StandardCharsets.ISO_8859_1));
    }

    public FileMetadata toMetadata(String hash) {
        return new FileMetadata(name, size(), contentType, lastModified, hash);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof UploadedPdf that)) {
            return false;
        }
        return lastModified == that.lastModified
                && Objects.equals(name, that.name)
                && Objects.equals(contentType, that.contentType)
                && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, contentType, lastModified) * 31 + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "UploadedPdf[name=" + name + ", size=" + content.length + "]";
    }
}
