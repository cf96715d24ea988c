package com.example.payanalyzer.domain.model;

/**
 * What is remembered about a submitted file.
 *
 * @param name         file name
 * @param size         size in bytes
 * @param type         MIME type
 * @param lastModified last-modified time in epoch milliseconds
 * @param hash         SHA-256 of the bytes, {@code null} when not computed
 */
public record FileMetadata(String name, long size, String type, long lastModified, String hash) {

    /**
     * @return {@code true} when both describe a file with the same name and size
     */
    public boolean sameSignature(FileMetadata other) {
        return other != null && size == other.size && name != null && name.equals(other.name);
    }
}
