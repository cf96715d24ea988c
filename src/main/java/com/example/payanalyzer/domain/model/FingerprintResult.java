package com.example.payanalyzer.domain.model;

import java.util.List;

/**
 * A file-set fingerprint and what went into it.
 *
 * @param fingerprint SHA-256 hex digest identifying the file set
 * @param fileHashes  per-file hashes, sorted
 * @param metadata    aggregate facts hashed together with the file hashes
 */
public record FingerprintResult(String fingerprint, List<String> fileHashes, FileSetMetadata metadata) {

    public FingerprintResult {
        fileHashes = List.copyOf(fileHashes);
    }
}
