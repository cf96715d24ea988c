package com.example.payanalyzer.domain.model;

/**
 * A file-level problem that kept a file from producing an outcome.
 *
 * @param fileName file the error belongs to
 * @param message  human readable reason
 */
public record FileError(String fileName, String message) {
}
