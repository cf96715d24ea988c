package com.example.payanalyzer.domain.model;

/**
 * Input of file-set fingerprinting.
 *
 * @param name         file name
 * @param size         size in bytes
 * @param lastModified last-modified time in epoch milliseconds
 * @param content      optional leading content, only the first 1000 characters are used
 */
public record FileInfo(String name, long size, long lastModified, String content) {
}
