package com.example.payanalyzer.domain.model;

/**
 * How a submission relates to what was submitted before.
 */
public enum FingerprintVerdict {
    /** Nothing comparable was submitted before. */
    NEW,
    /** Every file was submitted before with the same name, size and last-modified time. */
    UNCHANGED,
    /** At least one file was submitted before with the same name and size but another last-modified time. */
    MODIFIED,
    /** The fingerprint equals the fingerprint of an earlier submission. */
    DUPLICATE
}
