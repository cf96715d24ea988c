package com.example.payanalyzer.domain.model;

import java.util.List;

/**
 * Manually entered data for one period, fingerprinted when no files are uploaded.
 *
 * @param userId  submitting user
 * @param period  analysed period
 * @param entries entered days, any order
 */
public record ManualSubmission(String userId, DateRange period, List<ManualEntry> entries) {

    public ManualSubmission {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }
}
