package com.example.payanalyzer.interfaces.api.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * Manually entered period. {@code rules} only matters for analyses, fingerprinting ignores it.
 */
public record ManualSubmissionRequest(
        String userId,
        LocalDate start,
        LocalDate end,
        RulesPayload rules,
        List<ManualEntryPayload> entries
) {
}
