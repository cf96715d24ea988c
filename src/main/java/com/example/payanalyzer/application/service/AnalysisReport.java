package com.example.payanalyzer.application.service;

import com.example.payanalyzer.domain.model.AnalysisSource;
import com.example.payanalyzer.domain.model.DailyEntrySnapshot;
import com.example.payanalyzer.domain.model.DateRange;
import com.example.payanalyzer.domain.model.FingerprintComparison;
import com.example.payanalyzer.domain.model.PaymentStatus;
import com.example.payanalyzer.domain.model.ProcessingResult;
import com.example.payanalyzer.domain.model.ValidationReport;
import com.example.payanalyzer.domain.model.WeeklyStats;

import java.util.List;

/**
 * Outcome of a complete analysis run.
 *
 * @param analysisId    identifier of the new analysis
 * @param userId        owner
 * @param source        how the data arrived
 * @param period        analysed period
 * @param rulesVersion  version of the rules applied
 * @param fingerprint   fingerprint of the submission
 * @param comparison    relation to earlier submissions
 * @param entries       daily entries, chronological
 * @param totals        totals over the working days
 * @param overallStatus status of the summed difference
 * @param validation    file-set and entry findings
 * @param processing    batch result, {@code null} for manual submissions
 */
public record AnalysisReport(
        String analysisId,
        String userId,
        AnalysisSource source,
        DateRange period,
        int rulesVersion,
        String fingerprint,
        FingerprintComparison comparison,
        List<DailyEntrySnapshot> entries,
        WeeklyStats totals,
        PaymentStatus overallStatus,
        ValidationReport validation,
        ProcessingResult processing
) {

    public AnalysisReport {
        entries = List.copyOf(entries);
    }
}
