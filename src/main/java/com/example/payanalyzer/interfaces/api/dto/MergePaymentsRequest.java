package com.example.payanalyzer.interfaces.api.dto;

import com.example.payanalyzer.domain.model.DailyEntrySnapshot;
import com.example.payanalyzer.domain.model.MergeStrategy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * @param entries  existing entries
 * @param incoming newly extracted amounts per date
 * @param strategy combination rule, {@code SMART} when omitted
 */
public record MergePaymentsRequest(
        List<DailyEntrySnapshot> entries,
        Map<LocalDate, List<BigDecimal>> incoming,
        MergeStrategy strategy
) {
}
