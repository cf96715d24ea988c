package com.example.payanalyzer.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consignment counts extracted from a delivery runsheet, one day per date in chronological order.
 *
 * @param days              per-date details, chronological
 * @param totalConsignments sum of every per-date count
 */
public record RunsheetRecord(List<RunsheetDay> days, int totalConsignments) implements ExtractedDocument {

    public RunsheetRecord {
        days = List.copyOf(days);
    }

    @Override
    public DocumentType documentType() {
        return DocumentType.RUNSHEET;
    }

    @Override
    public int dataPoints() {
        return totalConsignments;
    }

    @JsonProperty("dates")
    @Override
    public List<LocalDate> dates() {
        return days.stream().map(RunsheetDay::date).toList();
    }

    /**
     * @return date to count view, iteration in chronological order
     */
    @JsonProperty("consignmentsByDate")
    public Map<LocalDate, Integer> consignmentsByDate() {
        Map<LocalDate, Integer> byDate = new LinkedHashMap<>();
        days.forEach(day -> byDate.put(day.date(), day.consignments().value()));
        return Collections.unmodifiableMap(byDate);
    }
}
