package com.example.payanalyzer.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Consignments delivered on one runsheet date.
 *
 * @param date           delivery date
 * @param consignments   number of consignments
 * @param consignmentIds consignment identifiers in document order
 */
public record RunsheetDay(LocalDate date, ConsignmentCount consignments, List<String> consignmentIds) {

    public RunsheetDay {
        consignmentIds = List.copyOf(consignmentIds);
    }
}
