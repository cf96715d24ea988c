package com.example.payanalyzer.domain.model;

import java.time.LocalDate;

/**
 * One manually entered day.
 *
 * @param date         day
 * @param consignments delivered consignments
 * @param paidAmount   amount paid
 */
public record ManualEntry(LocalDate date, ConsignmentCount consignments, Money paidAmount) {
}
