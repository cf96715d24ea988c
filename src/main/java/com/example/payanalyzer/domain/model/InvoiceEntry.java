package com.example.payanalyzer.domain.model;

import java.time.LocalDate;

/**
 * One dated, timed payment line of an invoice.
 *
 * @param date        service date
 * @param time        service time as printed ({@code HH:MM})
 * @param amount      amount paid for the line
 * @param serviceType service the line was paid for
 * @param description text printed between the time and the amount
 */
public record InvoiceEntry(LocalDate date, String time, Money amount, ServiceType serviceType, String description) {
}
