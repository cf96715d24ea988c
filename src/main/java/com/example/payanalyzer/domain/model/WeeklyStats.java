package com.example.payanalyzer.domain.model;

/**
 * Totals and per-day averages over the working days of a set of entries.
 */
public record WeeklyStats(
        int workingDays,
        int totalConsignments,
        Money baseTotal,
        Money bonusTotal,
        Money pickupTotal,
        Money expectedTotal,
        Money paidTotal,
        Money difference,
        double averageConsignmentsPerDay,
        Money averagePaymentPerDay
) {

    public static final WeeklyStats EMPTY = new WeeklyStats(0, 0, Money.ZERO, Money.ZERO, Money.ZERO,
            Money.ZERO, Money.ZERO, Money.ZERO, 0.0, Money.ZERO);
}
