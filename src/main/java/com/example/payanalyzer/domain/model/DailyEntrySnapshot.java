package com.example.payanalyzer.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Flat, serializable view of a {@link DailyEntry}.
 * Derived fields are carried for readers; {@link DailyEntry#fromSnapshot(DailyEntrySnapshot)}
 * recomputes them from the components.
 */
public record DailyEntrySnapshot(
        String id,
        String analysisId,
        LocalDate date,
        String dayName,
        int consignments,
        BigDecimal rate,
        BigDecimal basePayment,
        int pickups,
        BigDecimal pickupTotal,
        BigDecimal unloadingBonus,
        BigDecimal attendanceBonus,
        BigDecimal earlyBonus,
        BigDecimal expectedTotal,
        BigDecimal paidAmount,
        BigDecimal difference,
        PaymentStatus status
) {
}
