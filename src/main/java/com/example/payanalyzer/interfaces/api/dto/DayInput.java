package com.example.payanalyzer.interfaces.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Figures for one day. Counts arrive as numbers so fractional values can be rejected instead
 * of truncated.
 */
public record DayInput(
        LocalDate date,
        BigDecimal consignments,
        BigDecimal pickups,
        BigDecimal pickupTotal,
        BigDecimal paidAmount
) {
}
