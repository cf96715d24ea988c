package com.example.payanalyzer.interfaces.api.dto;

import java.math.BigDecimal;

/**
 * Rates and bonuses supplied by the client. Missing amounts use the configured defaults.
 */
public record RulesPayload(
        BigDecimal weekdayRate,
        BigDecimal saturdayRate,
        BigDecimal unloadingBonus,
        BigDecimal attendanceBonus,
        BigDecimal earlyBonus
) {

    public static final RulesPayload DEFAULTS = new RulesPayload(null, null, null, null, null);
}
