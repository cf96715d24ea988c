package com.example.payanalyzer.interfaces.api.dto;

import com.example.payanalyzer.domain.model.ConsignmentCount;
import com.example.payanalyzer.domain.model.Money;

import java.math.BigDecimal;

/**
 * Conversions from request numbers to domain values; absent numbers mean zero.
 */
public final class Payloads {

    private Payloads() {
    }

    public static ConsignmentCount count(BigDecimal value) {
        return value == null ? ConsignmentCount.ZERO : ConsignmentCount.parse(value.toPlainString());
    }

    public static Money money(BigDecimal value) {
        return value == null ? Money.ZERO : Money.of(value);
    }
}
