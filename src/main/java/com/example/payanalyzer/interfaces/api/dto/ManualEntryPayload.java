package com.example.payanalyzer.interfaces.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ManualEntryPayload(LocalDate date, BigDecimal consignments, BigDecimal paidAmount) {
}
