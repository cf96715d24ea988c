package com.example.payanalyzer.interfaces.api.dto;

public record DailyPaymentRequest(String userId, String analysisId, RulesPayload rules, DayInput day) {
}
