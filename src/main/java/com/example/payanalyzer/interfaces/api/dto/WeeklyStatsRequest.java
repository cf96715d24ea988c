package com.example.payanalyzer.interfaces.api.dto;

import java.util.List;

public record WeeklyStatsRequest(String userId, RulesPayload rules, List<DayInput> days) {
}
