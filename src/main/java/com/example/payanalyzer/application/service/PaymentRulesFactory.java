package com.example.payanalyzer.application.service;

import com.example.payanalyzer.application.config.AnalyzerProperties;
import com.example.payanalyzer.application.exception.RulesValidationException;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.PaymentRules;
import com.example.payanalyzer.domain.model.ValidationReport;
import com.example.payanalyzer.domain.service.ValidationService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Creates validated rule sets. Amounts left out fall back to the configured defaults.
 */
@Service
public class PaymentRulesFactory {

    private static final Logger log = LoggerFactory.getLogger(PaymentRulesFactory.class);

    private final AnalyzerProperties.Rules defaults;
    private final ValidationService validationService;
    private final Clock clock;

    public PaymentRulesFactory(AnalyzerProperties properties, ValidationService validationService, Clock clock) {
        this.defaults = properties.getRules();
        this.validationService = validationService;
        this.clock = clock;
    }

    public PaymentRules defaults(String userId) {
        return create(userId, null, null, null, null, null);
    }

    /**
     * Builds version 1 of a rule set and rejects it when it has blocking issues.
     *
     * @return validated rules
     * @throws RulesValidationException when a rate or bonus is negative
     */
    public PaymentRules create(String userId,
                               BigDecimal weekdayRate,
                               BigDecimal saturdayRate,
                               BigDecimal unloadingBonus,
                               BigDecimal attendanceBonus,
                               BigDecimal earlyBonus) {
        PaymentRules rules = build(userId, weekdayRate, saturdayRate, unloadingBonus, attendanceBonus, earlyBonus);
        ValidationReport report = validationService.validatePaymentRules(rules);
        if (!report.valid()) {
            throw new RulesValidationException(report.errors());
        }
        if (!report.warnings().isEmpty()) {
            log.info("Payment rules for {} accepted with warnings: {}", userId, report.warnings());
        }
        return rules;
    }

    /**
     * Builds version 1 of a rule set without validating it.
     */
    public PaymentRules build(String userId,
                              BigDecimal weekdayRate,
                              BigDecimal saturdayRate,
                              BigDecimal unloadingBonus,
                              BigDecimal attendanceBonus,
                              BigDecimal earlyBonus) {
        return PaymentRules.initial(
                userId,
                amountOrDefault(weekdayRate, defaults.getWeekdayRate()),
                amountOrDefault(saturdayRate, defaults.getSaturdayRate()),
                amountOrDefault(unloadingBonus, defaults.getUnloadingBonus()),
                amountOrDefault(attendanceBonus, defaults.getAttendanceBonus()),
                amountOrDefault(earlyBonus, defaults.getEarlyBonus()),
                clock);
    }

    private static Money amountOrDefault(BigDecimal amount, BigDecimal fallback) {
        return Money.of(amount != null ? amount : fallback);
    }
}
