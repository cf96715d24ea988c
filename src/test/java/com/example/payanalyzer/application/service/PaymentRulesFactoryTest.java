package com.example.payanalyzer.application.service;

import com.example.payanalyzer.application.config.AnalyzerProperties;
import com.example.payanalyzer.application.exception.RulesValidationException;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.PaymentRules;
import com.example.payanalyzer.domain.model.ValidationIssue;
import com.example.payanalyzer.domain.model.ValidationThresholds;
import com.example.payanalyzer.domain.service.ValidationService;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PaymentRulesFactoryTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-07-01T08:00:00Z"), ZoneOffset.UTC);
    private final AnalyzerProperties properties = new AnalyzerProperties();
    private final PaymentRulesFactory factory = new PaymentRulesFactory(
            properties, new ValidationService(ValidationThresholds.defaults()), clock);

    @Test
    void defaultsComeFromProperties() {
        properties.getRules().setWeekdayRate(new BigDecimal("2.20"));
        PaymentRulesFactory configured = new PaymentRulesFactory(
                properties, new ValidationService(ValidationThresholds.defaults()), clock);

        PaymentRules rules = configured.defaults("driver-1");

        assertThat(rules.userId()).isEqualTo("driver-1");
        assertThat(rules.version()).isEqualTo(1);
        assertThat(rules.weekdayRate()).isEqualTo(Money.of(2.20));
        assertThat(rules.saturdayRate()).isEqualTo(Money.of(3));
        assertThat(rules.validFrom()).isEqualTo(clock.instant());
    }

    @Test
    void overridesReplaceOnlyGivenAmounts() {
        PaymentRules rules = factory.create("driver-1", null, new BigDecimal("3.50"), null, null, BigDecimal.ZERO);

        assertThat(rules.weekdayRate()).isEqualTo(Money.of(2));
        assertThat(rules.saturdayRate()).isEqualTo(Money.of(3.50));
        assertThat(rules.earlyBonus()).isEqualTo(Money.ZERO);
    }

    @Test
    void negativeAmountsAreRejected() {
        RulesValidationException ex = assertThrows(RulesValidationException.class,
                () -> factory.create("driver-1", new BigDecimal("-1"), null, null, new BigDecimal("-5"), null));

        assertThat(ex.getIssues()).extracting(ValidationIssue::code)
                .containsExactly("NEGATIVE_WEEKDAY_RATE", "NEGATIVE_ATTENDANCE_BONUS");
        assertThat(ex.getMessage())
                .isEqualTo("Payment rules rejected: Weekday rate cannot be negative; Attendance bonus cannot be negative");
    }

    @Test
    void buildSkipsValidation() {
        PaymentRules rules = factory.build("driver-1", new BigDecimal("-1"), null, null, null, null);

        assertThat(rules.weekdayRate().isNegative()).isTrue();
    }
}
