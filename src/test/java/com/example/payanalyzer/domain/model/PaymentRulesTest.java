package com.example.payanalyzer.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for rate selection, the bonus calendar and rule versioning.
 */
class PaymentRulesTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-07-01T08:00:00Z"), ZoneOffset.UTC);
    private final PaymentRules rules = PaymentRules.defaults("driver-1", clock);

    @Test
    void saturdayUsesSaturdayRate() {
        assertThat(rules.getRateForDay(DayOfWeek.SATURDAY)).isEqualTo(Money.of(3.00));
        assertThat(rules.getRateForDay(DayOfWeek.TUESDAY)).isEqualTo(Money.of(2.00));
        assertThat(rules.getRateForDay(DayOfWeek.SUNDAY)).isEqualTo(Money.of(2.00));
    }

    /**
     * Unloading is paid Tuesday to Saturday, attendance and early start Monday to Friday.
     *
     * @param day day under test
     */
    @ParameterizedTest
    @EnumSource(DayOfWeek.class)
    void bonusCalendar(DayOfWeek day) {
        DailyBonuses bonuses = rules.getApplicableBonuses(day);

        boolean unloading = day != DayOfWeek.SUNDAY && day != DayOfWeek.MONDAY;
        boolean weekday = day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
        assertThat(bonuses.unloading()).isEqualTo(unloading ? Money.of(30) : Money.ZERO);
        assertThat(bonuses.attendance()).isEqualTo(weekday ? Money.of(25) : Money.ZERO);
        assertThat(bonuses.early()).isEqualTo(weekday ? Money.of(50) : Money.ZERO);
    }

    @Test
    void initialRulesAreActiveFromNow() {
        assertThat(rules.version()).isEqualTo(1);
        assertThat(rules.active()).isTrue();
        assertThat(rules.validUntil()).isNull();
        assertThat(rules.isValidFor(clock.instant())).isTrue();
        assertThat(rules.isValidFor(clock.instant().minusSeconds(1))).isFalse();
    }

    @Test
    void reviseRetiresCurrentAndCreatesNextVersion() {
        Clock later = Clock.offset(clock, Duration.ofDays(7));
        RulesUpdate update = new RulesUpdate(Money.of(2.50), null, null, null, null);

        RulesRevision revision = rules.revise(update, later);

        assertThat(revision.retired().id()).isEqualTo(rules.id());
        assertThat(revision.retired().active()).isFalse();
        assertThat(revision.retired().validUntil()).isEqualTo(later.instant());
        assertThat(revision.retired().isValidFor(later.instant())).isFalse();

        PaymentRules next = revision.current();
        assertThat(next.id()).isNotEqualTo(rules.id());
        assertThat(next.version()).isEqualTo(2);
        assertThat(next.weekdayRate()).isEqualTo(Money.of(2.50));
        assertThat(next.saturdayRate()).isEqualTo(rules.saturdayRate());
        assertThat(next.validFrom()).isEqualTo(later.instant());
        assertThat(next.isValidFor(later.instant())).isTrue();
    }
}
