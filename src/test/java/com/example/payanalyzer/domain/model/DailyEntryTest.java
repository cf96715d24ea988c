package com.example.payanalyzer.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class DailyEntryTest {

    private static final LocalDate TUESDAY = LocalDate.of(2025, 7, 1);

    private DailyEntry entry(Money paid) {
        return new DailyEntry(null, "analysis-1", TUESDAY, ConsignmentCount.of(20), Money.of(2), null,
                ConsignmentCount.of(1), Money.of(5), new DailyBonuses(Money.of(30), Money.of(25), Money.of(50)), paid);
    }

    @Test
    void expectedTotalCombinesBasePickupsAndBonuses() {
        DailyEntry entry = entry(Money.of(150));

        assertThat(entry.getId()).isNotBlank();
        assertThat(entry.getBasePayment()).isEqualTo(Money.of(40));
        assertThat(entry.getExpectedTotal()).isEqualTo(Money.of(150));
        assertThat(entry.getDifference()).isEqualTo(Money.ZERO);
        assertThat(entry.getStatus()).isEqualTo(PaymentStatus.BALANCED);
        assertThat(entry.getDayName()).isEqualTo("Tuesday");
        assertThat(entry.getDateFormatted()).isEqualTo("01/07/2025");
    }

    @Test
    void updatingPaidAmountRecomputesDifference() {
        DailyEntry entry = entry(Money.ZERO);
        assertThat(entry.getStatus()).isEqualTo(PaymentStatus.UNDERPAID);

        entry.updatePaidAmount(Money.of(160));

        assertThat(entry.getDifference()).isEqualTo(Money.of(10));
        assertThat(entry.getStatus()).isEqualTo(PaymentStatus.OVERPAID);
    }

    @Test
    void updatingPickupsRecomputesExpectedTotal() {
        DailyEntry entry = entry(Money.of(150));

        entry.updatePickupData(ConsignmentCount.of(3), Money.of(15));

        assertThat(entry.getPickups().value()).isEqualTo(3);
        assertThat(entry.getExpectedTotal()).isEqualTo(Money.of(160));
        assertThat(entry.getDifference()).isEqualTo(Money.of(-10));
    }

    @Test
    void snapshotRoundTripKeepsFigures() {
        DailyEntry original = entry(Money.of(140));

        DailyEntrySnapshot snapshot = original.toSnapshot();
        DailyEntry restored = DailyEntry.fromSnapshot(snapshot);

        assertThat(snapshot.status()).isEqualTo(PaymentStatus.UNDERPAID);
        assertThat(snapshot.difference()).isEqualByComparingTo(new BigDecimal("-10.00"));
        assertThat(restored.getId()).isEqualTo(original.getId());
        assertThat(restored.getExpectedTotal()).isEqualTo(original.getExpectedTotal());
        assertThat(restored.toSnapshot()).isEqualTo(snapshot);
    }

    @Test
    void sundayIsNotAWorkingDay() {
        DailyEntry sunday = new DailyEntry(null, null, LocalDate.of(2025, 7, 6), ConsignmentCount.ZERO,
                Money.of(2), null, null, null, null, Money.ZERO);

        assertThat(sunday.isWorkingDay()).isFalse();
        assertThat(sunday.getTotalBonus()).isEqualTo(Money.ZERO);
    }
}
