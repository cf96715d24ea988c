package com.example.payanalyzer.domain.service;

import com.example.payanalyzer.domain.model.ConsignmentCount;
import com.example.payanalyzer.domain.model.DailyBonuses;
import com.example.payanalyzer.domain.model.DailyEntry;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.PaymentRules;
import com.example.payanalyzer.domain.model.WeeklyStats;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Computes expected earnings for days and weeks under one rule version.
 * Instances hold no mutable state and may be shared between threads.
 */
public class PaymentCalculator {

    private final PaymentRules rules;

    public PaymentCalculator(PaymentRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public PaymentRules getRules() {
        return rules;
    }

    /**
     * Builds the entry for one day: base payment is {@code rate x consignments}, bonuses follow
     * the day of week.
     *
     * @param analysisId   owning analysis
     * @param date         day
     * @param consignments delivered consignments
     * @param pickups      number of pickups
     * @param pickupTotal  amount earned through pickups
     * @param paidAmount   amount actually paid
     * @return entry with expected total and difference computed
     */
    public DailyEntry calculateDailyPayment(String analysisId,
                                            LocalDate date,
                                            ConsignmentCount consignments,
                                            ConsignmentCount pickups,
                                            Money pickupTotal,
                                            Money paidAmount) {
        DayOfWeek day = date.getDayOfWeek();
        Money rate = rules.getRateForDay(day);
        return new DailyEntry(
                null,
                analysisId,
                date,
                consignments,
                rate,
                rate.multiply(consignments.value()),
                pickups,
                pickupTotal,
                rules.getApplicableBonuses(day),
                paidAmount
        );
    }

    public Money calculateExpectedTotal(ConsignmentCount consignments, LocalDate date, Money pickupTotal) {
        DayOfWeek day = date.getDayOfWeek();
        Money base = rules.getRateForDay(day).multiply(consignments.value());
        return base.add(rules.getApplicableBonuses(day).total()).add(pickupTotal);
    }

    public Money calculateExpectedTotal(ConsignmentCount consignments, LocalDate date) {
        return calculateExpectedTotal(consignments, date, Money.ZERO);
    }

    /**
     * @return {@code false} only for Sundays
     */
    public boolean isValidPaymentDay(LocalDate date) {
        return date.getDayOfWeek() != DayOfWeek.SUNDAY;
    }

    public Money getRateForDay(LocalDate date) {
        return rules.getRateForDay(date.getDayOfWeek());
    }

    public DailyBonuses getBonusesForDay(LocalDate date) {
        return rules.getApplicableBonuses(date.getDayOfWeek());
    }

    /**
     * Sums the working-day entries (Sundays are left out) and averages them per working day.
     *
     * @param entries entries of any period
     * @return totals and averages, all zero when there is no working day
     */
    public WeeklyStats calculateWeeklyStats(List<DailyEntry> entries) {
        List<DailyEntry> working = entries.stream().filter(DailyEntry::isWorkingDay).toList();
        int workingDays = working.size();
        if (workingDays == 0) {
            return WeeklyStats.EMPTY;
        }

        int totalConsignments = working.stream().mapToInt(entry -> entry.getConsignments().value()).sum();
        Money baseTotal = sum(working, DailyEntry::getBasePayment);
        Money bonusTotal = sum(working, DailyEntry::getTotalBonus);
        Money pickupTotal = sum(working, DailyEntry::getPickupTotal);
        Money expectedTotal = sum(working, DailyEntry::getExpectedTotal);
        Money paidTotal = sum(working, DailyEntry::getPaidAmount);

        return new WeeklyStats(
                workingDays,
                totalConsignments,
                baseTotal,
                bonusTotal,
                pickupTotal,
                expectedTotal,
                paidTotal,
                paidTotal.subtract(expectedTotal),
                (double) totalConsignments / workingDays,
                paidTotal.divide(workingDays)
        );
    }

    private static Money sum(List<DailyEntry> entries, Function<DailyEntry, Money> field) {
        return entries.stream().map(field).reduce(Money.ZERO, Money::add);
    }
}
