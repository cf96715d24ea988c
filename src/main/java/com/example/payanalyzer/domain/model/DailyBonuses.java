package com.example.payanalyzer.domain.model;

/**
 * Bonuses that apply to one calendar day.
 *
 * @param unloading  unloading bonus, zero on Sundays and Mondays
 * @param attendance attendance bonus, weekdays only
 * @param early      early bonus, weekdays only
 */
public record DailyBonuses(Money unloading, Money attendance, Money early) {

    public static final DailyBonuses NONE = new DailyBonuses(Money.ZERO, Money.ZERO, Money.ZERO);

    public Money total() {
        return unloading.add(attendance).add(early);
    }
}
