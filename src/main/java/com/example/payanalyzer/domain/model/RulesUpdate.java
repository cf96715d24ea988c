package com.example.payanalyzer.domain.model;

/**
 * Partial change to a rule set; {@code null} components keep the current value.
 *
 * @param weekdayRate     new per-consignment rate Monday to Friday
 * @param saturdayRate    new per-consignment rate on Saturday
 * @param unloadingBonus  new unloading bonus
 * @param attendanceBonus new attendance bonus
 * @param earlyBonus      new early bonus
 */
public record RulesUpdate(
        Money weekdayRate,
        Money saturdayRate,
        Money unloadingBonus,
        Money attendanceBonus,
        Money earlyBonus
) {
}
