package com.example.payanalyzer.domain.model;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Versioned, immutable set of per-consignment rates and daily bonuses for one user.
 * A change never edits a version in place: {@link #revise(RulesUpdate, Clock)} retires the
 * current version and returns its successor.
 *
 * @param id              version identifier
 * @param userId          owner of the rule set
 * @param version         monotonically increasing version number, starting at 1
 * @param weekdayRate     rate per consignment Monday to Friday (and Sunday)
 * @param saturdayRate    rate per consignment on Saturday
 * @param unloadingBonus  bonus paid Tuesday to Saturday
 * @param attendanceBonus bonus paid Monday to Friday
 * @param earlyBonus      bonus paid Monday to Friday
 * @param validFrom       first instant this version applies
 * @param validUntil      last instant this version applies, {@code null} while open-ended
 * @param active          whether this version is the one in force
 */
public record PaymentRules(
        UUID id,
        String userId,
        int version,
        Money weekdayRate,
        Money saturdayRate,
        Money unloadingBonus,
        Money attendanceBonus,
        Money earlyBonus,
        Instant validFrom,
        Instant validUntil,
        boolean active
) {

    public static final Money DEFAULT_WEEKDAY_RATE = Money.of(2.00);
    public static final Money DEFAULT_SATURDAY_RATE = Money.of(3.00);
    public static final Money DEFAULT_UNLOADING_BONUS = Money.of(30.00);
    public static final Money DEFAULT_ATTENDANCE_BONUS = Money.of(25.00);
    public static final Money DEFAULT_EARLY_BONUS = Money.of(50.00);

    public PaymentRules {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(weekdayRate, "weekdayRate");
        Objects.requireNonNull(saturdayRate, "saturdayRate");
        Objects.requireNonNull(unloadingBonus, "unloadingBonus");
        Objects.requireNonNull(attendanceBonus, "attendanceBonus");
        Objects.requireNonNull(earlyBonus, "earlyBonus");
        Objects.requireNonNull(validFrom, "validFrom");
        if (version < 1) {
            throw new IllegalArgumentException("Rule versions start at 1: " + version);
        }
    }

    /**
     * Creates the first version of a rule set, valid from now.
     *
     * @return version 1, active and open-ended
     */
    public static PaymentRules initial(String userId,
                                       Money weekdayRate,
                                       Money saturdayRate,
                                       Money unloadingBonus,
                                       Money attendanceBonus,
                                       Money earlyBonus,
                                       Clock clock) {
        return new PaymentRules(UUID.randomUUID(), userId, 1, weekdayRate, saturdayRate,
                unloadingBonus, attendanceBonus, earlyBonus, clock.instant(), null, true);
    }

    /**
     * @return version 1 carrying the standard rates and bonuses
     */
    public static PaymentRules defaults(String userId, Clock clock) {
        return initial(userId, DEFAULT_WEEKDAY_RATE, DEFAULT_SATURDAY_RATE, DEFAULT_UNLOADING_BONUS,
                DEFAULT_ATTENDANCE_BONUS, DEFAULT_EARLY_BONUS, clock);
    }

    public Money getRateForDay(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY ? saturdayRate : weekdayRate;
    }

    /**
     * Applies the weekly bonus calendar: unloading on every day except Sunday and Monday,
     * attendance and early bonus Monday to Friday.
     *
     * @param day day of week
     * @return bonuses for that day
     */
    public DailyBonuses getApplicableBonuses(DayOfWeek day) {
        boolean weekday = day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
        boolean unloadingDay = day != DayOfWeek.SUNDAY && day != DayOfWeek.MONDAY;
        return new DailyBonuses(
                unloadingDay ? unloadingBonus : Money.ZERO,
                weekday ? attendanceBonus : Money.ZERO,
                weekday ? earlyBonus : Money.ZERO
        );
    }

    public boolean isValidFor(Instant instant) {
        if (!active || instant.isBefore(validFrom)) {
            return false;
        }
        return validUntil == null || !instant.isAfter(validUntil);
    }

    /**
     * Builds the next version with the supplied changes, valid from now.
     *
     * @param update partial changes
     * @param clock  time source
     * @return version {@code N + 1}, active
     */
    public PaymentRules createNewVersion(RulesUpdate update, Clock clock) {
        return new PaymentRules(
                UUID.randomUUID(),
                userId,
                version + 1,
                update.weekdayRate() != null ? update.weekdayRate() : weekdayRate,
                update.saturdayRate() != null ? update.saturdayRate() : saturdayRate,
                update.unloadingBonus() != null ? update.unloadingBonus() : unloadingBonus,
                update.attendanceBonus() != null ? update.attendanceBonus() : attendanceBonus,
                update.earlyBonus() != null ? update.earlyBonus() : earlyBonus,
                clock.instant(),
                null,
                true
        );
    }

    /**
     * @return a copy of this version closed at the current instant
     */
    public PaymentRules deactivate(Clock clock) {
        return new PaymentRules(id, userId, version, weekdayRate, saturdayRate, unloadingBonus,
                attendanceBonus, earlyBonus, validFrom, clock.instant(), false);
    }

    public RulesRevision revise(RulesUpdate update, Clock clock) {
        return new RulesRevision(deactivate(clock), createNewVersion(update, clock));
    }
}
