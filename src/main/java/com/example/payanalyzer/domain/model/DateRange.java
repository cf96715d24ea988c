package com.example.payanalyzer.domain.model;

import com.example.payanalyzer.domain.exception.InvalidDateRangeException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Stream;

/**
 * Inclusive calendar period.
 *
 * @param start first day of the period
 * @param end   last day of the period, never before {@code start}
 */
public record DateRange(LocalDate start, LocalDate end) {

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    public DateRange {
        if (start == null || end == null || start.isAfter(end)) {
            throw new InvalidDateRangeException(start, end);
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public long dayCount() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public List<LocalDate> days() {
        return Stream.iterate(start, day -> !day.isAfter(end), day -> day.plusDays(1)).toList();
    }

    /**
     * @return every day of the period except Sundays, in calendar order
     */
    public List<LocalDate> workingDays() {
        return days().stream()
                .filter(day -> day.getDayOfWeek() != DayOfWeek.SUNDAY)
                .toList();
    }

    public String formatRange() {
        return DISPLAY_FORMAT.format(start) + " - " + DISPLAY_FORMAT.format(end);
    }
}
