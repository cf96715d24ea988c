package com.example.payanalyzer.domain.service;

import com.example.payanalyzer.domain.model.Analysis;
import com.example.payanalyzer.domain.model.DailyEntry;
import com.example.payanalyzer.domain.model.DateRange;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.PaymentRules;
import com.example.payanalyzer.domain.model.ValidationIssue;
import com.example.payanalyzer.domain.model.ValidationReport;
import com.example.payanalyzer.domain.model.ValidationThresholds;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Cross-entity business-rule checks. Errors make a report invalid; warnings only annotate it.
 */
public class ValidationService {

    private final ValidationThresholds thresholds;

    public ValidationService(ValidationThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public ValidationReport validateAnalysis(Analysis analysis) {
        return validateEntries(analysis.getPeriod(), analysis.getDailyEntries());
    }

    /**
     * Validates the entries of one analysis period.
     *
     * @param period  analysed period
     * @param entries entries in any order, possibly with repeated dates
     * @return errors and warnings
     */
    public ValidationReport validateEntries(DateRange period, List<DailyEntry> entries) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        if (entries.isEmpty()) {
            errors.add(ValidationIssue.of("NO_DAILY_ENTRIES", "Analysis must contain at least one daily entry"));
        }

        List<LocalDate> missing = findMissingWorkingDays(period, entries);
        if (!missing.isEmpty()) {
            warnings.add(new ValidationIssue("MISSING_WORKING_DAYS",
                    "Missing entries for working days: " + join(missing), null, missing));
        }

        List<LocalDate> duplicates = findDuplicateDates(entries);
        if (!duplicates.isEmpty()) {
            errors.add(new ValidationIssue("DUPLICATE_ENTRIES",
                    "Duplicate entries found for dates: " + join(duplicates), null, duplicates));
        }

        ValidationReport report = new ValidationReport(errors, warnings);
        for (DailyEntry entry : entries) {
            report = report.merge(validateDailyEntry(entry));
        }

        List<LocalDate> discrepancies = entries.stream()
                .filter(entry -> entry.getDifference().abs().isGreaterThan(thresholds.largeDiscrepancy()))
                .map(DailyEntry::getDate)
                .toList();
        if (!discrepancies.isEmpty()) {
            report = report.merge(new ValidationReport(List.of(), List.of(new ValidationIssue("LARGE_DISCREPANCIES",
                    "Large payment discrepancies found on " + discrepancies.size() + " days", "difference", discrepancies))));
        }
        return report;
    }

    public ValidationReport validateDailyEntry(DailyEntry entry) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        int consignments = entry.getConsignments().value();
        Money paid = entry.getPaidAmount();

        if (!entry.isWorkingDay() && consignments > 0) {
            warnings.add(new ValidationIssue("SUNDAY_CONSIGNMENTS",
                    "Consignments recorded on Sunday (non-working day)", "consignments", consignments));
        }
        if (consignments == 0 && paid.isPositive()) {
            warnings.add(new ValidationIssue("PAYMENT_WITHOUT_CONSIGNMENTS",
                    "Payment received with zero consignments", "paidAmount", paid.amount()));
        }
        if (consignments > thresholds.highConsignmentCount()) {
            warnings.add(new ValidationIssue("HIGH_CONSIGNMENT_COUNT",
                    "Unusually high consignment count", "consignments", consignments));
        }
        if (paid.isGreaterThan(thresholds.highPaymentAmount())) {
            warnings.add(new ValidationIssue("HIGH_PAYMENT_AMOUNT",
                    "Unusually high payment amount", "paidAmount", paid.amount()));
        }
        if (paid.isNegative()) {
            errors.add(new ValidationIssue("NEGATIVE_PAYMENT",
                    "Payment amount cannot be negative", "paidAmount", paid.amount()));
        }
        return new ValidationReport(errors, warnings);
    }

    public ValidationReport validatePaymentRules(PaymentRules rules) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        rejectNegative(errors, "NEGATIVE_WEEKDAY_RATE", "Weekday rate", "weekdayRate", rules.weekdayRate());
        rejectNegative(errors, "NEGATIVE_SATURDAY_RATE", "Saturday rate", "saturdayRate", rules.saturdayRate());
        rejectNegative(errors, "NEGATIVE_UNLOADING_BONUS", "Unloading bonus", "unloadingBonus", rules.unloadingBonus());
        rejectNegative(errors, "NEGATIVE_ATTENDANCE_BONUS", "Attendance bonus", "attendanceBonus", rules.attendanceBonus());
        rejectNegative(errors, "NEGATIVE_EARLY_BONUS", "Early bonus", "earlyBonus", rules.earlyBonus());

        if (rules.saturdayRate().isLessThan(rules.weekdayRate())) {
            warnings.add(new ValidationIssue("SATURDAY_RATE_LOWER", "Saturday rate is lower than weekday rate", null,
                    Map.of("weekday", rules.weekdayRate().amount(), "saturday", rules.saturdayRate().amount())));
        }
        if (rules.weekdayRate().isGreaterThan(thresholds.highWeekdayRate())) {
            warnings.add(new ValidationIssue("HIGH_WEEKDAY_RATE", "Weekday rate seems unusually high",
                    "weekdayRate", rules.weekdayRate().amount()));
        }
        if (rules.saturdayRate().isGreaterThan(thresholds.highSaturdayRate())) {
            warnings.add(new ValidationIssue("HIGH_SATURDAY_RATE", "Saturday rate seems unusually high",
                    "saturdayRate", rules.saturdayRate().amount()));
        }
        return new ValidationReport(errors, warnings);
    }

    private void rejectNegative(List<ValidationIssue> errors, String code, String label, String field, Money value) {
        if (value.isNegative()) {
            errors.add(new ValidationIssue(code, label + " cannot be negative", field, value.amount()));
        }
    }

    private List<LocalDate> findMissingWorkingDays(DateRange period, List<DailyEntry> entries) {
        if (period == null) {
            return List.of();
        }
        Set<LocalDate> covered = entries.stream().map(DailyEntry::getDate).collect(Collectors.toSet());
        return period.workingDays().stream().filter(day -> !covered.contains(day)).toList();
    }

    private List<LocalDate> findDuplicateDates(List<DailyEntry> entries) {
        Set<LocalDate> seen = new HashSet<>();
        Set<LocalDate> duplicates = new TreeSet<>();
        for (DailyEntry entry : entries) {
            if (!seen.add(entry.getDate())) {
                duplicates.add(entry.getDate());
            }
        }
        return List.copyOf(duplicates);
    }

    private String join(List<LocalDate> dates) {
        return dates.stream().map(LocalDate::toString).collect(Collectors.joining(", "));
    }
}
