package com.example.payanalyzer.domain.model;

import com.example.payanalyzer.domain.exception.InvalidDateRangeException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A payment analysis over one period: the daily entries plus their aggregate totals.
 * Entries are kept in date order with at most one entry per date.
 */
public class Analysis {

    private final String id;
    private final String userId;
    private final String fingerprint;
    private final AnalysisSource source;
    private final DateRange period;
    private final int rulesVersion;
    private final Instant createdAt;
    private final Clock clock;
    private final List<DailyEntry> dailyEntries = new ArrayList<>();
    private AnalysisStatus status;
    private Instant updatedAt;

    public Analysis(String id,
                    String userId,
                    String fingerprint,
                    AnalysisSource source,
                    DateRange period,
                    int rulesVersion,
                    Clock clock) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.userId = userId;
        this.fingerprint = fingerprint;
        this.source = Objects.requireNonNull(source, "source");
        this.period = Objects.requireNonNull(period, "period");
        this.rulesVersion = rulesVersion;
        this.clock = clock;
        this.status = AnalysisStatus.PENDING;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    /**
     * Adds an entry, replacing any existing entry for the same date.
     *
     * @param entry entry to add
     * @throws InvalidDateRangeException when the entry date is outside the analysis period
     */
    public synchronized void addDailyEntry(DailyEntry entry) {
        if (!period.contains(entry.getDate())) {
            throw new InvalidDateRangeException("Daily entry date " + entry.getDate()
                    + " is outside analysis period " + period.formatRange());
        }
        dailyEntries.removeIf(existing -> existing.getDate().equals(entry.getDate()));
        dailyEntries.add(entry);
        dailyEntries.sort(Comparator.comparing(DailyEntry::getDate));
        touch();
    }

    public synchronized void removeDailyEntry(LocalDate date) {
        if (dailyEntries.removeIf(existing -> existing.getDate().equals(date))) {
            touch();
        }
    }

    public synchronized Optional<DailyEntry> getDailyEntry(LocalDate date) {
        return dailyEntries.stream().filter(entry -> entry.getDate().equals(date)).findFirst();
    }

    public synchronized List<DailyEntry> getDailyEntries() {
        return List.copyOf(dailyEntries);
    }

    public synchronized void updateStatus(AnalysisStatus status) {
        this.status = Objects.requireNonNull(status, "status");
        touch();
    }

    public synchronized boolean isComplete() {
        return status == AnalysisStatus.COMPLETED && !dailyEntries.isEmpty();
    }

    public synchronized boolean hasErrors() {
        return status == AnalysisStatus.ERROR;
    }

    public long getWorkingDaysCount() {
        return getDailyEntries().stream().filter(DailyEntry::isWorkingDay).count();
    }

    public ConsignmentCount getTotalConsignments() {
        return getDailyEntries().stream()
                .map(DailyEntry::getConsignments)
                .reduce(ConsignmentCount.ZERO, ConsignmentCount::add);
    }

    public Money getBaseTotal() {
        return getDailyEntries().stream().map(DailyEntry::getBasePayment).reduce(Money.ZERO, Money::add);
    }

    public Money getBonusTotal() {
        return getDailyEntries().stream().map(DailyEntry::getTotalBonus).reduce(Money.ZERO, Money::add);
    }

    public Money getPickupTotal() {
        return getDailyEntries().stream().map(DailyEntry::getPickupTotal).reduce(Money.ZERO, Money::add);
    }

    public Money getExpectedTotal() {
        return getDailyEntries().stream().map(DailyEntry::getExpectedTotal).reduce(Money.ZERO, Money::add);
    }

    public Money getPaidTotal() {
        return getDailyEntries().stream().map(DailyEntry::getPaidAmount).reduce(Money.ZERO, Money::add);
    }

    public Money getDifferenceTotal() {
        return getPaidTotal().subtract(getExpectedTotal());
    }

    public PaymentStatus getOverallStatus() {
        return PaymentStatus.of(getDifferenceTotal());
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public AnalysisSource getSource() {
        return source;
    }

    public synchronized AnalysisStatus getStatus() {
        return status;
    }

    public DateRange getPeriod() {
        return period;
    }

    public int getRulesVersion() {
        return rulesVersion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    private void touch() {
        updatedAt = clock.instant();
    }
}
