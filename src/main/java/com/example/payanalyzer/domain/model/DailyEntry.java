package com.example.payanalyzer.domain.model;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * One day of a payment analysis: what was delivered, what should have been paid and what was paid.
 * <p>
 * The expected total always equals {@code basePayment + pickupTotal + bonuses} and the
 * difference always equals {@code paidAmount - expectedTotal}. The only mutators are
 * {@link #updatePaidAmount(Money)} and {@link #updatePickupData(ConsignmentCount, Money)};
 * both publish the recomputed figures in a single write, so concurrent readers never observe
 * a half-applied update.
 */
public final class DailyEntry {

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private final String id;
    private final String analysisId;
    private final LocalDate date;
    private final ConsignmentCount consignments;
    private final Money rate;
    private final Money basePayment;
    private final DailyBonuses bonuses;
    private volatile Figures figures;

    /**
     * Mutable part of the entry, swapped as a whole.
     */
    private record Figures(ConsignmentCount pickups, Money pickupTotal, Money expectedTotal,
                           Money paidAmount, Money difference) {
    }

    /**
     * Creates an entry; a {@code null} base payment defaults to {@code consignments x rate}.
     *
     * @param id           entry identifier, generated when {@code null}
     * @param analysisId   owning analysis
     * @param date         calendar day
     * @param consignments delivered consignments
     * @param rate         rate per consignment for that day
     * @param basePayment  explicit base payment or {@code null}
     * @param pickups      number of pickups
     * @param pickupTotal  amount earned through pickups
     * @param bonuses      bonuses for that day
     * @param paidAmount   amount actually paid
     */
    public DailyEntry(String id,
                      String analysisId,
                      LocalDate date,
                      ConsignmentCount consignments,
                      Money rate,
                      Money basePayment,
                      ConsignmentCount pickups,
                      Money pickupTotal,
                      DailyBonuses bonuses,
                      Money paidAmount) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.analysisId = analysisId;
        this.date = Objects.requireNonNull(date, "date");
        this.consignments = Objects.requireNonNull(consignments, "consignments");
        this.rate = Objects.requireNonNull(rate, "rate");
        this.basePayment = basePayment != null ? basePayment : rate.multiply(consignments.value());
        this.bonuses = bonuses != null ? bonuses : DailyBonuses.NONE;
        this.figures = computeFigures(
                pickups != null ? pickups : ConsignmentCount.ZERO,
                pickupTotal != null ? pickupTotal : Money.ZERO,
                Objects.requireNonNull(paidAmount, "paidAmount"));
    }

    /**
     * Rebuilds an entry from its flat view. Expected total, difference and status are
     * recomputed rather than trusted.
     *
     * @param snapshot flat view
     * @return equivalent entry
     */
    public static DailyEntry fromSnapshot(DailyEntrySnapshot snapshot) {
        return new DailyEntry(
                snapshot.id(),
                snapshot.analysisId(),
                snapshot.date(),
                ConsignmentCount.of(snapshot.consignments()),
                money(snapshot.rate()),
                snapshot.basePayment() != null ? Money.of(snapshot.basePayment()) : null,
                ConsignmentCount.of(snapshot.pickups()),
                money(snapshot.pickupTotal()),
                new DailyBonuses(money(snapshot.unloadingBonus()), money(snapshot.attendanceBonus()),
                        money(snapshot.earlyBonus())),
                money(snapshot.paidAmount())
        );
    }

    private static Money money(BigDecimal amount) {
        return amount != null ? Money.of(amount) : Money.ZERO;
    }

    private Figures computeFigures(ConsignmentCount pickups, Money pickupTotal, Money paidAmount) {
        Money expected = basePayment.add(pickupTotal).add(bonuses.total());
        return new Figures(pickups, pickupTotal, expected, paidAmount, paidAmount.subtract(expected));
    }

    public synchronized void updatePaidAmount(Money amount) {
        Objects.requireNonNull(amount, "amount");
        Figures current = figures;
        figures = computeFigures(current.pickups(), current.pickupTotal(), amount);
    }

    public synchronized void updatePickupData(ConsignmentCount count, Money total) {
        Objects.requireNonNull(count, "count");
        Objects.requireNonNull(total, "total");
        figures = computeFigures(count, total, figures.paidAmount());
    }

    public DailyEntrySnapshot toSnapshot() {
        Figures current = figures;
        return new DailyEntrySnapshot(
                id,
                analysisId,
                date,
                getDayName(),
                consignments.value(),
                rate.amount(),
                basePayment.amount(),
                current.pickups().value(),
                current.pickupTotal().amount(),
                bonuses.unloading().amount(),
                bonuses.attendance().amount(),
                bonuses.early().amount(),
                current.expectedTotal().amount(),
                current.paidAmount().amount(),
                current.difference().amount(),
                PaymentStatus.of(current.difference())
        );
    }

    public String getId() {
        return id;
    }

    public String getAnalysisId() {
        return analysisId;
    }

    public LocalDate getDate() {
        return date;
    }

    public DayOfWeek getDayOfWeek() {
        return date.getDayOfWeek();
    }

    public String getDayName() {
        return date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.UK);
    }

    public String getDateFormatted() {
        return DISPLAY_FORMAT.format(date);
    }

    /**
     * @return {@code true} for every day except Sunday
     */
    public boolean isWorkingDay() {
        return date.getDayOfWeek() != DayOfWeek.SUNDAY;
    }

    public ConsignmentCount getConsignments() {
        return consignments;
    }

    public Money getRate() {
        return rate;
    }

    public Money getBasePayment() {
        return basePayment;
    }

    public DailyBonuses getBonuses() {
        return bonuses;
    }

    public Money getUnloadingBonus() {
        return bonuses.unloading();
    }

    public Money getAttendanceBonus() {
        return bonuses.attendance();
    }

    public Money getEarlyBonus() {
        return bonuses.early();
    }

    public Money getTotalBonus() {
        return bonuses.total();
    }

    public ConsignmentCount getPickups() {
        return figures.pickups();
    }

    public Money getPickupTotal() {
        return figures.pickupTotal();
    }

    public Money getExpectedTotal() {
        return figures.expectedTotal();
    }

    public Money getPaidAmount() {
        return figures.paidAmount();
    }

    public Money getDifference() {
        return figures.difference();
    }

    public PaymentStatus getStatus() {
        return PaymentStatus.of(figures.difference());
    }

    @Override
    public String toString() {
        Figures current = figures;
        return "DailyEntry[" + date + ", consignments=" + consignments + ", expected=" + current.expectedTotal()
                + ", paid=" + current.paidAmount() + "]";
    }
}
