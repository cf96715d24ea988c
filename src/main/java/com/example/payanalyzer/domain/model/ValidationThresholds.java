package com.example.payanalyzer.domain.model;

/**
 * Limits above which otherwise valid data is reported as unusual.
 *
 * @param highConsignmentCount daily consignment count considered unusually high
 * @param highPaymentAmount    daily paid amount considered unusually high
 * @param largeDiscrepancy     absolute daily difference considered large
 * @param highWeekdayRate      weekday rate considered unusually high
 * @param highSaturdayRate     Saturday rate considered unusually high
 */
public record ValidationThresholds(
        int highConsignmentCount,
        Money highPaymentAmount,
        Money largeDiscrepancy,
        Money highWeekdayRate,
        Money highSaturdayRate
) {

    public static ValidationThresholds defaults() {
        return new ValidationThresholds(200, Money.of(1000), Money.of(50), Money.of(10), Money.of(15));
    }
}
