package com.example.payanalyzer.domain.model;

/**
 * Reconciliation verdict derived from the sign of {@code paid - expected}.
 */
public enum PaymentStatus {
    BALANCED,
    OVERPAID,
    UNDERPAID;

    public static PaymentStatus of(Money difference) {
        if (difference.isZero()) {
            return BALANCED;
        }
        return difference.isPositive() ? OVERPAID : UNDERPAID;
    }
}
