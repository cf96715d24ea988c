package com.example.payanalyzer.domain.model;

import com.example.payanalyzer.domain.exception.InvalidMoneyException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Two-decimal fixed-point amount in pounds sterling.
 * Every instance is normalized to scale 2 with {@code HALF_UP} rounding, so equality and
 * hashing never depend on how the amount was produced. Negative values are allowed because
 * reconciliation differences can go either way.
 *
 * @param amount normalized amount
 */
public record Money(BigDecimal amount) implements Comparable<Money> {

    public static final int SCALE = 2;
    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private static final BigDecimal PENCE_PER_POUND = BigDecimal.valueOf(100);

    /**
     * Normalizes the amount to two decimals.
     *
     * @throws InvalidMoneyException when the amount is missing
     */
    public Money {
        if (amount == null) {
            throw new InvalidMoneyException("Money amount is required.");
        }
        amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Money of(BigDecimal amount) {
        return new Money(amount);
    }

    /**
     * Creates money from a floating point value, rounding to the nearest penny.
     *
     * @param amount amount in pounds
     * @return normalized money
     * @throws InvalidMoneyException when the value is NaN or infinite
     */
    public static Money of(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            throw new InvalidMoneyException("Money amount must be finite: " + amount);
        }
        return new Money(BigDecimal.valueOf(amount));
    }

    /**
     * Parses a textual amount such as {@code "1,234.50"} or {@code "£45.50"}.
     *
     * @param text amount text, optionally prefixed with the pound sign
     * @return normalized money
     * @throws InvalidMoneyException when the text is not a number
     */
    public static Money parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidMoneyException("Money amount is required.");
        }
        String cleaned = text.strip().replace("£", "").replace(",", "");
        try {
            return new Money(new BigDecimal(cleaned));
        } catch (NumberFormatException ex) {
            throw new InvalidMoneyException("Not a money amount: " + text, ex);
        }
    }

    public static Money ofPence(long pence) {
        return new Money(BigDecimal.valueOf(pence, SCALE));
    }

    @JsonValue
    @Override
    public BigDecimal amount() {
        return amount;
    }

    public Money add(Money other) {
        return new Money(amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(amount.subtract(other.amount));
    }

    public Money multiply(int count) {
        return new Money(amount.multiply(BigDecimal.valueOf(count)));
    }

    public Money multiply(BigDecimal factor) {
        return new Money(amount.multiply(factor));
    }

    /**
     * Divides the amount evenly, rounding half up to the penny.
     *
     * @param divisor positive divisor
     * @return quotient
     */
    public Money divide(int divisor) {
        if (divisor <= 0) {
            throw new InvalidMoneyException("Cannot divide money by " + divisor);
        }
        return new Money(amount.divide(BigDecimal.valueOf(divisor), SCALE, RoundingMode.HALF_UP));
    }

    public Money abs() {
        return new Money(amount.abs());
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    public Money max(Money other) {
        return compareTo(other) >= 0 ? this : other;
    }

    /**
     * @return the amount in whole pence, used wherever an integer representation is required
     */
    public long toPence() {
        return amount.multiply(PENCE_PER_POUND).longValueExact();
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @Override
    public String toString() {
        return "£" + amount.toPlainString();
    }
}
