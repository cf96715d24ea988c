package com.example.payanalyzer.domain.model;

import com.example.payanalyzer.domain.exception.InvalidCountException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Non-negative whole number of consignments handled on a day.
 *
 * @param value count, never negative
 */
public record ConsignmentCount(int value) implements Comparable<ConsignmentCount> {

    public static final ConsignmentCount ZERO = new ConsignmentCount(0);

    public ConsignmentCount {
        if (value < 0) {
            throw new InvalidCountException(value);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ConsignmentCount of(int value) {
        return new ConsignmentCount(value);
    }

    /**
     * Accepts a decimal value only when it has no fractional part.
     *
     * @param value numeric input, for instance from a JSON body
     * @return count
     * @throws InvalidCountException when the value is fractional, negative or not finite
     */
    public static ConsignmentCount of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
            throw new InvalidCountException(value);
        }
        if (value > Integer.MAX_VALUE) {
            throw new InvalidCountException(value);
        }
        return new ConsignmentCount((int) value);
    }

    /**
     * Parses a textual count such as {@code "12"}; {@code "12.0"} is accepted, {@code "12.5"} is not.
     *
     * @param text raw text
     * @return count
     * @throws InvalidCountException when the text is not a non-negative whole number
     */
    public static ConsignmentCount parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidCountException(text);
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(text.strip());
        } catch (NumberFormatException ex) {
            throw new InvalidCountException(text, ex);
        }
        try {
            return new ConsignmentCount(parsed.intValueExact());
        } catch (ArithmeticException ex) {
            throw new InvalidCountException(text, ex);
        }
    }

    @JsonValue
    @Override
    public int value() {
        return value;
    }

    public ConsignmentCount add(ConsignmentCount other) {
        return new ConsignmentCount(value + other.value);
    }

    public boolean isZero() {
        return value == 0;
    }

    public boolean isGreaterThan(int threshold) {
        return value > threshold;
    }

    @Override
    public int compareTo(ConsignmentCount other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
