package com.example.payanalyzer.domain.exception;

import java.time.LocalDate;

/**
 * Raised when a period is missing a bound or ends before it starts.
 */
public class InvalidDateRangeException extends DomainException {

	/**
	 * Creates the exception for the rejected bounds.
	 *
	 * @param start requested first day
	 * @param end   requested last day
	 */
    public InvalidDateRangeException(LocalDate start, LocalDate end) {
        super("Invalid period: " + start + " to " + end);
    }

	/**
	 * Creates the exception for a date that falls outside an otherwise valid period.
	 *
	 * @param message explanation naming the date and the period
	 */
    public InvalidDateRangeException(String message) {
        super(message);
    }
}
