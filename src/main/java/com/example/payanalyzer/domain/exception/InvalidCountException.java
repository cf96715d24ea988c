package com.example.payanalyzer.domain.exception;

/**
 * Raised when a consignment count is negative, fractional or not a number at all.
 */
public class InvalidCountException extends DomainException {

	/**
	 * Creates the exception and echoes the rejected input.
	 *
	 * @param value raw value supplied by the caller
	 */
    public InvalidCountException(Object value) {
        super("Consignment count must be a non-negative whole number: " + value);
    }

	/**
	 * Creates the exception for unparsable text, keeping the parse failure as cause.
	 *
	 * @param value raw text supplied by the caller
	 * @param cause number format failure
	 */
    public InvalidCountException(Object value, Throwable cause) {
        super("Consignment count must be a non-negative whole number: " + value, cause);
    }
}
