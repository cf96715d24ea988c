package com.example.payanalyzer.infrastructure.exception;

/**
 * Raised when a daily entry cannot be written to or read from JSON.
 */
public class EntrySerializationException extends InfrastructureException {

	/**
	 * @param message what was being converted
	 * @param cause   underlying Jackson failure
	 */
    public EntrySerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
