package com.example.payanalyzer.domain.exception;

/**
 * Raised when a fingerprint or a processing batch is requested for zero files.
 */
public class EmptyFileSetException extends DomainException {

	/**
	 * Creates the exception with a predefined error message.
	 */
    public EmptyFileSetException() {
        super("At least one file is required.");
    }
}
