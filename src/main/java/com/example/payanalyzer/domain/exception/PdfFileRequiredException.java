package com.example.payanalyzer.domain.exception;

/**
 * Raised when an upload flow runs without any PDF content.
 * Guards downstream parsing logic from null or empty inputs.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public PdfFileRequiredException() {
        super("Please choose at least one PDF file to upload.");
    }
}
