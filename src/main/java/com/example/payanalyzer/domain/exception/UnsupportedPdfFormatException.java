package com.example.payanalyzer.domain.exception;

/**
 * Raised when the uploaded file does not resemble a PDF by MIME type or header.
 * This protects the extractors from receiving unsupported formats.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF uploads are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
