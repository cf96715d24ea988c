package com.example.payanalyzer.infrastructure.exception;

/**
 * Raised by a submission history source that cannot answer right now.
 */
public class HistoryUnavailableException extends InfrastructureException {

	/**
	 * @param message which source failed
	 * @param cause   underlying failure
	 */
    public HistoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
