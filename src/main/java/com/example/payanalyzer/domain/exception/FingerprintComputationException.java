package com.example.payanalyzer.domain.exception;

/**
 * Raised when a canonical payload cannot be serialized or digested.
 */
public class FingerprintComputationException extends DomainException {

	/**
	 * @param message which payload failed
	 * @param cause   serializer or digest failure
	 */
    public FingerprintComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
