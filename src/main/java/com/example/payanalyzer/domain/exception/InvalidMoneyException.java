package com.example.payanalyzer.domain.exception;

/**
 * Raised when an amount cannot be represented as a two-decimal money value.
 */
public class InvalidMoneyException extends DomainException {

	/**
	 * @param message what was wrong with the amount
	 */
    public InvalidMoneyException(String message) {
        super(message);
    }

	/**
	 * @param message what was wrong with the amount
	 * @param cause   parse failure
	 */
    public InvalidMoneyException(String message, Throwable cause) {
        super(message, cause);
    }
}
