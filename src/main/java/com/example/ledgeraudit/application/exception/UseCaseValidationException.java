package com.example.ledgeraudit.application.exception;

/**
 * Signals that a pipeline or export request is unusable as submitted.
 * Controllers translate this exception into HTTP 400 responses unless a subclass maps elsewhere.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
