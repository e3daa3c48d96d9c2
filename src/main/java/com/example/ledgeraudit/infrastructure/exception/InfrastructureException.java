package com.example.ledgeraudit.infrastructure.exception;

/**
 * Base unchecked exception for adapter concerns (OCR output, PDF text layers, the audit log file).
 * Keeps adapter failures isolated from the ledger language.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * Creates a new infrastructure exception while preserving the root cause.
	 *
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
