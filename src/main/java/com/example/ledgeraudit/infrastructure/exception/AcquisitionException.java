package com.example.ledgeraudit.infrastructure.exception;

/**
 * Page text for a document could not be obtained. Document-scoped and retryable: acquisition is
 * idempotent, so the pipeline may simply invoke the source again.
 */
public class AcquisitionException extends InfrastructureException {

	/**
	 * @param documentId document whose text was requested
	 * @param message    what failed
	 * @param cause      I/O or engine failure, may be {@code null}
	 */
    public AcquisitionException(String documentId, String message, Throwable cause) {
        super("Page text unavailable for " + documentId + ": " + message, cause);
    }
}
