package com.example.ledgeraudit.domain.exception;

/**
 * Raised when a source document descriptor cannot be accepted into a batch
 * (missing identifier, inverted reporting period, unknown document type).
 */
public class InvalidDocumentException extends DomainException {

	/**
	 * Creates the exception naming the offending document.
	 *
	 * @param documentId identifier of the document, may be {@code null}
	 * @param reason     what is wrong with the descriptor
	 */
    public InvalidDocumentException(String documentId, String reason) {
        super("Invalid source document" + (documentId != null ? " " + documentId : "") + ": " + reason);
    }
}
