package com.example.ledgeraudit.domain.exception;

/**
 * Raised when the client attempts to ingest a register without providing a PDF file.
 * This is a domain-layer guard that protects downstream text-layer extraction from null inputs.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public PdfFileRequiredException() {
        super("Please choose a register PDF to upload.");
    }
}
