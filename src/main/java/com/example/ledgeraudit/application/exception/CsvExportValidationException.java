package com.example.ledgeraudit.application.exception;

/**
 * Dedicated exception for ledger CSV export problems within the application layer.
 * Thrown when a run produced nothing that could be exported.
 */
public class CsvExportValidationException extends UseCaseValidationException {

	/**
	 * Creates a new exception describing why the export request is invalid.
	 *
	 * @param message validation message suitable for display
	 */
    public CsvExportValidationException(String message) {
        super(message);
    }
}
