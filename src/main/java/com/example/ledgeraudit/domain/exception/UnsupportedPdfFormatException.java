package com.example.ledgeraudit.domain.exception;

/**
 * Raised when the uploaded file does not resemble a PDF according to the domain rules.
 * This protects the text-layer reader from receiving unsupported formats.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF registers are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
