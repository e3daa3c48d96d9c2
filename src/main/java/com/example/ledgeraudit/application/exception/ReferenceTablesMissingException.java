package com.example.ledgeraudit.application.exception;

/**
 * Structural failure: the account-code reference table is absent or empty. This is the only
 * condition that aborts a whole batch run.
 */
public class ReferenceTablesMissingException extends ApplicationException {

    private final String location;

	/**
	 * @param location configured location of the reference table
	 */
    public ReferenceTablesMissingException(String location) {
        super("Reference tables are missing or empty: " + location);
        this.location = location;
    }

	/**
	 * @param location configured location of the reference table
	 * @param cause    read failure
	 */
    public ReferenceTablesMissingException(String location, Throwable cause) {
        super("Reference tables could not be read: " + location, cause);
        this.location = location;
    }

    public String location() {
        return location;
    }
}
