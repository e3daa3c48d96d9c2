package com.example.ledgeraudit.domain.exception;

/**
 * Raised when a narrative claim is structurally unusable, e.g. it has no asserted value or cites no source.
 * A claim that is well formed but cannot be resolved is not an error; it becomes an unverifiable verdict.
 */
public class InvalidClaimException extends DomainException {

	/**
	 * Creates the exception naming the offending claim.
	 *
	 * @param claimId identifier of the claim, may be {@code null}
	 * @param reason  what is missing or malformed
	 */
    public InvalidClaimException(String claimId, String reason) {
        super("Invalid claim" + (claimId != null ? " " + claimId : "") + ": " + reason);
    }
}
