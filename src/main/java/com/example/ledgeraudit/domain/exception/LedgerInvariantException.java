package com.example.ledgeraudit.domain.exception;

/**
 * Signals that a canonical ledger structure was about to be built in a state that breaks its invariants,
 * such as an aggregate bucket whose stored total differs from the sum of its contributing records.
 */
public class LedgerInvariantException extends DomainException {

    public LedgerInvariantException(String message) {
        super(message);
    }

    public LedgerInvariantException(String message, Throwable cause) {
        super(message, cause);
    }
}
