package com.example.ledgeraudit.domain.model;

/**
 * Document-scoped failure. The document's rows are excluded from the batch; siblings are unaffected.
 */
public record DocumentError(
        String documentId,
        Kind kind,
        String message,
        int attempts
) {

    public enum Kind {
        /** Page text could not be obtained after all retries. */
        ACQUISITION,
        /** Text was obtained but the document could not be processed. */
        PROCESSING,
        /** Processing did not finish within the configured timeout. */
        TIMEOUT
    }
}
