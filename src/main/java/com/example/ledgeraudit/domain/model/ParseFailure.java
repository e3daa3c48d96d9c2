package com.example.ledgeraudit.domain.model;

/**
 * Row that could not yield a record. Kept for manual review so no input silently disappears.
 */
public record ParseFailure(
        String documentId,
        int pageIndex,
        int rowIndex,
        Reason reason,
        String rawText
) {

    public enum Reason {
        /** No currency-shaped token on the row. */
        NO_AMOUNT,
        /** Several equally plausible amounts competed for the amount column. */
        AMBIGUOUS_AMOUNT,
        /** Payee-only line that was not followed by a row it could continue. */
        STRAY_LINE
    }
}
