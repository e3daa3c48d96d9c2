package com.example.ledgeraudit.domain.model;

/**
 * Parsed row that violated a ledger invariant.
 */
public record ValidationRejection(
        String documentId,
        int pageIndex,
        int rowIndex,
        Reason reason,
        String detail,
        String rawText
) {

    public enum Reason {
        UNPARSEABLE_AMOUNT,
        DATE_OUTSIDE_FISCAL_YEAR,
        EMPTY_PAYEE
    }
}
