package com.example.ledgeraudit.domain.model;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * Candidate transaction produced by the line-item parser, before validation and canonicalization.
 * The amount is kept as text so the validator owns the decimal conversion.
 */
public record ParsedLineItem(
        String documentId,
        int pageIndex,
        int rowIndex,
        String payeeName,
        String amountText,
        boolean voided,
        LocalDate transactionDate,
        DatePrecision datePrecision,
        String warrantNumber,
        String accountCode,
        boolean accountCodeKnown,
        String accountCategory,
        double confidence,
        boolean degraded,
        Set<ParseFlag> flags,
        String rawText
) {

    public ParsedLineItem {
        flags = flags == null || flags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(flags));
    }
}
