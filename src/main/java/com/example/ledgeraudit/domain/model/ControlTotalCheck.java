package com.example.ledgeraudit.domain.model;

import java.math.BigDecimal;

/**
 * Comparison of a document's stated control total against the ledger records it sourced.
 *
 * @param documentId          document stating the totals
 * @param statedTotalMinor    stated net total in cents, {@code null} when only a count was stated
 * @param ledgerTotalMinor    net total of records whose provenance includes the document
 * @param differenceMinor     {@code ledger - stated}, {@code null} without a stated total
 * @param percentDifference   absolute difference as a percentage of the stated total, {@code null} without a stated total
 * @param statedCount         stated item count, optional
 * @param ledgerCount         number of ledger records whose provenance includes the document
 * @param withinTolerance     {@code true} when every stated figure is within the configured tolerance
 */
public record ControlTotalCheck(
        String documentId,
        Long statedTotalMinor,
        long ledgerTotalMinor,
        Long differenceMinor,
        BigDecimal percentDifference,
        Integer statedCount,
        int ledgerCount,
        boolean withinTolerance
) {
}
