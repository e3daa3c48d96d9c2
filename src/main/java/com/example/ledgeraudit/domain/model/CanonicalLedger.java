package com.example.ledgeraudit.domain.model;

import com.example.ledgeraudit.domain.exception.LedgerInvariantException;

import java.util.Comparator;
import java.util.List;

/**
 * Reconciled record set of one batch run, ordered by record id. Record ids are unique.
 */
public record CanonicalLedger(
        List<TransactionRecord> records,
        int recordCount,
        long netTotalMinor,
        long lowConfidenceTotalMinor,
        int lowConfidenceCount
) {

    /**
     * @throws LedgerInvariantException when two records share an id or the total overflows
     */
    public static CanonicalLedger of(List<TransactionRecord> records) {
        List<TransactionRecord> ordered = records.stream()
                .sorted(Comparator.comparing(TransactionRecord::recordId))
                .toList();
        long total = 0L;
        long lowTotal = 0L;
        int lowCount = 0;
        String previousId = null;
        try {
            for (TransactionRecord record : ordered) {
                if (record.recordId().equals(previousId)) {
                    throw new LedgerInvariantException("Duplicate record id in canonical ledger: " + previousId);
                }
                previousId = record.recordId();
                total = Math.addExact(total, record.amountMinor());
                if (record.lowConfidence()) {
                    lowTotal = Math.addExact(lowTotal, record.amountMinor());
                    lowCount++;
                }
            }
        } catch (ArithmeticException ex) {
            throw new LedgerInvariantException("Ledger total exceeds the representable range", ex);
        }
        return new CanonicalLedger(ordered, ordered.size(), total, lowTotal, lowCount);
    }
}
