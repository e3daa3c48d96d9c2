package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.domain.model.TransactionRecord;

import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Scores how plausibly two records from different documents describe the same payment.
 * Payee key and amount must be equal, dates at most {@code window} days apart, document sets disjoint
 * and warrant numbers must not conflict. Closer dates score higher.
 */
public class DuplicateScorer {

    private final int window;

    public DuplicateScorer(int window) {
        this.window = window;
    }

    /**
     * @return score in {@code [1, window + 1]}, empty when the pair is not a candidate
     */
    public OptionalInt score(TransactionRecord left, TransactionRecord right) {
        if (left.recordId().equals(right.recordId())
                || left.amountMinor() != right.amountMinor()
                || !left.normalizedPayee().equals(right.normalizedPayee())) {
            return OptionalInt.empty();
        }
        if (left.warrantOrCheckNumber() != null && right.warrantOrCheckNumber() != null
                && !left.warrantOrCheckNumber().equals(right.warrantOrCheckNumber())) {
            return OptionalInt.empty();
        }
        Set<String> shared = new HashSet<>(left.allDocumentIds());
        shared.retainAll(right.allDocumentIds());
        if (!shared.isEmpty()) {
            return OptionalInt.empty();
        }
        long days = Math.abs(ChronoUnit.DAYS.between(left.transactionDate(), right.transactionDate()));
        if (days > window) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) (window + 1 - days));
    }
}
