package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.domain.model.ReconciliationAmbiguity;
import com.example.ledgeraudit.domain.model.TransactionRecord;

import java.util.List;

/**
 * Canonical records after deduplication plus the ties left for manual resolution.
 */
public record ReconciliationResult(
        List<TransactionRecord> records,
        List<ReconciliationAmbiguity> ambiguities,
        int exactMerges,
        int fuzzyMerges
) {
}
