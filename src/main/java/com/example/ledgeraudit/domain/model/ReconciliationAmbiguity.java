package com.example.ledgeraudit.domain.model;

import java.util.List;

/**
 * Fuzzy duplicate candidates that tied, left unmerged pending manual resolution.
 *
 * @param recordId          record whose best match was not unique
 * @param candidateRecordIds competing candidates with the same best score, sorted
 * @param normalizedPayee   shared payee key
 * @param amountMinor       shared amount
 * @param documentIds       documents involved, sorted
 */
public record ReconciliationAmbiguity(
        String recordId,
        List<String> candidateRecordIds,
        String normalizedPayee,
        long amountMinor,
        List<String> documentIds
) {

    public ReconciliationAmbiguity {
        candidateRecordIds = candidateRecordIds.stream().sorted().toList();
        documentIds = documentIds.stream().distinct().sorted().toList();
    }
}
