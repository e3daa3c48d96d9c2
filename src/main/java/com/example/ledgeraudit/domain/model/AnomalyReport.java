package com.example.ledgeraudit.domain.model;

import java.util.List;

/**
 * Side channel of everything that did not flow cleanly into the ledger.
 *
 * @param auditLogFailure why the verdicts could not be appended to the audit log, {@code null} when they were
 */
public record AnomalyReport(
        List<ParseFailure> parseFailures,
        List<ValidationRejection> rejections,
        List<ReconciliationAmbiguity> ambiguities,
        List<DocumentError> documentErrors,
        List<WarrantNumberGap> warrantGaps,
        String auditLogFailure
) {

    public AnomalyReport {
        parseFailures = List.copyOf(parseFailures);
        rejections = List.copyOf(rejections);
        ambiguities = List.copyOf(ambiguities);
        documentErrors = List.copyOf(documentErrors);
        warrantGaps = List.copyOf(warrantGaps);
    }
}
