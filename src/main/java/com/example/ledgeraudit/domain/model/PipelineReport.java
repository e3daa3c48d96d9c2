package com.example.ledgeraudit.domain.model;

import java.util.List;

/**
 * Complete output of one batch run. Contains no timestamps so identical input serializes identically.
 */
public record PipelineReport(
        String runFingerprint,
        int documentCount,
        int failedDocumentCount,
        CanonicalLedger ledger,
        AggregationIndex aggregation,
        VerificationReport verification,
        List<ControlTotalCheck> controlTotals,
        AnomalyReport anomalies
) {

    public PipelineReport {
        controlTotals = List.copyOf(controlTotals);
    }
}
