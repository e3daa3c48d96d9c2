package com.example.ledgeraudit.application.port;

import com.example.ledgeraudit.domain.model.VerificationResult;

import java.util.List;

/**
 * Append-only record of verification runs. Entries are never rewritten so consecutive runs can be diffed.
 */
public interface VerificationAuditLog {

    /**
     * Appends the results of one run.
     *
     * @param runFingerprint content hash of the ledger and claims the run verified
     * @param results        results in claim order
     */
    void append(String runFingerprint, List<VerificationResult> results);
}
