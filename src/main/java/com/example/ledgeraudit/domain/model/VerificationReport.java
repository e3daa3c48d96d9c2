package com.example.ledgeraudit.domain.model;

import java.util.List;

/**
 * One result per input claim, in input order.
 */
public record VerificationReport(List<VerificationResult> results, Summary summary) {

    public record Summary(int total, int verified, int mismatch, int unverifiable) {
    }

    public static VerificationReport of(List<VerificationResult> results) {
        int verified = 0;
        int mismatch = 0;
        int unverifiable = 0;
        for (VerificationResult result : results) {
            switch (result.verdict()) {
                case VERIFIED -> verified++;
                case MISMATCH -> mismatch++;
                case UNVERIFIABLE -> unverifiable++;
            }
        }
        return new VerificationReport(List.copyOf(results), new Summary(results.size(), verified, mismatch, unverifiable));
    }
}
