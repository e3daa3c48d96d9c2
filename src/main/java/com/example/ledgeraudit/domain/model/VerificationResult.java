package com.example.ledgeraudit.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Verdict for one claim plus the evidence needed to re-derive the matched number.
 *
 * @param claimId           claim identifier
 * @param verdict           outcome
 * @param unit              unit of all numeric fields
 * @param assertedValue     value stated by the claim
 * @param matchedValue      value found in the ledger, {@code null} when unverifiable
 * @param delta             {@code matched - asserted}, {@code null} when unverifiable
 * @param toleranceUsed     allowance in claim units
 * @param evidenceRecordIds contributing record ids, sorted
 * @param evidencePointer   bucket key, document id or record id the value came from
 * @param gapReason         reason for an unverifiable verdict, otherwise {@code null}
 */
public record VerificationResult(
        String claimId,
        Verdict verdict,
        ClaimUnit unit,
        BigDecimal assertedValue,
        BigDecimal matchedValue,
        BigDecimal delta,
        BigDecimal toleranceUsed,
        List<String> evidenceRecordIds,
        String evidencePointer,
        ClaimResolutionGap gapReason
) {

    public VerificationResult {
        evidenceRecordIds = evidenceRecordIds == null ? List.of() : evidenceRecordIds.stream().sorted().toList();
    }

    public static VerificationResult unverifiable(Claim claim, BigDecimal toleranceUsed, String pointer, ClaimResolutionGap gap) {
        return new VerificationResult(claim.claimId(), Verdict.UNVERIFIABLE, claim.unit(), claim.assertedValue(),
                null, null, toleranceUsed, List.of(), pointer, gap);
    }
}
