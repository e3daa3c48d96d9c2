package com.example.ledgeraudit.domain.model;

import com.example.ledgeraudit.domain.exception.InvalidClaimException;

import java.math.BigDecimal;

/**
 * Numeric assertion taken from a narrative document. Read-only to the pipeline.
 * An incomplete source is kept; verification reports it as unverifiable.
 */
public record Claim(
        String claimId,
        String assertionText,
        BigDecimal assertedValue,
        ClaimUnit unit,
        ClaimSource source,
        Tolerance tolerance
) {

    public Claim {
        if (claimId == null || claimId.isBlank()) {
            throw new InvalidClaimException(null, "claim id is required");
        }
        if (assertedValue == null) {
            throw new InvalidClaimException(claimId, "asserted value is required");
        }
        source = source == null ? ClaimSource.unspecified() : source;
        unit = unit == null ? ClaimUnit.USD : unit;
        tolerance = tolerance == null ? new Tolerance(Tolerance.Kind.ABSOLUTE, BigDecimal.ZERO) : tolerance;
    }
}
