package com.example.ledgeraudit.interfaces.api.dto;

import com.example.ledgeraudit.domain.model.ClaimSourceKind;
import com.example.ledgeraudit.domain.model.ClaimUnit;
import com.example.ledgeraudit.domain.model.GroupingRule;
import com.example.ledgeraudit.domain.model.Tolerance;

import java.math.BigDecimal;

/**
 * API-layer DTO for a narrative claim. Which source fields are required depends on {@code sourceKind}:
 * {@code rule} and {@code key} for buckets, {@code documentId} for documents, {@code warrantNumber} for records.
 */
public record ClaimRequest(
        String claimId,
        String assertionText,
        BigDecimal assertedValue,
        ClaimUnit unit,
        ClaimSourceKind sourceKind,
        GroupingRule rule,
        String key,
        Integer fiscalYear,
        String documentId,
        Integer pageIndex,
        String warrantNumber,
        Tolerance.Kind toleranceKind,
        BigDecimal tolerance
) {
}
