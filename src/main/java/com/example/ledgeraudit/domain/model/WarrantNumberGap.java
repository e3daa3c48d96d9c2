package com.example.ledgeraudit.domain.model;

/**
 * Missing run of warrant numbers between two consecutive numbers of the same series in one document.
 */
public record WarrantNumberGap(
        String documentId,
        String series,
        String before,
        String after,
        long missingCount
) {
}
