package com.example.ledgeraudit.domain.model;

/**
 * Cited evidence of a claim.
 * <ul>
 *     <li>{@code BUCKET}: aggregation rule plus key, optionally narrowed to one fiscal year</li>
 *     <li>{@code DOCUMENT}: all records sourced from a document, optionally one page</li>
 *     <li>{@code RECORD}: the records carrying a warrant or check number, summed</li>
 * </ul>
 * A source without a kind cannot be resolved and verifies as {@link ClaimResolutionGap#SOURCE_NOT_SPECIFIED}.
 */
public record ClaimSource(
        ClaimSourceKind kind,
        GroupingRule rule,
        String key,
        Integer fiscalYear,
        String documentId,
        Integer pageIndex,
        String warrantNumber
) {

    public static ClaimSource unspecified() {
        return new ClaimSource(null, null, null, null, null, null, null);
    }

    public static ClaimSource bucket(GroupingRule rule, String key) {
        return new ClaimSource(ClaimSourceKind.BUCKET, rule, key, null, null, null, null);
    }

    public static ClaimSource bucket(GroupingRule rule, String key, Integer fiscalYear) {
        return new ClaimSource(ClaimSourceKind.BUCKET, rule, key, fiscalYear, null, null, null);
    }

    public static ClaimSource document(String documentId, Integer pageIndex) {
        return new ClaimSource(ClaimSourceKind.DOCUMENT, null, null, null, documentId, pageIndex, null);
    }

    public static ClaimSource record(String warrantNumber) {
        return new ClaimSource(ClaimSourceKind.RECORD, null, null, null, null, null, warrantNumber);
    }
}
