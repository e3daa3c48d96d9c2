package com.example.ledgeraudit.domain.model;

/**
 * Why a claim could not be resolved against the ledger.
 */
public enum ClaimResolutionGap {
    SOURCE_NOT_SPECIFIED,
    GROUPING_RULE_NOT_INDEXED,
    BUCKET_NOT_FOUND,
    DOCUMENT_NOT_FOUND,
    NO_RECORDS_FOR_SOURCE,
    RECORD_NOT_FOUND
}
