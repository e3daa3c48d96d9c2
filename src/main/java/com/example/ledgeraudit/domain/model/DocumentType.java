package com.example.ledgeraudit.domain.model;

/**
 * Kind of source document. Detailed registers list individual warrants; vendor summaries list
 * per-vendor totals without dates or warrant numbers.
 */
public enum DocumentType {
    DETAILED_REGISTER,
    VENDOR_SUMMARY
}
