package com.example.ledgeraudit.domain.model;

/**
 * Bucket definitions available to the aggregation index.
 */
public enum GroupingRule {
    /** Normalized payee across all fiscal years. */
    PAYEE,
    /** Normalized payee within one fiscal year, key {@code PAYEE|FY}. */
    PAYEE_FISCAL_YEAR,
    /** Object-code category name, or {@code UNCATEGORIZED}. */
    ACCOUNT_CATEGORY,
    /** Starting calendar year of the fiscal year, {@code 2025} for FY2025-26. */
    FISCAL_YEAR,
    /** Calendar month of the transaction date, {@code yyyy-MM}. */
    FISCAL_MONTH
}
