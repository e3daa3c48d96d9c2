package com.example.ledgeraudit.domain.model;

/**
 * Unit of a claim's asserted value.
 */
public enum ClaimUnit {
    /** Dollars, compared against cent totals divided by 100. */
    USD,
    /** Cents. */
    USD_MINOR,
    /** Number of contributing records. */
    COUNT
}
