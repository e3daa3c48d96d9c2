package com.example.ledgeraudit.domain.model;

public enum Verdict {
    /** Matched value within tolerance. */
    VERIFIED,
    /** Source resolved but the value is outside tolerance. */
    MISMATCH,
    /** Cited source could not be resolved; a data gap, not a contradiction. */
    UNVERIFIABLE
}
