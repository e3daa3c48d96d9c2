package com.example.ledgeraudit.domain.model;

/**
 * Markers raised during line-item parsing. They never drop a row; ambiguity markers lower its provenance confidence.
 */
public enum ParseFlag {
    MULTIPLE_AMOUNT_CANDIDATES(true),
    MULTIPLE_DATE_CANDIDATES(true),
    DATE_DEFAULTED_TO_PERIOD(false),
    DATE_INHERITED(true),
    UNKNOWN_ACCOUNT_CODE(false),
    CONTINUATION_MERGED(true),
    WARRANT_CONTINUED(false),
    DEGRADED_LAYOUT(false);

    private final boolean ambiguity;

    ParseFlag(boolean ambiguity) {
        this.ambiguity = ambiguity;
    }

    public boolean ambiguity() {
        return ambiguity;
    }
}
