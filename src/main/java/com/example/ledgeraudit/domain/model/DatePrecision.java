package com.example.ledgeraudit.domain.model;

/**
 * How a transaction date was obtained.
 */
public enum DatePrecision {
    /** Read from the row itself. */
    EXACT,
    /** Inherited from the nearest dated row above on the same page. */
    INHERITED,
    /** Row carried no date; the record is dated at the end of the document's reporting period. */
    PERIOD_ONLY
}
