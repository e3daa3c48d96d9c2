package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.domain.model.ParseFailure;
import com.example.ledgeraudit.domain.model.ParsedLineItem;

/**
 * Outcome of parsing one candidate row: a line item, a skipped non-record row, or a failure kept for review.
 */
public record RowParseResult(Kind kind, ParsedLineItem item, ParseFailure failure, String skipReason) {

    public enum Kind {
        PARSED,
        SKIPPED,
        FAILED
    }

    public static RowParseResult parsed(ParsedLineItem item) {
        return new RowParseResult(Kind.PARSED, item, null, null);
    }

    public static RowParseResult skipped(String reason) {
        return new RowParseResult(Kind.SKIPPED, null, null, reason);
    }

    public static RowParseResult failed(ParseFailure failure) {
        return new RowParseResult(Kind.FAILED, null, failure, null);
    }
}
