package com.example.ledgeraudit.application.service;

import com.example.ledgeraudit.domain.model.TransactionRecord;
import com.example.ledgeraudit.domain.model.ValidationRejection;

/**
 * Either a canonical record or the reason it was rejected.
 */
public record ValidationOutcome(TransactionRecord record, ValidationRejection rejection) {

    public static ValidationOutcome accepted(TransactionRecord record) {
        return new ValidationOutcome(record, null);
    }

    public static ValidationOutcome rejected(ValidationRejection rejection) {
        return new ValidationOutcome(null, rejection);
    }

    public boolean accepted() {
        return record != null;
    }
}
