package com.example.ledgeraudit.application.exception;

/**
 * Thrown when a batch submits no documents, repeats a document id, or cites an unknown grouping rule.
 */
public class BatchRequestValidationException extends UseCaseValidationException {

    public BatchRequestValidationException(String message) {
        super(message);
    }
}
