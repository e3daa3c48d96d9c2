package com.example.ledgeraudit.infrastructure.exception;

/**
 * The verification audit log could not be appended to.
 */
public class AuditLogException extends InfrastructureException {

    public AuditLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
