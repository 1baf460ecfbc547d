package com.ivamare.auditstore.exception;

/**
 * Base exception for all audit store errors.
 */
public class AuditStoreException extends RuntimeException {

    public AuditStoreException(String message) {
        super(message);
    }

    public AuditStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
