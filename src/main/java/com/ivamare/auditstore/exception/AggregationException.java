package com.ivamare.auditstore.exception;

/**
 * Raised when a success-rate aggregation cannot be computed.
 */
public class AggregationException extends AuditStoreException {

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
