package com.ivamare.auditstore.exception;

/**
 * Raised for transient storage failures (connection loss, timeouts, shutdown).
 *
 * <p>The ingestion gateway absorbs this exception by queueing the event in the DLQ.
 */
public class StorageUnavailableException extends AuditStoreException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
