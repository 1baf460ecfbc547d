package com.ivamare.auditstore.exception;

import java.util.List;

/**
 * Raised when an inbound event or query is malformed or misses required fields.
 *
 * <p>Validation failures are caller-fixable and are never retried by the gateway.
 */
public class ValidationException extends AuditStoreException {

    private final List<String> violations;

    public ValidationException(String violation) {
        this(List.of(violation));
    }

    public ValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
