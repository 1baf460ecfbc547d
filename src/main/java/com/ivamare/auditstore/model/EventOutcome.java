package com.ivamare.auditstore.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Outcome reported by the producer of an audit event.
 */
public enum EventOutcome {
    SUCCESS("success"),
    FAILURE("failure"),
    PENDING("pending");

    private final String value;

    EventOutcome(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse a wire value.
     *
     * @param value lower-case outcome as sent by producers
     * @return the outcome, or empty if the value is not recognised
     */
    public static Optional<EventOutcome> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(o -> o.value.equals(value))
            .findFirst();
    }
}
