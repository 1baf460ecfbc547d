package com.ivamare.auditstore.ingest;

import com.ivamare.auditstore.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * State of one ingestion request as it moves through validation, parent
 * resolution and the write. Created per request and never shared between
 * requests or threads.
 */
public final class IngestContext {

    /**
     * Where the request came from.
     */
    public enum Origin {
        /** Live call from a producer */
        PRODUCER,
        /** Replay of a DLQ entry by the recovery worker */
        DLQ_REPLAY
    }

    /**
     * One violated rule.
     *
     * @param field Request field, in wire naming
     * @param code Stable reason code, used as a metric tag
     * @param message Human readable message
     */
    public record Violation(String field, String code, String message) {
    }

    private final Origin origin;
    private final List<Violation> violations = new ArrayList<>();

    private IngestContext(Origin origin) {
        this.origin = origin;
    }

    public static IngestContext forProducer() {
        return new IngestContext(Origin.PRODUCER);
    }

    public static IngestContext forReplay() {
        return new IngestContext(Origin.DLQ_REPLAY);
    }

    public Origin getOrigin() {
        return origin;
    }

    public void reject(String field, String code, String message) {
        violations.add(new Violation(field, code, message));
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    public List<Violation> getViolations() {
        return List.copyOf(violations);
    }

    /**
     * @throws ValidationException listing every recorded violation, if any
     */
    public void throwIfInvalid() {
        if (hasViolations()) {
            throw new ValidationException(violations.stream().map(Violation::message).toList());
        }
    }
}
