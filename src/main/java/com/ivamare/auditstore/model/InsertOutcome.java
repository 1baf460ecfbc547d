package com.ivamare.auditstore.model;

/**
 * Result of inserting an audit event into the store.
 */
public enum InsertOutcome {
    /** Row was written. */
    CREATED,
    /** An event with the same id already exists; nothing was written. */
    DUPLICATE
}
