package com.ivamare.auditstore.repository;

/**
 * @param total Matching traces
 * @param successful Matching traces with execution status {@code completed}
 */
public record ExecutionCounts(long total, long successful) {

    public static final ExecutionCounts EMPTY = new ExecutionCounts(0, 0);

    public ExecutionCounts {
        if (total < 0 || successful < 0 || successful > total) {
            throw new IllegalArgumentException(
                "invalid counts: total=" + total + ", successful=" + successful);
        }
    }

    public long failed() {
        return total - successful;
    }
}
