package com.ivamare.auditstore.aggregation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Statistical trust in a success rate, from the sample count alone.
 *
 * <pre>
 * total >= 100       HIGH
 * 20 <= total < 100  MEDIUM
 * 5 <= total < 20    LOW
 * total < 5          INSUFFICIENT_DATA
 * </pre>
 */
public enum ConfidenceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    INSUFFICIENT_DATA("insufficient_data");

    static final long HIGH_THRESHOLD = 100;
    static final long MEDIUM_THRESHOLD = 20;
    static final long LOW_THRESHOLD = 5;

    private final String value;

    ConfidenceLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ConfidenceLevel forSampleCount(long total) {
        if (total >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (total >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        if (total >= LOW_THRESHOLD) {
            return LOW;
        }
        return INSUFFICIENT_DATA;
    }
}
