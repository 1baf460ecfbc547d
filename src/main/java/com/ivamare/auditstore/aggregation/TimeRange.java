package com.ivamare.auditstore.aggregation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Allow-listed look-back windows for success-rate queries.
 */
public enum TimeRange {
    ONE_HOUR("1h", Duration.ofHours(1)),
    ONE_DAY("24h", Duration.ofHours(24)),
    SEVEN_DAYS("7d", Duration.ofDays(7)),
    THIRTY_DAYS("30d", Duration.ofDays(30)),
    NINETY_DAYS("90d", Duration.ofDays(90));

    public static final TimeRange DEFAULT = SEVEN_DAYS;

    private final String value;
    private final Duration duration;

    TimeRange(String value, Duration duration) {
        this.value = value;
        this.duration = duration;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Duration getDuration() {
        return duration;
    }

    public static Optional<TimeRange> fromValue(String value) {
        return Arrays.stream(values())
            .filter(r -> r.value.equals(value))
            .findFirst();
    }

    /**
     * @return the accepted wire values, comma separated
     */
    public static String allowedValues() {
        return Arrays.stream(values()).map(TimeRange::getValue).collect(Collectors.joining(", "));
    }
}
