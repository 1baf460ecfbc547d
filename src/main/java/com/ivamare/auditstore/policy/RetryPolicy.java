package com.ivamare.auditstore.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Policy for replaying DLQ entries.
 *
 * <p>Retry counts are the number of failed replays recorded on the entry so
 * far, counted after the failure that is being handled.
 *
 * @param maxRetries Failed replays after which an entry is dead-lettered
 * @param initialBackoff Delay before the first retry
 * @param multiplier Growth factor applied per further retry
 * @param maxBackoff Upper bound on any single delay
 */
public record RetryPolicy(
    int maxRetries,
    Duration initialBackoff,
    double multiplier,
    Duration maxBackoff
) {
    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must not be shorter than initialBackoff");
        }
    }

    /**
     * Default retry policy: 5 retries, 10s doubling up to 10 minutes.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(5, Duration.ofSeconds(10), 2.0, Duration.ofMinutes(10));
    }

    /**
     * Get the delay before the entry is replayed again.
     *
     * @param retryCount Failed replays so far (1-based)
     * @return initialBackoff * multiplier^(retryCount - 1), capped at maxBackoff
     */
    public Duration getBackoff(int retryCount) {
        int exponent = Math.max(0, retryCount - 1);
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, exponent);
        if (Double.isInfinite(millis) || millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * Check if another replay should be attempted.
     *
     * @param retryCount Failed replays so far
     * @return true while the retry ceiling has not been reached
     */
    public boolean shouldRetry(int retryCount) {
        return retryCount < maxRetries;
    }
}
