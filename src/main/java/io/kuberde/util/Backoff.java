package io.kuberde.util;

import java.time.Duration;

/**
 * Exponential backoff schedule. Attempt 0 waits {@code initial}, each further attempt multiplies by
 * {@code multiplier} up to {@code max}.
 */
public record Backoff(Duration initial, Duration max, double multiplier) {
    public Backoff {
        if (initial == null || initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial backoff must be positive");
        }
        if (max == null || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max backoff must be >= initial");
        }
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("backoff multiplier must be >= 1");
        }
    }

    public static Backoff of(long initialMs, long maxMs, double multiplier) {
        return new Backoff(Duration.ofMillis(initialMs), Duration.ofMillis(maxMs), multiplier);
    }

    public Duration delayForAttempt(int attempt) {
        int safeAttempt = Math.max(0, attempt);
        double delay = initial.toMillis() * Math.pow(multiplier, safeAttempt);
        long capped = delay >= max.toMillis() ? max.toMillis() : (long) delay;
        return Duration.ofMillis(capped);
    }
}
