package com.jobbus;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay that grows by {@code multiplier} per attempt from {@code initialDelay}, capped at {@code maxDelay}.
 */
public record ExponentialBackoff(Duration initialDelay, Duration maxDelay, double multiplier) {

    public ExponentialBackoff {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * @param attempt zero-based attempt number; negative values are treated as zero
     */
    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, attempt);
        double millis = initialDelay.toMillis() * Math.pow(multiplier, exponent);
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
