package com.jobbus;

import java.time.Duration;
import java.util.Objects;

/**
 * Dead-letter retry settings for one subscription.
 * <p>
 * A dead-lettered message with {@code retriesCount < maxRetryCount} is resubmitted after
 * {@link #getDelay(int)}; anything beyond is forwarded to {@code permanentErrorsTopic}.
 *
 * @param <T> topic enum of the bus
 */
public final class RetryPolicy<T extends Enum<T>> {

    private final T permanentErrorsTopic;
    private final ExponentialBackoff backoff;
    private final int maxRetryCount;

    public RetryPolicy(T permanentErrorsTopic, ExponentialBackoff backoff, int maxRetryCount) {
        this.permanentErrorsTopic = Objects.requireNonNull(permanentErrorsTopic, "permanentErrorsTopic must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        if (maxRetryCount < 0) {
            throw new IllegalArgumentException("maxRetryCount must be >= 0");
        }
        this.maxRetryCount = maxRetryCount;
    }

    /**
     * Doubles the delay on every retry, starting from {@code initialDelay}.
     */
    public static <T extends Enum<T>> RetryPolicy<T> exponential(
            T permanentErrorsTopic, Duration initialDelay, Duration maxDelay, int maxRetryCount) {
        return new RetryPolicy<>(permanentErrorsTopic, new ExponentialBackoff(initialDelay, maxDelay, 2.0d),
                maxRetryCount);
    }

    public Duration getDelay(int retryCount) {
        return backoff.delayFor(retryCount);
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public T getPermanentErrorsTopic() {
        return permanentErrorsTopic;
    }

    public ExponentialBackoff getBackoff() {
        return backoff;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetryCount=" + maxRetryCount + ", backoff=" + backoff
                + ", permanentErrorsTopic=" + permanentErrorsTopic + "}";
    }
}
