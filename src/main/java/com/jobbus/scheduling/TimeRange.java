package com.jobbus.scheduling;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [from, to)}.
 */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("Time range must end after it starts: " + from + " - " + to);
        }
    }
}
