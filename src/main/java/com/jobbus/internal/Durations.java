package com.jobbus.internal;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

public final class Durations {

    private Durations() {
    }

    /**
     * Parses ISO-8601 durations ("PT36H") and the shorthand forms "90s", "15m", "36h" and "7d".
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration value must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unsupported duration value: " + value, e);
            }
        }

        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        long amount;
        try {
            amount = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported duration value: " + value, e);
        }
        return switch (shorthand.charAt(shorthand.length() - 1)) {
            case 's' -> Duration.ofSeconds(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("Unsupported duration value: " + value);
        };
    }
}
