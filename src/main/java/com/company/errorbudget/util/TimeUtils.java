package com.company.errorbudget.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public class TimeUtils {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private TimeUtils() {
    }

    /**
     * Fractional hours from {@code from} to {@code to}; negative when {@code to} is earlier.
     */
    public static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_HOUR;
    }

    public static Instant plusHours(Instant instant, double hours) {
        return instant.plusMillis(Math.round(hours * MILLIS_PER_HOUR));
    }

    /**
     * Human-readable span for forecast messages, e.g. "45 minutes", "9.0 hours", "2.5 days".
     */
    public static String formatHours(double hours) {
        if (hours < 1.0) {
            return (int) (hours * 60) + " minutes";
        }
        if (hours < 24.0) {
            return String.format(Locale.ROOT, "%.1f hours", hours);
        }
        if (hours < 72.0) {
            return String.format(Locale.ROOT, "%.1f days", hours / 24.0);
        }
        return (int) (hours / 24.0) + " days";
    }
}
