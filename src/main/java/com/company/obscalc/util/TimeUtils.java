package com.company.obscalc.util;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public class TimeUtils {

    /**
     * Truncate to the precision stored by the database (microseconds), so a
     * value read back compares equal to the value written.
     */
    public static Instant toDbPrecision(Instant instant) {
        if (instant == null) return null;
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    public static Instant max(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    /**
     * True when {@code candidate} is strictly later than {@code reference}; a
     * missing reference counts as infinitely old.
     */
    public static boolean isAfter(Instant candidate, Instant reference) {
        if (candidate == null) return false;
        return reference == null || candidate.isAfter(reference);
    }

    public static String formatDuration(Duration duration) {
        if (duration == null) return null;

        long durationMs = duration.toMillis();
        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else {
            return String.format("%ds", seconds);
        }
    }
}
