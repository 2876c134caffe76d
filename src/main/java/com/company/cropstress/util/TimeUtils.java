package com.company.cropstress.util;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public class TimeUtils {

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    /**
     * Fractional days between two instants; acquisitions are irregularly spaced, so trend slopes
     * are measured against this rather than against sample position.
     */
    public static double elapsedDays(Instant origin, Instant instant) {
        if (origin == null || instant == null) return Double.NaN;
        return Duration.between(origin, instant).toMillis() / MILLIS_PER_DAY;
    }

    /**
     * Elapsed days of every instant relative to the first one.
     */
    public static double[] elapsedDays(List<Instant> instants) {
        double[] days = new double[instants.size()];
        if (instants.isEmpty()) return days;

        Instant origin = instants.get(0);
        for (int i = 0; i < days.length; i++) {
            days[i] = elapsedDays(origin, instants.get(i));
        }
        return days;
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long minutes = durationMs / 60000;
        long seconds = (durationMs % 60000) / 1000;
        long millis = durationMs % 1000;

        if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else if (seconds > 0) {
            return String.format("%d.%03ds", seconds, millis);
        } else {
            return String.format("%dms", millis);
        }
    }
}
