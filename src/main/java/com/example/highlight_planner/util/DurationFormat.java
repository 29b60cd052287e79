package com.example.highlight_planner.util;

public final class DurationFormat {

    private DurationFormat() {
    }

    /**
     * Formats seconds as {@code 1h 5m}, {@code 12m 30s} or {@code 45s}.
     */
    public static String readable(double seconds) {
        long total = Math.max(0, Math.round(seconds));
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long secs = total % 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        if (minutes > 0) {
            return minutes + "m " + secs + "s";
        }
        return secs + "s";
    }
}
