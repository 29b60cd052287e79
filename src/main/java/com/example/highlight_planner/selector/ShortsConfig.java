package com.example.highlight_planner.selector;

public record ShortsConfig(boolean enabled, double minDuration, double maxDuration, int count) {
    public ShortsConfig {
        if (minDuration <= 0 || minDuration >= maxDuration)
            throw new IllegalArgumentException("shorts minDuration must be > 0 and < maxDuration");
        if (count < 1)
            throw new IllegalArgumentException("shorts count must be >= 1");
    }

    public static ShortsConfig defaults() {
        return new ShortsConfig(true, 8, 58, 10);
    }
}
