package com.example.highlight_planner.selector;

/**
 * Validated knobs of the selector, the coverage balancer and the duration reconciler.
 * Durations are in seconds.
 */
public record SelectionConfig(double minClipDuration,
                              double maxClipDuration,
                              double targetTotalDuration,
                              int minClips,
                              int maxClips,
                              double minScoreThreshold,
                              double minTimeGap,
                              double smartMergeGap,
                              double smartMergeMinScore,
                              int positionBins,
                              int maxClipsPerBin,
                              double trimPercentage,
                              double durationTolerance,
                              double shortBurstMinDuration,
                              double shortBurstMergeGap,
                              double minDurationGuard,
                              int topUpMaxClips,
                              double dynamicThresholdPercentile) {

    public SelectionConfig {
        requirePositive("minClipDuration", minClipDuration);
        requirePositive("maxClipDuration", maxClipDuration);
        requirePositive("targetTotalDuration", targetTotalDuration);
        requirePositive("shortBurstMinDuration", shortBurstMinDuration);
        requirePositive("minDurationGuard", minDurationGuard);
        requireNonNegative("minTimeGap", minTimeGap);
        requireNonNegative("smartMergeGap", smartMergeGap);
        requireNonNegative("shortBurstMergeGap", shortBurstMergeGap);

        if (minClipDuration >= maxClipDuration)
            throw new IllegalArgumentException("minClipDuration must be < maxClipDuration");
        if (minClips < 1)
            throw new IllegalArgumentException("minClips must be >= 1");
        if (maxClips < 1)
            throw new IllegalArgumentException("maxClips must be >= 1");
        if (targetTotalDuration < minClipDuration * minClips)
            throw new IllegalArgumentException("targetTotalDuration must be >= minClipDuration * minClips");
        if (minScoreThreshold < 0 || minScoreThreshold > 1)
            throw new IllegalArgumentException("minScoreThreshold must be in [0,1]");
        if (smartMergeMinScore < 0 || smartMergeMinScore > 1)
            throw new IllegalArgumentException("smartMergeMinScore must be in [0,1]");
        if (positionBins < 1)
            throw new IllegalArgumentException("positionBins must be >= 1");
        if (maxClipsPerBin < 1)
            throw new IllegalArgumentException("maxClipsPerBin must be >= 1");
        if (trimPercentage <= 0 || trimPercentage >= 1)
            throw new IllegalArgumentException("trimPercentage must be in (0,1)");
        if (durationTolerance < 1)
            throw new IllegalArgumentException("durationTolerance must be >= 1");
        if (topUpMaxClips < 1)
            throw new IllegalArgumentException("topUpMaxClips must be >= 1");
        if (dynamicThresholdPercentile <= 0 || dynamicThresholdPercentile > 100)
            throw new IllegalArgumentException("dynamicThresholdPercentile must be in (0,100]");
    }

    public static SelectionConfig defaults() {
        return new SelectionConfig(90, 180, 900, 8, 15, 0.25, 30, 5, 0.6, 5, 4,
                0.15, 1.1, 8, 3, 10, 40, 80);
    }

    public SelectionConfig withTargetTotalDuration(double target) {
        return new SelectionConfig(minClipDuration, maxClipDuration, target, minClips, maxClips,
                minScoreThreshold, minTimeGap, smartMergeGap, smartMergeMinScore, positionBins, maxClipsPerBin,
                trimPercentage, durationTolerance, shortBurstMinDuration, shortBurstMergeGap, minDurationGuard,
                topUpMaxClips, dynamicThresholdPercentile);
    }

    public SelectionConfig withMinScoreThreshold(double threshold) {
        return new SelectionConfig(minClipDuration, maxClipDuration, targetTotalDuration, minClips, maxClips,
                threshold, minTimeGap, smartMergeGap, smartMergeMinScore, positionBins, maxClipsPerBin,
                trimPercentage, durationTolerance, shortBurstMinDuration, shortBurstMergeGap, minDurationGuard,
                topUpMaxClips, dynamicThresholdPercentile);
    }

    /** Upper bound the greedy selection never exceeds. */
    public double selectionCeiling() {
        return targetTotalDuration * 1.2;
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0)
            throw new IllegalArgumentException(name + " must be > 0");
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0)
            throw new IllegalArgumentException(name + " must be >= 0");
    }
}
