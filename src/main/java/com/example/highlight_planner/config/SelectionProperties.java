package com.example.highlight_planner.config;

import com.example.highlight_planner.selector.SelectionConfig;
import com.example.highlight_planner.selector.ShortsConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for the selector, coverage balancer and duration reconciler. Converted into a validated
 * {@link SelectionConfig} per run.
 */
@ConfigurationProperties(prefix = "highlight.selection")
public class SelectionProperties {

    private double minClipDuration = 90;
    private double maxClipDuration = 180;
    private double targetTotalDuration = 900;
    private int minClips = 8;
    private int maxClips = 15;
    private double minScoreThreshold = 0.25;
    private double minTimeGap = 30;
    private double smartMergeGap = 5;
    private double smartMergeMinScore = 0.6;
    private int positionBins = 5;
    private int maxClipsPerBin = 4;
    private double trimPercentage = 0.15;
    private double durationTolerance = 1.1;
    private double shortBurstMinDuration = 8;
    private double shortBurstMergeGap = 3;
    private double minDurationGuard = 10;
    private int topUpMaxClips = 40;
    private double dynamicThresholdPercentile = 80;

    private Shorts shorts = new Shorts();

    public SelectionConfig toConfig() {
        return new SelectionConfig(minClipDuration, maxClipDuration, targetTotalDuration, minClips, maxClips,
                minScoreThreshold, minTimeGap, smartMergeGap, smartMergeMinScore, positionBins, maxClipsPerBin,
                trimPercentage, durationTolerance, shortBurstMinDuration, shortBurstMergeGap, minDurationGuard,
                topUpMaxClips, dynamicThresholdPercentile);
    }

    public double getMinClipDuration() {
        return minClipDuration;
    }

    public void setMinClipDuration(double minClipDuration) {
        this.minClipDuration = minClipDuration;
    }

    public double getMaxClipDuration() {
        return maxClipDuration;
    }

    public void setMaxClipDuration(double maxClipDuration) {
        this.maxClipDuration = maxClipDuration;
    }

    public double getTargetTotalDuration() {
        return targetTotalDuration;
    }

    public void setTargetTotalDuration(double targetTotalDuration) {
        this.targetTotalDuration = targetTotalDuration;
    }

    public int getMinClips() {
        return minClips;
    }

    public void setMinClips(int minClips) {
        this.minClips = minClips;
    }

    public int getMaxClips() {
        return maxClips;
    }

    public void setMaxClips(int maxClips) {
        this.maxClips = maxClips;
    }

    public double getMinScoreThreshold() {
        return minScoreThreshold;
    }

    public void setMinScoreThreshold(double minScoreThreshold) {
        this.minScoreThreshold = minScoreThreshold;
    }

    public double getMinTimeGap() {
        return minTimeGap;
    }

    public void setMinTimeGap(double minTimeGap) {
        this.minTimeGap = minTimeGap;
    }

    public double getSmartMergeGap() {
        return smartMergeGap;
    }

    public void setSmartMergeGap(double smartMergeGap) {
        this.smartMergeGap = smartMergeGap;
    }

    public double getSmartMergeMinScore() {
        return smartMergeMinScore;
    }

    public void setSmartMergeMinScore(double smartMergeMinScore) {
        this.smartMergeMinScore = smartMergeMinScore;
    }

    public int getPositionBins() {
        return positionBins;
    }

    public void setPositionBins(int positionBins) {
        this.positionBins = positionBins;
    }

    public int getMaxClipsPerBin() {
        return maxClipsPerBin;
    }

    public void setMaxClipsPerBin(int maxClipsPerBin) {
        this.maxClipsPerBin = maxClipsPerBin;
    }

    public double getTrimPercentage() {
        return trimPercentage;
    }

    public void setTrimPercentage(double trimPercentage) {
        this.trimPercentage = trimPercentage;
    }

    public double getDurationTolerance() {
        return durationTolerance;
    }

    public void setDurationTolerance(double durationTolerance) {
        this.durationTolerance = durationTolerance;
    }

    public double getShortBurstMinDuration() {
        return shortBurstMinDuration;
    }

    public void setShortBurstMinDuration(double shortBurstMinDuration) {
        this.shortBurstMinDuration = shortBurstMinDuration;
    }

    public double getShortBurstMergeGap() {
        return shortBurstMergeGap;
    }

    public void setShortBurstMergeGap(double shortBurstMergeGap) {
        this.shortBurstMergeGap = shortBurstMergeGap;
    }

    public double getMinDurationGuard() {
        return minDurationGuard;
    }

    public void setMinDurationGuard(double minDurationGuard) {
        this.minDurationGuard = minDurationGuard;
    }

    public int getTopUpMaxClips() {
        return topUpMaxClips;
    }

    public void setTopUpMaxClips(int topUpMaxClips) {
        this.topUpMaxClips = topUpMaxClips;
    }

    public double getDynamicThresholdPercentile() {
        return dynamicThresholdPercentile;
    }

    public void setDynamicThresholdPercentile(double dynamicThresholdPercentile) {
        this.dynamicThresholdPercentile = dynamicThresholdPercentile;
    }

    public Shorts getShorts() {
        return shorts;
    }

    public void setShorts(Shorts shorts) {
        this.shorts = shorts;
    }

    /**
     * Vertical short-form candidates picked alongside the main reel.
     */
    public static class Shorts {
        private boolean enabled = true;
        private double minDuration = 8;
        private double maxDuration = 58;
        private int count = 10;

        public ShortsConfig toConfig() {
            return new ShortsConfig(enabled, minDuration, maxDuration, count);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getMinDuration() {
            return minDuration;
        }

        public void setMinDuration(double minDuration) {
            this.minDuration = minDuration;
        }

        public double getMaxDuration() {
            return maxDuration;
        }

        public void setMaxDuration(double maxDuration) {
            this.maxDuration = maxDuration;
        }

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }
    }
}
