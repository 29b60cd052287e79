package com.example.highlight_planner.dto.web;

import com.example.highlight_planner.selector.SelectionConfig;

/**
 * Optional per-request replacements of the configured selection defaults.
 */
public record SelectionOverrides(Double minClipDuration,
                                 Double maxClipDuration,
                                 Double targetTotalDuration,
                                 Integer minClips,
                                 Integer maxClips,
                                 Double minScoreThreshold) {

    /**
     * @throws IllegalArgumentException when the combined values do not form a valid configuration
     */
    public SelectionConfig applyTo(SelectionConfig base) {
        return new SelectionConfig(
                minClipDuration != null ? minClipDuration : base.minClipDuration(),
                maxClipDuration != null ? maxClipDuration : base.maxClipDuration(),
                targetTotalDuration != null ? targetTotalDuration : base.targetTotalDuration(),
                minClips != null ? minClips : base.minClips(),
                maxClips != null ? maxClips : base.maxClips(),
                minScoreThreshold != null ? minScoreThreshold : base.minScoreThreshold(),
                base.minTimeGap(), base.smartMergeGap(), base.smartMergeMinScore(), base.positionBins(),
                base.maxClipsPerBin(), base.trimPercentage(), base.durationTolerance(),
                base.shortBurstMinDuration(), base.shortBurstMergeGap(), base.minDurationGuard(),
                base.topUpMaxClips(), base.dynamicThresholdPercentile());
    }
}
