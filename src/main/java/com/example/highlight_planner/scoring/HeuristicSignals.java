package com.example.highlight_planner.scoring;

import com.example.highlight_planner.model.Segment;
import com.example.highlight_planner.util.ScoreMath;

/**
 * Cheap signals computed from the feature map, used for the pre-score and as inputs of the
 * composite score.
 */
public final class HeuristicSignals {

    private HeuristicSignals() {
    }

    public static double acoustic(Segment segment) {
        double value = 0.35 * segment.feature("rms_z", 0.0)
                + 0.25 * segment.feature("spectral_centroid_z", 0.0)
                + 0.20 * (segment.feature("speech_rate_wpm", 0.0) / 200.0)
                + 0.15 * segment.feature("spectral_flux", 0.0)
                + 0.05 * segment.feature("dramatic_pauses", 0.0);
        return ScoreMath.clamp(value);
    }

    public static double keyword(Segment segment) {
        return Math.min(Math.max(segment.keywordScore(), 0.0) / 10.0, 1.0);
    }

    public static double preScore(Segment segment) {
        return 0.6 * acoustic(segment) + 0.4 * keyword(segment);
    }

    /**
     * Stand-in for the semantic score when the assessment service is not available at all.
     */
    public static double keywordDensity(Segment segment) {
        return Math.min(Math.max(segment.keywordScore(), 0.0) / 15.0, 1.0);
    }
}
