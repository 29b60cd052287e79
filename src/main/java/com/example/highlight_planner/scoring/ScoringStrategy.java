package com.example.highlight_planner.scoring;

import com.example.highlight_planner.model.ProcessingMode;
import com.example.highlight_planner.model.WeightProfile;

/**
 * Mode-specific scoring behaviour injected into the {@link SignalAggregator}.
 */
public interface ScoringStrategy {

    ProcessingMode mode();

    WeightProfile defaultWeights();

    /**
     * Whether this mode relies on chat activity. Only such modes move the chat weight onto the other
     * signals when the histogram is empty.
     */
    boolean expectsChat();

    default WeightProfile effectiveWeights(WeightProfile override, boolean chatAvailable) {
        WeightProfile base = override != null ? override : defaultWeights();
        if (expectsChat() && !chatAvailable) {
            return base.withoutChat();
        }
        return base;
    }
}
