package com.example.highlight_planner.scoring;

import com.example.highlight_planner.config.ScoringProperties;
import com.example.highlight_planner.model.ProcessingMode;
import com.example.highlight_planner.model.WeightProfile;
import org.springframework.stereotype.Component;

/**
 * Live stream VODs: chat reaction is the dominant signal.
 */
@Component
public class StreamScoringStrategy implements ScoringStrategy {

    private final WeightProfile weights;

    public StreamScoringStrategy(ScoringProperties properties) {
        this.weights = properties.getStream().toProfile();
    }

    @Override
    public ProcessingMode mode() {
        return ProcessingMode.STREAM;
    }

    @Override
    public WeightProfile defaultWeights() {
        return weights;
    }

    @Override
    public boolean expectsChat() {
        return true;
    }
}
