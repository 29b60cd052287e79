package com.example.highlight_planner.scoring;

import com.example.highlight_planner.config.ScoringProperties;
import com.example.highlight_planner.model.ProcessingMode;
import com.example.highlight_planner.model.WeightProfile;
import org.springframework.stereotype.Component;

/**
 * Parliamentary sessions: what is said matters most, chat is rarely present.
 */
@Component
public class PoliticalSessionScoringStrategy implements ScoringStrategy {

    private final WeightProfile weights;

    public PoliticalSessionScoringStrategy(ScoringProperties properties) {
        this.weights = properties.getPoliticalSession().toProfile();
    }

    @Override
    public ProcessingMode mode() {
        return ProcessingMode.POLITICAL_SESSION;
    }

    @Override
    public WeightProfile defaultWeights() {
        return weights;
    }

    @Override
    public boolean expectsChat() {
        return false;
    }
}
