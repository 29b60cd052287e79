package com.example.highlight_planner.scoring;

import com.example.highlight_planner.model.ProcessingMode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ScoringStrategyRegistry {

    private final Map<ProcessingMode, ScoringStrategy> strategies = new EnumMap<>(ProcessingMode.class);

    public ScoringStrategyRegistry(List<ScoringStrategy> strategies) {
        for (ScoringStrategy strategy : strategies) {
            ScoringStrategy previous = this.strategies.put(strategy.mode(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scoring strategy for mode " + strategy.mode());
            }
        }
    }

    public ScoringStrategy forMode(ProcessingMode mode) {
        ScoringStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalArgumentException("No scoring strategy for mode " + mode);
        }
        return strategy;
    }
}
