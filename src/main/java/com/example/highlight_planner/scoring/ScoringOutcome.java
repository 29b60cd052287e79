package com.example.highlight_planner.scoring;

import com.example.highlight_planner.model.Segment;
import com.example.highlight_planner.model.WeightProfile;

import java.util.List;

public record ScoringOutcome(List<Segment> segments,
                             WeightProfile effectiveWeights,
                             int semanticCandidates,
                             int semanticBatches,
                             int failedSemanticBatches,
                             boolean semanticFallback) {
    public ScoringOutcome {
        segments = List.copyOf(segments);
    }
}
