package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;

import java.util.List;

/**
 * @param clips           accepted clips after smart merging, chronological
 * @param candidatePool   score and duration filtered candidates, the backfill source of the balancer
 * @param broadPool       every clip after short-burst merging, the top-up source of the reconciler
 * @param effectiveThreshold score threshold actually applied (after percentile fallback or relaxation)
 */
public record SelectionOutcome(List<Clip> clips,
                               List<Clip> candidatePool,
                               List<Clip> broadPool,
                               double effectiveThreshold,
                               boolean percentileFallback,
                               boolean thresholdRelaxed,
                               boolean forceMerged) {

    public SelectionOutcome {
        clips = List.copyOf(clips);
        candidatePool = List.copyOf(candidatePool);
        broadPool = List.copyOf(broadPool);
    }

    public static SelectionOutcome empty(double threshold) {
        return new SelectionOutcome(List.of(), List.of(), List.of(), threshold, false, false, false);
    }
}
