package com.example.highlight_planner.dto;

import java.util.List;

public record RunDiagnostics(int inputSegments,
                             List<String> rejectedSegmentIds,
                             int semanticCandidates,
                             int semanticBatches,
                             int failedSemanticBatches,
                             boolean semanticFallback,
                             double effectiveThreshold,
                             boolean percentileFallback,
                             boolean thresholdRelaxed,
                             boolean forceMerged,
                             int selected,
                             int removedByBalancer,
                             int backfilled,
                             double trimmedSeconds,
                             int dropped,
                             int toppedUp) {

    public RunDiagnostics {
        rejectedSegmentIds = rejectedSegmentIds == null ? List.of() : List.copyOf(rejectedSegmentIds);
    }

    public static RunDiagnostics inputOnly(int inputSegments, List<String> rejected) {
        return new RunDiagnostics(inputSegments, rejected, 0, 0, 0, false, 0, false, false, false,
                0, 0, 0, 0, 0, 0);
    }
}
