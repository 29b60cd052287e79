package com.example.highlight_planner.dto;

import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.ProcessingMode;
import com.example.highlight_planner.model.SplitPlan;
import com.example.highlight_planner.model.WeightProfile;
import com.example.highlight_planner.util.RunStatus;

import java.util.List;
import java.util.UUID;

/**
 * Outcome handed to the export consumer: final clips in chronological order, optional split plan
 * with populated parts, and how the run got there.
 */
public record HighlightResult(UUID runId,
                              RunStatus status,
                              String message,
                              ProcessingMode mode,
                              double sourceDuration,
                              List<Clip> clips,
                              double totalDuration,
                              List<ShortCandidate> shorts,
                              WeightProfile effectiveWeights,
                              SplitPlan splitPlan,
                              RunDiagnostics diagnostics) {

    public HighlightResult {
        clips = clips == null ? List.of() : List.copyOf(clips);
        shorts = shorts == null ? List.of() : List.copyOf(shorts);
    }

    public static HighlightResult noCandidates(UUID runId, ProcessingMode mode, double sourceDuration,
                                               RunDiagnostics diagnostics) {
        return new HighlightResult(runId, RunStatus.NO_CANDIDATES,
                "No valid segments to select from; lower the threshold or add more source signal",
                mode, sourceDuration, List.of(), 0, List.of(), null, null, diagnostics);
    }

    public static HighlightResult cancelled(UUID runId, ProcessingMode mode, String stage) {
        return new HighlightResult(runId, RunStatus.CANCELLED, "Cancelled before " + stage,
                mode, 0, List.of(), 0, List.of(), null, null, null);
    }
}
