package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;

import java.util.List;

public record ReconcileOutcome(List<Clip> clips, double trimmedSeconds, int trimmedClips, int dropped, int toppedUp) {
    public ReconcileOutcome {
        clips = List.copyOf(clips);
    }

    public double totalDuration() {
        return TemporalCorridor.totalDuration(clips);
    }
}
