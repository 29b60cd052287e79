package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;

import java.util.List;

public record BalanceOutcome(List<Clip> clips, int perBinCap, int minClipFloor, int removed, int backfilled) {
    public BalanceOutcome {
        clips = List.copyOf(clips);
    }
}
