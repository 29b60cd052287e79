package com.example.highlight_planner.service;

import com.example.highlight_planner.model.ChatHistogram;
import com.example.highlight_planner.model.ProcessingMode;
import com.example.highlight_planner.model.Segment;
import com.example.highlight_planner.model.WeightProfile;
import com.example.highlight_planner.selector.SelectionConfig;
import com.example.highlight_planner.selector.ShortsConfig;

import java.time.LocalDate;
import java.util.List;

/**
 * Fully validated input of one pipeline run.
 *
 * @param sourceDuration source length in seconds; 0 means derive it from the segments
 */
public record HighlightJob(ProcessingMode mode,
                           double sourceDuration,
                           List<Segment> segments,
                           List<String> rejectedSegmentIds,
                           ChatHistogram chat,
                           String prompt,
                           WeightProfile weightOverride,
                           SelectionConfig selection,
                           ShortsConfig shorts,
                           boolean splitEnabled,
                           Integer overrideParts,
                           Integer overrideTargetMinutes,
                           String baseTitle,
                           LocalDate premiereBaseDate) {

    public HighlightJob {
        segments = List.copyOf(segments);
        rejectedSegmentIds = rejectedSegmentIds == null ? List.of() : List.copyOf(rejectedSegmentIds);
        chat = chat == null ? ChatHistogram.empty() : chat;
        mode = mode == null ? ProcessingMode.POLITICAL_SESSION : mode;
    }

    public int inputCount() {
        return segments.size() + rejectedSegmentIds.size();
    }

    public double resolvedSourceDuration() {
        if (sourceDuration > 0) {
            return sourceDuration;
        }
        return segments.stream().mapToDouble(Segment::t1).max().orElse(0.0);
    }
}
