package com.example.highlight_planner.scoring;

import com.example.highlight_planner.model.ChatHistogram;
import com.example.highlight_planner.model.WeightProfile;

/**
 * Read-only inputs shared by every segment of one scoring pass.
 *
 * @param weightOverride caller supplied weights replacing the mode profile, or {@code null}
 */
public record ScoringContext(ScoringStrategy strategy,
                             WeightProfile weightOverride,
                             ChatHistogram chat,
                             String prompt,
                             double sourceDuration) {
    public ScoringContext {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        chat = chat == null ? ChatHistogram.empty() : chat;
        prompt = prompt == null ? "" : prompt.trim();
    }
}
