package com.example.highlight_planner.scoring;

public interface PromptSimilarityScorer {
    /**
     * @return similarity in [0,1]; 0 for an empty prompt
     */
    double similarity(String prompt, String transcript);
}
