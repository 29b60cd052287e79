package com.example.highlight_planner.engine.Interfaces;

import com.example.highlight_planner.dto.SemanticItem;
import com.example.highlight_planner.engine.SemanticAssessmentException;

import java.util.List;
import java.util.Map;

/**
 * External judge of how interesting a transcript fragment is.
 */
public interface SemanticAssessor {
    /**
     * @return semantic score in [0,1] per item id; ids missing from the map were not scored
     * @throws SemanticAssessmentException when the whole batch could not be assessed
     */
    Map<String, Double> assess(List<SemanticItem> batch);
}
