package com.example.highlight_planner.dto.web;

import java.util.List;
import java.util.Map;

/**
 * Segment as delivered by the feature source. Validated per item so one bad segment does not
 * fail the request.
 */
public record SegmentInput(String id,
                           Double t0,
                           Double t1,
                           String transcript,
                           Map<String, Double> features,
                           List<KeywordInput> keywords) {
}
