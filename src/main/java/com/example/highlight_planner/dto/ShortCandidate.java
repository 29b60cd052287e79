package com.example.highlight_planner.dto;

public record ShortCandidate(String shortId,
                             String segmentId,
                             double t0,
                             double t1,
                             double duration,
                             double score,
                             String title) {
}
