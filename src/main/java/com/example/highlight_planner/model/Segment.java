package com.example.highlight_planner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Atomic unit of source time as delivered by the feature source, optionally carrying the
 * composite score assigned by the aggregator.
 *
 * <p>{@code features} holds open-ended numeric attributes (e.g. {@code rms_z},
 * {@code keyword_score}); everything the pipeline reads on every stage is a typed component.</p>
 */
public record Segment(String id,
                      double t0,
                      double t1,
                      String transcript,
                      Map<String, Double> features,
                      List<KeywordHit> keywords,
                      SubScores subscores,
                      Double finalScore) {

    public static final String KEYWORD_SCORE = "keyword_score";
    public static final String POSITION_IN_VIDEO = "position_in_video";

    public Segment {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("segment id must not be blank");
        }
        if (!Double.isFinite(t0) || !Double.isFinite(t1)) {
            throw new IllegalArgumentException("segment " + id + " has non-finite bounds");
        }
        if (t1 <= t0) {
            throw new IllegalArgumentException("segment " + id + " must satisfy t1 > t0");
        }
        if (finalScore != null && (!Double.isFinite(finalScore) || finalScore < 0 || finalScore > 1)) {
            throw new IllegalArgumentException("segment " + id + " finalScore must be in [0,1]");
        }
        transcript = transcript == null ? "" : transcript;
        features = features == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(features));
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        subscores = subscores == null ? SubScores.ZERO : subscores;
    }

    public static Segment unscored(String id, double t0, double t1, String transcript,
                                   Map<String, Double> features, List<KeywordHit> keywords) {
        return new Segment(id, t0, t1, transcript, features, keywords, SubScores.ZERO, null);
    }

    @JsonProperty("duration")
    public double duration() {
        return t1 - t0;
    }

    public double feature(String name, double fallback) {
        Double value = features.get(name);
        return value == null || !Double.isFinite(value) ? fallback : value;
    }

    public double keywordScore() {
        return feature(KEYWORD_SCORE, 0.0);
    }

    @JsonIgnore
    public boolean isScored() {
        return finalScore != null;
    }

    public Segment withScores(SubScores scores, double score) {
        return new Segment(id, t0, t1, transcript, features, keywords, scores, score);
    }
}
