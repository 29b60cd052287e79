package com.example.highlight_planner.model;

/**
 * Lexical match found in a segment transcript by the feature source.
 */
public record KeywordHit(String token, double weight) {
    public KeywordHit {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("keyword token must not be blank");
        }
        token = token.trim();
        if (!Double.isFinite(weight) || weight < 0) {
            weight = 0.0;
        }
    }
}
