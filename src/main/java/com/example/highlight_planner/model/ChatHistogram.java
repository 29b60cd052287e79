package com.example.highlight_planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Per-second chat message counts. Read-only for the duration of a run.
 */
public final class ChatHistogram {

    private static final ChatHistogram EMPTY = new ChatHistogram(new TreeMap<>());

    private final NavigableMap<Integer, Integer> counts;

    private ChatHistogram(NavigableMap<Integer, Integer> counts) {
        this.counts = Collections.unmodifiableNavigableMap(counts);
    }

    public static ChatHistogram empty() {
        return EMPTY;
    }

    /**
     * Copies the given counts, ignoring negative seconds and non-positive counts.
     */
    public static ChatHistogram of(Map<Integer, Integer> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        TreeMap<Integer, Integer> copy = new TreeMap<>();
        raw.forEach((second, count) -> {
            if (second != null && count != null && second >= 0 && count > 0) {
                copy.merge(second, count, Integer::sum);
            }
        });
        return copy.isEmpty() ? EMPTY : new ChatHistogram(copy);
    }

    public int count(int second) {
        return counts.getOrDefault(second, 0);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public int totalMessages() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @JsonValue
    public Map<Integer, Integer> asMap() {
        return counts;
    }
}
