package com.example.highlight_planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A scored segment, or a merge of several, promoted into the output set.
 *
 * <p>{@code clipId} and {@code title} are assigned once the final set is known.
 * {@code trimmedSeconds} records how much of the tail the duration reconciler removed.</p>
 */
public record Clip(String id,
                   double t0,
                   double t1,
                   double score,
                   List<String> mergedFrom,
                   String transcript,
                   List<KeywordHit> keywords,
                   SubScores subscores,
                   String clipId,
                   String title,
                   double trimmedSeconds) {

    public static final Comparator<Clip> BY_START = Comparator.comparingDouble(Clip::t0).thenComparing(Clip::id);
    public static final Comparator<Clip> BY_SCORE_DESC = Comparator.comparingDouble(Clip::score).reversed()
            .thenComparingDouble(Clip::t0)
            .thenComparing(Clip::id);

    public Clip {
        if (t1 <= t0) {
            throw new IllegalArgumentException("clip " + id + " must satisfy t1 > t0");
        }
        mergedFrom = mergedFrom == null ? List.of() : List.copyOf(mergedFrom);
        transcript = transcript == null ? "" : transcript;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        subscores = subscores == null ? SubScores.ZERO : subscores;
    }

    public static Clip of(Segment segment) {
        if (!segment.isScored()) {
            throw new IllegalStateException("segment " + segment.id() + " has no final score");
        }
        return new Clip(segment.id(), segment.t0(), segment.t1(), segment.finalScore(), List.of(),
                segment.transcript(), segment.keywords(), segment.subscores(), null, null, 0.0);
    }

    @JsonProperty("duration")
    public double duration() {
        return t1 - t0;
    }

    /**
     * Number of source segments this clip covers.
     */
    public int constituents() {
        return mergedFrom.isEmpty() ? 1 : mergedFrom.size();
    }

    /**
     * Joins this clip with a later one. The span runs from this start to the later end, so any
     * gap between them is part of the merged duration. The score is the mean over all constituents.
     */
    public Clip mergeWith(Clip next) {
        int left = constituents();
        int right = next.constituents();
        double mergedScore = (score * left + next.score * right) / (left + right);

        List<String> ids = new ArrayList<>(left + right);
        ids.addAll(mergedFrom.isEmpty() ? List.of(id) : mergedFrom);
        ids.addAll(next.mergedFrom.isEmpty() ? List.of(next.id) : next.mergedFrom);

        String text = transcript.isBlank() ? next.transcript
                : next.transcript.isBlank() ? transcript
                : transcript + " " + next.transcript;

        return new Clip(id + "+" + next.id, Math.min(t0, next.t0), Math.max(t1, next.t1), mergedScore, ids, text,
                mergeKeywords(keywords, next.keywords), SubScores.weightedMean(subscores, left, next.subscores, right),
                null, null, trimmedSeconds + next.trimmedSeconds);
    }

    public Clip withEnd(double newEnd) {
        double removed = t1 - newEnd;
        return new Clip(id, t0, newEnd, score, mergedFrom, transcript, keywords, subscores, clipId, title,
                trimmedSeconds + removed);
    }

    public Clip withLabel(String newClipId, String newTitle) {
        return new Clip(id, t0, t1, score, mergedFrom, transcript, keywords, subscores, newClipId, newTitle,
                trimmedSeconds);
    }

    private static List<KeywordHit> mergeKeywords(List<KeywordHit> a, List<KeywordHit> b) {
        Map<String, Double> best = new LinkedHashMap<>();
        for (KeywordHit hit : a) {
            best.merge(hit.token(), hit.weight(), Math::max);
        }
        for (KeywordHit hit : b) {
            best.merge(hit.token(), hit.weight(), Math::max);
        }
        List<KeywordHit> merged = new ArrayList<>();
        best.forEach((token, weight) -> merged.add(new KeywordHit(token, weight)));
        merged.sort(Comparator.comparingDouble(KeywordHit::weight).reversed().thenComparing(KeywordHit::token));
        return merged;
    }
}
