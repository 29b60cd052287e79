package com.example.highlight_planner.selector;

import com.example.highlight_planner.dto.ShortCandidate;
import com.example.highlight_planner.model.Segment;
import com.example.highlight_planner.util.Percentiles;
import com.example.highlight_planner.util.TitleText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Picks short vertical-format candidates straight from the scored segments.
 */
@Component
public class ShortsSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortsSelector.class);

    static final int TITLE_MAX_LENGTH = 100;
    private static final int TRANSCRIPT_TITLE_WORDS = 10;
    private static final int TRANSCRIPT_TITLE_CHARS = 50;

    public List<ShortCandidate> select(List<Segment> scored, double threshold, double percentile, ShortsConfig cfg) {
        if (!cfg.enabled() || scored.isEmpty()) {
            return List.of();
        }
        List<Segment> eligible = new ArrayList<>();
        for (Segment segment : scored) {
            if (segment.isScored() && segment.duration() >= cfg.minDuration() && segment.duration() <= cfg.maxDuration()) {
                eligible.add(segment);
            }
        }
        if (eligible.isEmpty()) {
            LOGGER.debug("SHORTS no segment within {}-{}s", cfg.minDuration(), cfg.maxDuration());
            return List.of();
        }

        List<Segment> passing = eligible.stream().filter(s -> s.finalScore() >= threshold).collect(Collectors.toList());
        if (passing.isEmpty()) {
            double cut = Percentiles.linear(eligible.stream().map(Segment::finalScore).toList(), percentile);
            passing = eligible.stream().filter(s -> s.finalScore() >= cut).collect(Collectors.toList());
        }

        passing.sort(Comparator.comparingDouble((Segment s) -> s.finalScore()).reversed()
                .thenComparingDouble(Segment::t0)
                .thenComparing(Segment::id));
        List<Segment> top = new ArrayList<>(passing.subList(0, Math.min(cfg.count(), passing.size())));
        top.sort(Comparator.comparingDouble(Segment::t0).thenComparing(Segment::id));

        List<ShortCandidate> out = new ArrayList<>(top.size());
        for (int i = 0; i < top.size(); i++) {
            Segment segment = top.get(i);
            out.add(new ShortCandidate(String.format(Locale.ROOT, "short_%02d", i + 1), segment.id(),
                    segment.t0(), segment.t1(), segment.duration(), segment.finalScore(), title(segment)));
        }
        LOGGER.info("SHORTS eligible={} selected={}", eligible.size(), out.size());
        return out;
    }

    static String title(Segment segment) {
        String base = ClipLabeler.keywordTitle(segment.keywords(), 3, null);
        if (base == null) {
            base = transcriptTitle(segment.transcript());
        }
        return TitleText.truncate(prefix(segment.finalScore()) + base, TITLE_MAX_LENGTH);
    }

    static String prefix(double score) {
        if (score >= 0.9) return "[TOP] ";
        if (score >= 0.8) return "[HOT] ";
        if (score >= 0.7) return "[NEW] ";
        return "";
    }

    private static String transcriptTitle(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return "Hot moment";
        }
        String words = Arrays.stream(transcript.trim().split("\\s+"))
                .limit(TRANSCRIPT_TITLE_WORDS)
                .collect(Collectors.joining(" "));
        return TitleText.truncate(words, TRANSCRIPT_TITLE_CHARS);
    }
}
