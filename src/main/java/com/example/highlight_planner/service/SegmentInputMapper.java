package com.example.highlight_planner.service;

import com.example.highlight_planner.dto.web.KeywordInput;
import com.example.highlight_planner.dto.web.SegmentInput;
import com.example.highlight_planner.model.KeywordHit;
import com.example.highlight_planner.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts incoming segments, rejecting malformed ones individually.
 */
@Component
public class SegmentInputMapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(SegmentInputMapper.class);

    public Mapped map(List<SegmentInput> inputs) {
        List<Segment> accepted = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (inputs == null) {
            return new Mapped(accepted, rejected);
        }
        for (int i = 0; i < inputs.size(); i++) {
            SegmentInput input = inputs.get(i);
            String label = input == null || input.id() == null || input.id().isBlank() ? "#" + i : input.id();
            try {
                Segment segment = toSegment(input);
                if (!seen.add(segment.id())) {
                    throw new IllegalArgumentException("duplicate segment id " + segment.id());
                }
                accepted.add(segment);
            } catch (IllegalArgumentException ex) {
                LOGGER.warn("INPUT rejected segment={} reason={}", label, ex.getMessage());
                rejected.add(label);
            }
        }
        if (!rejected.isEmpty()) {
            LOGGER.info("INPUT accepted={} rejected={}", accepted.size(), rejected.size());
        }
        return new Mapped(accepted, rejected);
    }

    private static Segment toSegment(SegmentInput input) {
        if (input == null) {
            throw new IllegalArgumentException("segment is null");
        }
        if (input.t0() == null || input.t1() == null) {
            throw new IllegalArgumentException("t0 and t1 are required");
        }
        Map<String, Double> features = new HashMap<>();
        if (input.features() != null) {
            input.features().forEach((key, value) -> {
                if (key != null && value != null && Double.isFinite(value)) {
                    features.put(key, value);
                }
            });
        }
        List<KeywordHit> keywords = new ArrayList<>();
        if (input.keywords() != null) {
            for (KeywordInput keyword : input.keywords()) {
                if (keyword != null && keyword.token() != null && !keyword.token().isBlank()) {
                    keywords.add(new KeywordHit(keyword.token(), keyword.weight() == null ? 1.0 : keyword.weight()));
                }
            }
        }
        return Segment.unscored(input.id(), input.t0(), input.t1(), input.transcript(), features, keywords);
    }

    public record Mapped(List<Segment> segments, List<String> rejectedIds) {
        public Mapped {
            segments = List.copyOf(segments);
            rejectedIds = List.copyOf(rejectedIds);
        }
    }
}
