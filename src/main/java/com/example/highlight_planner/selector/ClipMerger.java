package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Gap-inclusive merge of neighbouring accepted clips.
 */
@Component
public class ClipMerger {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClipMerger.class);

    /**
     * Walks the clips in time order and merges {@code i} into {@code i+1} when the gap is at most
     * {@code mergeGap}, the combined span including the gap fits {@code maxDuration} and the
     * neighbour scores at least {@code minScore}.
     */
    public List<Clip> smartMerge(List<Clip> clips, double mergeGap, double maxDuration, double minScore) {
        if (clips.size() < 2) {
            return List.copyOf(clips);
        }
        List<Clip> sorted = new ArrayList<>(clips);
        sorted.sort(Clip.BY_START);

        List<Clip> result = new ArrayList<>();
        Clip current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            Clip next = sorted.get(i);
            double gap = next.t0() - current.t1();
            double combined = current.duration() + gap + next.duration();
            if (gap >= 0 && gap <= mergeGap && combined <= maxDuration && next.score() >= minScore) {
                LOGGER.debug("SELECT merge {} + {} gap={} combined={}", current.id(), next.id(),
                        String.format(Locale.ROOT, "%.1f", gap), String.format(Locale.ROOT, "%.1f", combined));
                current = current.mergeWith(next);
            } else {
                result.add(current);
                current = next;
            }
        }
        result.add(current);
        return result;
    }
}
