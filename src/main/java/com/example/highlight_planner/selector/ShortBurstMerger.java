package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedily joins very short segments with their time-adjacent neighbours until they reach the
 * minimum length. A remnant still too short at the end of a run is attached backwards when the
 * previous clip was itself grown from short pieces.
 */
@Component
public class ShortBurstMerger {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShortBurstMerger.class);

    public List<Clip> merge(List<Clip> clips, double minDuration, double mergeGap) {
        List<Clip> sorted = new ArrayList<>(clips);
        sorted.sort(Clip.BY_START);

        List<Clip> result = new ArrayList<>(sorted.size());
        List<Boolean> grown = new ArrayList<>(sorted.size());
        int merges = 0;
        int i = 0;
        while (i < sorted.size()) {
            Clip current = sorted.get(i++);
            boolean wasShort = current.duration() < minDuration;
            while (current.duration() < minDuration && i < sorted.size()) {
                Clip next = sorted.get(i);
                if (next.t0() - current.t1() > mergeGap) {
                    break;
                }
                current = current.mergeWith(next);
                merges++;
                i++;
            }
            if (current.duration() < minDuration && !result.isEmpty()) {
                int last = result.size() - 1;
                Clip previous = result.get(last);
                if (grown.get(last) && current.t0() - previous.t1() <= mergeGap) {
                    result.set(last, previous.mergeWith(current));
                    merges++;
                    continue;
                }
            }
            result.add(current);
            grown.add(wasShort);
        }
        if (merges > 0) {
            LOGGER.debug("SELECT short-burst merges={} before={} after={}", merges, sorted.size(), result.size());
        }
        return result;
    }
}
