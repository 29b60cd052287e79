package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Spreads the selection over the source timeline. The per-bin cap is a soft preference; the
 * minimum clip count is restored by backfilling from the whole candidate pool.
 */
@Component
public class CoverageBalancer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CoverageBalancer.class);

    static final double LONG_SOURCE_HOURS = 6.0;
    static final double VERY_LONG_SOURCE_HOURS = 12.0;

    public BalanceOutcome balance(List<Clip> selected, List<Clip> candidatePool, double sourceDuration,
                                  SelectionConfig cfg) {
        if (selected.isEmpty()) {
            return new BalanceOutcome(List.of(), cfg.maxClipsPerBin(), cfg.minClips(), 0, 0);
        }
        double source = sourceDuration > 0 ? sourceDuration : inferDuration(selected, candidatePool);
        int cap = perBinCap(source, cfg);
        int floor = minClipFloor(source, cfg);

        int bins = cfg.positionBins();
        double binSize = source / bins;
        List<List<Clip>> byBin = new ArrayList<>(bins);
        for (int i = 0; i < bins; i++) {
            byBin.add(new ArrayList<>());
        }
        for (Clip clip : selected) {
            int index = binSize > 0 ? (int) Math.floor(clip.t0() / binSize) : 0;
            byBin.get(Math.max(0, Math.min(bins - 1, index))).add(clip);
        }

        List<Clip> kept = new ArrayList<>();
        for (int i = 0; i < bins; i++) {
            List<Clip> bin = byBin.get(i);
            bin.sort(Clip.BY_SCORE_DESC);
            if (bin.size() > cap) {
                LOGGER.debug("BALANCE bin={} clips={} capped at {}", i, bin.size(), cap);
            }
            kept.addAll(bin.subList(0, Math.min(cap, bin.size())));
        }
        int removed = selected.size() - kept.size();

        int backfilled = 0;
        if (kept.size() < floor) {
            Set<String> present = new HashSet<>();
            kept.forEach(c -> present.add(c.id()));
            List<Clip> ranked = new ArrayList<>(candidatePool);
            ranked.addAll(selected);
            ranked.sort(Clip.BY_SCORE_DESC);
            for (Clip candidate : ranked) {
                if (kept.size() >= floor) {
                    break;
                }
                if (present.contains(candidate.id())
                        || !TemporalCorridor.isClear(candidate.t0(), candidate.t1(), kept, cfg.minTimeGap())) {
                    continue;
                }
                kept.add(candidate);
                present.add(candidate.id());
                backfilled++;
            }
            if (kept.size() < floor) {
                LOGGER.warn("BALANCE floor={} not reachable, pool exhausted at {} clips", floor, kept.size());
            }
        }

        kept.sort(Clip.BY_START);
        LOGGER.info("BALANCE source={}s bins={} cap={} floor={} removed={} backfilled={} clips={}",
                Math.round(source), bins, cap, floor, removed, backfilled, kept.size());
        return new BalanceOutcome(kept, cap, floor, removed, backfilled);
    }

    static int perBinCap(double sourceDuration, SelectionConfig cfg) {
        double hours = sourceDuration / 3600.0;
        if (hours >= VERY_LONG_SOURCE_HOURS) {
            return Math.max(cfg.maxClipsPerBin(), 8);
        }
        if (hours >= LONG_SOURCE_HOURS) {
            return Math.max(cfg.maxClipsPerBin(), 6);
        }
        return cfg.maxClipsPerBin();
    }

    static int minClipFloor(double sourceDuration, SelectionConfig cfg) {
        double hours = sourceDuration / 3600.0;
        if (hours >= VERY_LONG_SOURCE_HOURS) {
            return Math.max(cfg.minClips(), 15);
        }
        if (hours >= LONG_SOURCE_HOURS) {
            return Math.max(cfg.minClips(), 10);
        }
        return cfg.minClips();
    }

    private static double inferDuration(List<Clip> selected, List<Clip> pool) {
        double max = 0;
        for (Clip clip : selected) {
            max = Math.max(max, clip.t1());
        }
        for (Clip clip : pool) {
            max = Math.max(max, clip.t1());
        }
        return max;
    }
}
