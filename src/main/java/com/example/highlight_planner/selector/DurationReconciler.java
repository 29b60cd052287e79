package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Brings the total clip duration within tolerance of the target.
 *
 * <p>Trimming removes time from the end of a clip only and never touches time-indexed data the
 * clip points into; {@link Clip#trimmedSeconds()} tells consumers how much was cut.</p>
 */
@Component
public class DurationReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(DurationReconciler.class);

    static final double TRIM_SLACK = 0.05;
    static final double TOP_UP_CEILING = 1.15;
    static final double TOP_UP_MIN_DURATION_FACTOR = 0.6;

    public ReconcileOutcome reconcile(List<Clip> clips, List<Clip> broadPool, SelectionConfig cfg) {
        List<Clip> working = new ArrayList<>(clips);
        double target = cfg.targetTotalDuration();
        double limit = target * cfg.durationTolerance();

        double trimmed = 0;
        int trimmedClips = 0;
        int dropped = 0;
        double total = TemporalCorridor.totalDuration(working);
        boolean trimAttempted = total > limit + TRIM_SLACK * target;
        if (trimAttempted) {
            double overshoot = total - limit;
            List<Clip> longestFirst = new ArrayList<>(working);
            longestFirst.sort(Comparator.comparingDouble(Clip::duration).reversed().thenComparing(Clip.BY_START));
            for (Clip clip : longestFirst) {
                if (overshoot <= 0) {
                    break;
                }
                double cut = Math.min(clip.duration() * cfg.trimPercentage(),
                        Math.min(clip.duration() - cfg.minDurationGuard(), overshoot));
                if (cut <= 0) {
                    continue;
                }
                working.set(working.indexOf(clip), clip.withEnd(clip.t1() - cut));
                overshoot -= cut;
                trimmed += cut;
                trimmedClips++;
            }
            LOGGER.info("RECONCILE trimmed={}s clips={} overshootLeft={}s", fmt(trimmed), trimmedClips,
                    fmt(Math.max(0, overshoot)));
        }

        List<Clip> guarded = new ArrayList<>();
        for (Clip clip : working) {
            if (clip.duration() < cfg.minDurationGuard()) {
                LOGGER.debug("RECONCILE drop {} below guard duration={}", clip.id(), fmt(clip.duration()));
                dropped++;
            } else {
                guarded.add(clip);
            }
        }
        working = guarded;

        total = TemporalCorridor.totalDuration(working);
        // only finishes a trim that could not reach the limit on its own
        if (trimAttempted && total > limit && working.size() > 1) {
            List<Clip> lowestFirst = new ArrayList<>(working);
            lowestFirst.sort(Clip.BY_SCORE_DESC.reversed());
            for (Clip clip : lowestFirst) {
                if (total <= limit || working.size() <= 1) {
                    break;
                }
                working.remove(clip);
                total -= clip.duration();
                dropped++;
                LOGGER.debug("RECONCILE drop {} score={} to meet tolerance", clip.id(), fmt(clip.score()));
            }
        }

        int toppedUp = 0;
        if (total < target && working.size() < cfg.topUpMaxClips()) {
            toppedUp = topUp(working, broadPool, cfg);
            total = TemporalCorridor.totalDuration(working);
        }

        working.sort(Clip.BY_START);
        LOGGER.info("RECONCILE clips={} total={}s target={}s dropped={} toppedUp={}", working.size(), fmt(total),
                fmt(target), dropped, toppedUp);
        return new ReconcileOutcome(working, trimmed, trimmedClips, dropped, toppedUp);
    }

    private int topUp(List<Clip> working, List<Clip> broadPool, SelectionConfig cfg) {
        double target = cfg.targetTotalDuration();
        double ceiling = target * TOP_UP_CEILING;
        double minDuration = Math.max(cfg.minDurationGuard(), cfg.minClipDuration() * TOP_UP_MIN_DURATION_FACTOR);

        Set<String> present = new HashSet<>();
        working.forEach(c -> present.add(c.id()));
        List<Clip> ranked = new ArrayList<>(broadPool);
        ranked.sort(Clip.BY_SCORE_DESC);

        double total = TemporalCorridor.totalDuration(working);
        int added = 0;
        for (Clip candidate : ranked) {
            if (total >= target || working.size() >= cfg.topUpMaxClips()) {
                break;
            }
            double duration = candidate.duration();
            if (present.contains(candidate.id()) || duration < minDuration || duration > cfg.maxClipDuration()) {
                continue;
            }
            if (total + duration > ceiling) {
                continue;
            }
            if (!TemporalCorridor.isClear(candidate.t0(), candidate.t1(), working, cfg.minTimeGap())) {
                continue;
            }
            working.add(candidate);
            present.add(candidate.id());
            total += duration;
            added++;
        }
        if (added > 0) {
            LOGGER.info("RECONCILE top-up added={} total={}s minDuration={}s", added, fmt(total), fmt(minDuration));
        }
        return added;
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
