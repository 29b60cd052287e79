package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.Segment;
import com.example.highlight_planner.util.Percentiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns scored segments into a non-overlapping, duration-bounded clip set.
 *
 * <ol>
 *     <li>short-burst merge</li>
 *     <li>score filter, percentile cut when nothing passes</li>
 *     <li>duration filter, one threshold relaxation when the pool is thin</li>
 *     <li>greedy selection with non-maximum suppression</li>
 *     <li>gap-inclusive smart merge, one force merge pass when coverage stays low</li>
 * </ol>
 */
@Component
public class CandidateSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(CandidateSelector.class);

    static final int MIN_POOL_SIZE = 30;
    static final double MIN_POOL_COVERAGE = 0.5;
    static final double RELAX_STEP = 0.10;
    static final double FORCE_MERGE_COVERAGE = 0.7;
    static final double FORCE_MERGE_CEILING = 1.1;

    private final ShortBurstMerger shortBurstMerger;
    private final ClipMerger clipMerger;

    public CandidateSelector(ShortBurstMerger shortBurstMerger, ClipMerger clipMerger) {
        this.shortBurstMerger = shortBurstMerger;
        this.clipMerger = clipMerger;
    }

    public SelectionOutcome select(List<Segment> scored, SelectionConfig cfg) {
        if (scored == null || scored.isEmpty()) {
            return SelectionOutcome.empty(cfg.minScoreThreshold());
        }
        List<Clip> clips = new ArrayList<>(scored.size());
        for (Segment segment : scored) {
            clips.add(Clip.of(segment));
        }
        List<Clip> merged = shortBurstMerger.merge(clips, cfg.shortBurstMinDuration(), cfg.shortBurstMergeGap());

        double threshold = cfg.minScoreThreshold();
        FilterResult filtered = filter(merged, threshold, cfg);
        boolean relaxed = false;
        double poolDuration = TemporalCorridor.totalDuration(filtered.pool());
        if ((filtered.pool().size() < MIN_POOL_SIZE || poolDuration < MIN_POOL_COVERAGE * cfg.targetTotalDuration())
                && threshold > 0) {
            double relaxedThreshold = Math.max(0.0, threshold - RELAX_STEP);
            LOGGER.info("SELECT pool thin size={} duration={} threshold {} -> {}", filtered.pool().size(),
                    fmt(poolDuration), fmt(threshold), fmt(relaxedThreshold));
            filtered = filter(merged, relaxedThreshold, cfg);
            relaxed = true;
        }

        List<Clip> accepted = suppress(filtered.pool(), cfg);
        List<Clip> result = clipMerger.smartMerge(accepted, cfg.smartMergeGap(), cfg.maxClipDuration(),
                cfg.smartMergeMinScore());
        boolean forceMerged = false;
        double coverage = TemporalCorridor.totalDuration(result);
        if (!result.isEmpty() && coverage < FORCE_MERGE_COVERAGE * cfg.targetTotalDuration()) {
            result = clipMerger.smartMerge(result, cfg.smartMergeGap(), cfg.maxClipDuration() * FORCE_MERGE_CEILING,
                    cfg.smartMergeMinScore());
            forceMerged = true;
            LOGGER.debug("SELECT force merge coverage={} clips={}", fmt(coverage), result.size());
        }

        List<Clip> ordered = new ArrayList<>(result);
        ordered.sort(Clip.BY_START);
        LOGGER.info("SELECT segments={} afterShortMerge={} pool={} accepted={} final={} total={} threshold={}",
                scored.size(), merged.size(), filtered.pool().size(), accepted.size(), ordered.size(),
                fmt(TemporalCorridor.totalDuration(ordered)), fmt(filtered.threshold()));
        return new SelectionOutcome(ordered, filtered.pool(), merged, filtered.threshold(),
                filtered.percentileFallback(), relaxed, forceMerged);
    }

    FilterResult filter(List<Clip> clips, double threshold, SelectionConfig cfg) {
        List<Clip> byScore = new ArrayList<>();
        for (Clip clip : clips) {
            if (clip.score() >= threshold) {
                byScore.add(clip);
            }
        }
        double effective = threshold;
        boolean fallback = false;
        if (byScore.isEmpty() && !clips.isEmpty()) {
            List<Double> scores = clips.stream().map(Clip::score).toList();
            effective = Percentiles.linear(scores, cfg.dynamicThresholdPercentile());
            fallback = true;
            for (Clip clip : clips) {
                if (clip.score() >= effective) {
                    byScore.add(clip);
                }
            }
            LOGGER.info("SELECT nothing above threshold={}, percentile p{} cut={} kept={}", fmt(threshold),
                    fmt(cfg.dynamicThresholdPercentile()), fmt(effective), byScore.size());
        }

        List<Clip> pool = new ArrayList<>();
        for (Clip clip : byScore) {
            double duration = clip.duration();
            if (duration >= cfg.minClipDuration() && duration <= cfg.maxClipDuration()) {
                pool.add(clip);
            }
        }
        return new FilterResult(pool, effective, fallback);
    }

    /**
     * Greedy non-maximum suppression. Stops once the target is reached; skips a candidate that
     * would push the total past the selection ceiling or that falls inside an accepted corridor.
     */
    List<Clip> suppress(List<Clip> pool, SelectionConfig cfg) {
        List<Clip> ranked = new ArrayList<>(pool);
        ranked.sort(Clip.BY_SCORE_DESC);

        List<Clip> accepted = new ArrayList<>();
        double total = 0;
        for (Clip candidate : ranked) {
            if (accepted.size() >= cfg.maxClips() || total >= cfg.targetTotalDuration()) {
                break;
            }
            if (total + candidate.duration() > cfg.selectionCeiling()) {
                LOGGER.debug("SELECT skip {} would exceed ceiling total={}", candidate.id(), fmt(total));
                continue;
            }
            if (!TemporalCorridor.isClear(candidate.t0(), candidate.t1(), accepted, cfg.minTimeGap())) {
                LOGGER.debug("SELECT skip {} inside accepted corridor", candidate.id());
                continue;
            }
            accepted.add(candidate);
            total += candidate.duration();
        }
        accepted.sort(Clip.BY_START);
        return accepted;
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    record FilterResult(List<Clip> pool, double threshold, boolean percentileFallback) {
    }
}
