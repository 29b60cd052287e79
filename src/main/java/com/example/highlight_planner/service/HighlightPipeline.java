package com.example.highlight_planner.service;

import com.example.highlight_planner.dto.HighlightResult;
import com.example.highlight_planner.dto.RunDiagnostics;
import com.example.highlight_planner.dto.ShortCandidate;
import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.SplitPlan;
import com.example.highlight_planner.scoring.ScoringContext;
import com.example.highlight_planner.scoring.ScoringOutcome;
import com.example.highlight_planner.scoring.ScoringStrategyRegistry;
import com.example.highlight_planner.scoring.SignalAggregator;
import com.example.highlight_planner.selector.BalanceOutcome;
import com.example.highlight_planner.selector.CandidateSelector;
import com.example.highlight_planner.selector.ClipLabeler;
import com.example.highlight_planner.selector.CoverageBalancer;
import com.example.highlight_planner.selector.DurationReconciler;
import com.example.highlight_planner.selector.ReconcileOutcome;
import com.example.highlight_planner.selector.SelectionConfig;
import com.example.highlight_planner.selector.SelectionOutcome;
import com.example.highlight_planner.selector.ShortsSelector;
import com.example.highlight_planner.service.split.SplitPlanner;
import com.example.highlight_planner.util.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Aggregator, selector, balancer, reconciler and part planner run strictly in that order. Every
 * stage returns a fresh list and cancellation is checked between stages.
 */
@Service
public class HighlightPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(HighlightPipeline.class);

    private final SignalAggregator aggregator;
    private final ScoringStrategyRegistry strategies;
    private final CandidateSelector selector;
    private final CoverageBalancer balancer;
    private final DurationReconciler reconciler;
    private final ClipLabeler labeler;
    private final ShortsSelector shortsSelector;
    private final SplitPlanner splitPlanner;
    private final RunArtifactWriter artifactWriter;

    public HighlightPipeline(SignalAggregator aggregator,
                             ScoringStrategyRegistry strategies,
                             CandidateSelector selector,
                             CoverageBalancer balancer,
                             DurationReconciler reconciler,
                             ClipLabeler labeler,
                             ShortsSelector shortsSelector,
                             SplitPlanner splitPlanner,
                             RunArtifactWriter artifactWriter) {
        this.aggregator = aggregator;
        this.strategies = strategies;
        this.selector = selector;
        this.balancer = balancer;
        this.reconciler = reconciler;
        this.labeler = labeler;
        this.shortsSelector = shortsSelector;
        this.splitPlanner = splitPlanner;
        this.artifactWriter = artifactWriter;
    }

    public HighlightResult run(HighlightJob job, RunHandle handle) {
        handle.checkpoint("plan");
        double source = job.resolvedSourceDuration();
        if (job.segments().isEmpty()) {
            LOGGER.warn("PIPELINE run={} no valid segments (rejected={})", handle.id(), job.rejectedSegmentIds().size());
            return HighlightResult.noCandidates(handle.id(), job.mode(), source,
                    RunDiagnostics.inputOnly(job.inputCount(), job.rejectedSegmentIds()));
        }

        SelectionConfig cfg = job.selection();
        SplitPlan plan = null;
        if (job.splitEnabled() && splitPlanner.appliesTo(source)) {
            plan = splitPlanner.calculateSplitStrategy(source, job.overrideParts(), job.overrideTargetMinutes());
            cfg = cfg.withTargetTotalDuration(plan.totalTargetDuration())
                    .withMinScoreThreshold(Math.max(cfg.minScoreThreshold(), plan.minScoreThreshold()));
        }
        LOGGER.info("PIPELINE run={} mode={} segments={} source={}s target={}s threshold={}", handle.id(),
                job.mode().code(), job.segments().size(), Math.round(source), Math.round(cfg.targetTotalDuration()),
                String.format(Locale.ROOT, "%.2f", cfg.minScoreThreshold()));

        handle.checkpoint("scoring");
        ScoringOutcome scoring = aggregator.score(job.segments(), new ScoringContext(strategies.forMode(job.mode()),
                job.weightOverride(), job.chat(), job.prompt(), source));

        handle.checkpoint("selection");
        SelectionOutcome selection = selector.select(scoring.segments(), cfg);

        handle.checkpoint("balance");
        BalanceOutcome balance = balancer.balance(selection.clips(), selection.candidatePool(), source, cfg);

        handle.checkpoint("reconcile");
        ReconcileOutcome reconcile = reconciler.reconcile(balance.clips(), selection.broadPool(), cfg);
        List<Clip> clips = labeler.label(reconcile.clips());
        List<ShortCandidate> shorts = shortsSelector.select(scoring.segments(), selection.effectiveThreshold(),
                cfg.dynamicThresholdPercentile(), job.shorts());

        handle.checkpoint("split");
        if (plan != null) {
            plan = splitPlanner.planParts(plan, clips, job.baseTitle(), job.premiereBaseDate());
        }

        RunDiagnostics diagnostics = new RunDiagnostics(job.inputCount(), job.rejectedSegmentIds(),
                scoring.semanticCandidates(), scoring.semanticBatches(), scoring.failedSemanticBatches(),
                scoring.semanticFallback(), selection.effectiveThreshold(), selection.percentileFallback(),
                selection.thresholdRelaxed(), selection.forceMerged(), selection.clips().size(), balance.removed(),
                balance.backfilled(), reconcile.trimmedSeconds(), reconcile.dropped(), reconcile.toppedUp());

        double total = reconcile.totalDuration();
        if (clips.isEmpty()) {
            LOGGER.warn("PIPELINE run={} produced no clips from {} segments", handle.id(), job.segments().size());
        }
        artifactWriter.write(handle.id(), scoring.segments(), clips, shorts, plan);
        LOGGER.info("PIPELINE run={} done clips={} total={}s shorts={} parts={}", handle.id(), clips.size(),
                Math.round(total), shorts.size(), plan == null ? 0 : plan.parts().size());
        return new HighlightResult(handle.id(), RunStatus.COMPLETED, null, job.mode(), source, clips, total, shorts,
                scoring.effectiveWeights(), plan, diagnostics);
    }
}
