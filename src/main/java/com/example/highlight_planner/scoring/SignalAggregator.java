package com.example.highlight_planner.scoring;

import com.example.highlight_planner.config.ScoringProperties;
import com.example.highlight_planner.dto.SemanticItem;
import com.example.highlight_planner.engine.Interfaces.SemanticAssessor;
import com.example.highlight_planner.engine.SemanticAssessmentException;
import com.example.highlight_planner.model.Segment;
import com.example.highlight_planner.model.SubScores;
import com.example.highlight_planner.model.WeightProfile;
import com.example.highlight_planner.util.ScoreMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Combines the independent per-segment signals into one composite score.
 *
 * <p>Only a prefiltered subset (top pre-scores plus keyword-heavy segments) is sent to the
 * semantic assessor. A failed batch gets a neutral score; when no assessor is configured the
 * semantic signal is approximated from keyword density for every segment.</p>
 */
@Component
public class SignalAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SignalAggregator.class);

    private static final Comparator<Segment> BY_TIME = Comparator.comparingDouble(Segment::t0).thenComparing(Segment::id);

    private final ScoringProperties properties;
    private final Optional<SemanticAssessor> semanticAssessor;
    private final PromptSimilarityScorer promptScorer;
    private final Executor semanticExecutor;

    @Autowired
    public SignalAggregator(ScoringProperties properties,
                            Optional<SemanticAssessor> semanticAssessor,
                            PromptSimilarityScorer promptScorer,
                            @Qualifier("semanticTaskExecutor") Executor semanticExecutor) {
        this.properties = properties;
        this.semanticAssessor = semanticAssessor;
        this.promptScorer = promptScorer;
        this.semanticExecutor = semanticExecutor;
    }

    public ScoringOutcome score(List<Segment> segments, ScoringContext context) {
        List<Segment> ordered = new ArrayList<>(segments);
        ordered.sort(BY_TIME);

        WeightProfile weights = context.strategy().effectiveWeights(context.weightOverride(), !context.chat().isEmpty());
        if (weights.chatBurst() == 0.0 && context.strategy().expectsChat() && context.chat().isEmpty()) {
            LOGGER.info("SCORE no chat data for mode={}, chat weight redistributed acoustic={} semantic={}",
                    context.strategy().mode().code(), fmt(weights.acoustic()), fmt(weights.semantic()));
        }

        ChatBurstCalculator chatBurst = new ChatBurstCalculator(properties.getChatBaselineWindowSec(),
                properties.getChatPeakExtensionSec());

        Set<String> candidates = prefilter(ordered);
        SemanticResult semantic = assessSemantics(ordered, candidates);

        List<Segment> scored = new ArrayList<>(ordered.size());
        for (Segment segment : ordered) {
            SubScores sub = new SubScores(
                    HeuristicSignals.acoustic(segment),
                    HeuristicSignals.keyword(segment),
                    semantic.scores().getOrDefault(segment.id(), 0.0),
                    chatBurst.score(segment.t0(), segment.t1(), context.chat()),
                    context.prompt().isEmpty() ? 0.0 : promptScorer.similarity(context.prompt(), segment.transcript()));
            double composite = composite(sub, weights, position(segment, context.sourceDuration()));
            LOGGER.trace("SCORE segment={} acoustic={} keyword={} semantic={} chat={} prompt={} final={}",
                    segment.id(), fmt(sub.acoustic()), fmt(sub.keyword()), fmt(sub.semantic()),
                    fmt(sub.chatBurst()), fmt(sub.promptSimilarity()), fmt(composite));
            scored.add(segment.withScores(sub, composite));
        }

        LOGGER.info("SCORE segments={} semanticCandidates={} batches={} failedBatches={} fallback={} weights={}",
                scored.size(), candidates.size(), semantic.batches(), semantic.failedBatches(),
                semantic.fallback(), weights);
        return new ScoringOutcome(scored, weights, candidates.size(), semantic.batches(),
                semantic.failedBatches(), semantic.fallback());
    }

    /**
     * Final score: weighted sum clamped to [0,1], then a mild boost for segments away from the
     * edges of the source, clamped again.
     */
    double composite(SubScores sub, WeightProfile weights, double position) {
        double sum = sub.chatBurst() * weights.chatBurst()
                + sub.acoustic() * weights.acoustic()
                + sub.semantic() * weights.semantic()
                + sub.promptSimilarity() * weights.promptBoost();
        double score = ScoreMath.clamp(sum);
        score *= 1.0 + properties.getPositionDiversityBonus() * (1.0 - Math.abs(position - 0.5));
        return ScoreMath.clamp(score);
    }

    Set<String> prefilter(List<Segment> ordered) {
        List<Segment> ranked = new ArrayList<>(ordered);
        ranked.sort(Comparator.comparingDouble(HeuristicSignals::preScore).reversed().thenComparing(BY_TIME));

        Set<String> selected = new LinkedHashSet<>();
        int topN = Math.max(0, properties.getPrefilterTopN());
        for (int i = 0; i < ranked.size() && i < topN; i++) {
            selected.add(ranked.get(i).id());
        }
        int forced = 0;
        for (Segment segment : ordered) {
            if (segment.keywordScore() >= properties.getKeywordForceIncludeThreshold() && selected.add(segment.id())) {
                forced++;
            }
        }
        LOGGER.debug("SCORE prefilter topN={} forced={} candidates={}", Math.min(topN, ranked.size()), forced, selected.size());
        return selected;
    }

    private SemanticResult assessSemantics(List<Segment> ordered, Set<String> candidates) {
        Map<String, Double> scores = new HashMap<>();
        if (semanticAssessor.isEmpty()) {
            for (Segment segment : ordered) {
                scores.put(segment.id(), HeuristicSignals.keywordDensity(segment));
            }
            LOGGER.warn("SCORE semantic assessor unavailable, using keyword density for {} segments", ordered.size());
            return new SemanticResult(scores, 0, 0, true);
        }

        List<SemanticItem> items = new ArrayList<>();
        for (Segment segment : ordered) {
            if (candidates.contains(segment.id())) {
                items.add(new SemanticItem(segment.id(), segment.transcript()));
            }
        }
        List<List<SemanticItem>> batches = partition(items, Math.max(1, properties.getSemanticBatchSize()));
        List<BatchResult> results = properties.getSemanticParallelism() > 1 && batches.size() > 1
                ? runParallel(batches)
                : batches.stream().map(this::assessBatch).toList();

        int failed = 0;
        for (BatchResult result : results) {
            if (result.failed()) {
                failed++;
            }
            scores.putAll(result.scores());
        }
        return new SemanticResult(scores, batches.size(), failed, false);
    }

    private List<BatchResult> runParallel(List<List<SemanticItem>> batches) {
        List<CompletableFuture<BatchResult>> futures = new ArrayList<>(batches.size());
        int inline = 0;
        for (List<SemanticItem> batch : batches) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> assessBatch(batch), semanticExecutor));
            } catch (RejectedExecutionException ex) {
                // pool saturated, the caller thread takes the batch
                futures.add(CompletableFuture.completedFuture(assessBatch(batch)));
                inline++;
            }
        }
        if (inline > 0) {
            LOGGER.warn("SCORE semantic executor rejected {} of {} batches, assessed inline", inline, batches.size());
        }
        List<BatchResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException ex) {
                LOGGER.warn("SCORE semantic batch {} did not complete: {}", i, ex.getMessage());
                results.add(neutral(batches.get(i)));
            }
        }
        return results;
    }

    private BatchResult assessBatch(List<SemanticItem> batch) {
        double neutral = properties.getNeutralSemanticScore();
        try {
            Map<String, Double> response = semanticAssessor.get().assess(batch);
            Map<String, Double> scores = new HashMap<>();
            for (SemanticItem item : batch) {
                Double value = response == null ? null : response.get(item.id());
                scores.put(item.id(), value == null ? neutral : ScoreMath.clamp(value));
            }
            return new BatchResult(scores, false);
        } catch (SemanticAssessmentException ex) {
            LOGGER.warn("SCORE semantic batch failed size={} firstId={} reason={}, using neutral {}",
                    batch.size(), batch.get(0).id(), ex.getMessage(), neutral);
            return neutral(batch);
        } catch (RuntimeException ex) {
            LOGGER.warn("SCORE semantic batch errored size={} firstId={} error={}, using neutral {}",
                    batch.size(), batch.get(0).id(), ex.toString(), neutral);
            return neutral(batch);
        }
    }

    private BatchResult neutral(List<SemanticItem> batch) {
        Map<String, Double> scores = new HashMap<>();
        for (SemanticItem item : batch) {
            scores.put(item.id(), properties.getNeutralSemanticScore());
        }
        return new BatchResult(scores, true);
    }

    private static double position(Segment segment, double sourceDuration) {
        Double explicit = segment.features().get(Segment.POSITION_IN_VIDEO);
        if (explicit != null && Double.isFinite(explicit)) {
            return ScoreMath.clamp(explicit);
        }
        if (sourceDuration <= 0) {
            return 0.5;
        }
        return ScoreMath.clamp(((segment.t0() + segment.t1()) / 2.0) / sourceDuration);
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            out.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return out;
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }

    private record BatchResult(Map<String, Double> scores, boolean failed) {
    }

    private record SemanticResult(Map<String, Double> scores, int batches, int failedBatches, boolean fallback) {
    }
}
