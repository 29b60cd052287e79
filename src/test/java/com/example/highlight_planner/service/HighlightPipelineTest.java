package com.example.highlight_planner.service;

import com.example.highlight_planner.TestData;
import com.example.highlight_planner.config.ArtifactProperties;
import com.example.highlight_planner.config.ScoringProperties;
import com.example.highlight_planner.config.SplitterProperties;
import com.example.highlight_planner.dto.HighlightResult;
import com.example.highlight_planner.model.ChatHistogram;
import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.PlannedPart;
import com.example.highlight_planner.model.ProcessingMode;
import com.example.highlight_planner.model.Segment;
import com.example.highlight_planner.scoring.KeywordOverlapPromptSimilarity;
import com.example.highlight_planner.scoring.PoliticalSessionScoringStrategy;
import com.example.highlight_planner.scoring.ScoringStrategyRegistry;
import com.example.highlight_planner.scoring.SignalAggregator;
import com.example.highlight_planner.scoring.StreamScoringStrategy;
import com.example.highlight_planner.selector.CandidateSelector;
import com.example.highlight_planner.selector.ClipLabeler;
import com.example.highlight_planner.selector.ClipMerger;
import com.example.highlight_planner.selector.CoverageBalancer;
import com.example.highlight_planner.selector.DurationReconciler;
import com.example.highlight_planner.selector.SelectionConfig;
import com.example.highlight_planner.selector.ShortBurstMerger;
import com.example.highlight_planner.selector.ShortsConfig;
import com.example.highlight_planner.selector.ShortsSelector;
import com.example.highlight_planner.service.split.SplitPlanner;
import com.example.highlight_planner.util.RunStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HighlightPipelineTest {

    private HighlightPipeline pipeline;

    @BeforeEach
    void setUp() {
        ScoringProperties scoring = new ScoringProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-01-10T12:00:00Z"), ZoneOffset.UTC);
        pipeline = new HighlightPipeline(
                new SignalAggregator(scoring, Optional.empty(), new KeywordOverlapPromptSimilarity(), Runnable::run),
                new ScoringStrategyRegistry(List.of(new StreamScoringStrategy(scoring),
                        new PoliticalSessionScoringStrategy(scoring))),
                new CandidateSelector(new ShortBurstMerger(), new ClipMerger()),
                new CoverageBalancer(),
                new DurationReconciler(),
                new ClipLabeler(),
                new ShortsSelector(),
                new SplitPlanner(new SplitterProperties(), clock),
                new RunArtifactWriter(new ArtifactProperties(), new ObjectMapper()));
    }

    private static RunHandle handle() {
        return new RunHandle(UUID.randomUUID(), Instant.EPOCH);
    }

    private static HighlightJob job(ProcessingMode mode, double source, List<Segment> segments) {
        return new HighlightJob(mode, source, segments, List.of(), ChatHistogram.empty(), null, null,
                SelectionConfig.defaults(), ShortsConfig.defaults(), true, null, null, "Sejm", null);
    }

    /**
     * Two hours of 100 second segments, every other one loud and keyword heavy.
     */
    private static List<Segment> twoHourSession() {
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            Map<String, Double> features = i % 2 == 0
                    ? Map.of("rms_z", 1.0, Segment.KEYWORD_SCORE, 15.0)
                    : Map.of();
            segments.add(TestData.raw(String.format("seg%02d", i), i * 120.0, i * 120.0 + 100, features));
        }
        return segments;
    }

    @Test
    void longSessionIsSelectedAndSplitIntoParts() {
        HighlightResult result = pipeline.run(job(ProcessingMode.POLITICAL_SESSION, 7200, twoHourSession()),
                handle());

        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        List<Clip> clips = result.clips();
        assertThat(clips).isNotEmpty();
        assertThat(clips.get(0).clipId()).isEqualTo("clip_001");
        for (int i = 1; i < clips.size(); i++) {
            assertThat(clips.get(i).t0()).isGreaterThanOrEqualTo(clips.get(i - 1).t1());
        }
        assertThat(clips).allSatisfy(c -> assertThat(c.duration()).isBetween(10.0, 180.0 * 1.1));
        assertThat(result.totalDuration())
                .isCloseTo(clips.stream().mapToDouble(Clip::duration).sum(), within(1e-6));

        assertThat(result.splitPlan()).isNotNull();
        assertThat(result.splitPlan().numParts()).isEqualTo(3);
        assertThat(result.splitPlan().parts()).isNotEmpty();
        List<String> packed = result.splitPlan().parts().stream()
                .flatMap(part -> part.clips().stream())
                .map(Clip::clipId)
                .toList();
        assertThat(packed).containsExactlyInAnyOrderElementsOf(clips.stream().map(Clip::clipId).toList());
        assertThat(result.splitPlan().parts()).extracting(PlannedPart::title)
                .allSatisfy(title -> assertThat(title).startsWith("Sejm"));
        assertThat(result.diagnostics().semanticFallback()).isTrue();
    }

    @Test
    void streamWithoutChatReportsRenormalizedWeights() {
        HighlightResult result = pipeline.run(job(ProcessingMode.STREAM, 0, twoHourSession()), handle());

        assertThat(result.effectiveWeights().chatBurst()).isZero();
        assertThat(result.effectiveWeights().total()).isCloseTo(1.0, within(1e-9));
        assertThat(result.sourceDuration()).isEqualTo(59 * 120.0 + 100);
    }

    @Test
    void shortSourceIsNotSplit() {
        HighlightResult result = pipeline.run(job(ProcessingMode.POLITICAL_SESSION, 1800, twoHourSession().subList(0, 15)),
                handle());

        assertThat(result.splitPlan()).isNull();
    }

    @Test
    void noValidSegmentsGivesNoCandidates() {
        HighlightJob job = new HighlightJob(ProcessingMode.STREAM, 600, List.of(), List.of("bad", "#1"),
                null, null, null, SelectionConfig.defaults(), ShortsConfig.defaults(), true, null, null, null, null);

        HighlightResult result = pipeline.run(job, handle());

        assertThat(result.status()).isEqualTo(RunStatus.NO_CANDIDATES);
        assertThat(result.clips()).isEmpty();
        assertThat(result.diagnostics().inputSegments()).isEqualTo(2);
        assertThat(result.diagnostics().rejectedSegmentIds()).containsExactly("bad", "#1");
    }

    @Test
    void cancelledRunStopsBeforeFirstStage() {
        RunHandle cancelled = handle();
        cancelled.cancel();

        assertThatThrownBy(() -> pipeline.run(job(ProcessingMode.STREAM, 7200, twoHourSession()), cancelled))
                .isInstanceOf(RunCancelledException.class)
                .satisfies(ex -> assertThat(((RunCancelledException) ex).getStage()).isEqualTo("plan"));
    }
}
