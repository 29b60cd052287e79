package com.example.highlight_planner.selector;

import com.example.highlight_planner.TestData;
import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.Segment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CandidateSelectorTest {

    private final CandidateSelector selector = new CandidateSelector(new ShortBurstMerger(), new ClipMerger());

    private static SelectionConfig config(double minScore) {
        return new SelectionConfig(20, 60, 900, 8, 40, minScore, 5, 5, 0.6, 5, 4, 0.15, 1.1, 8, 3, 10, 40, 80);
    }

    private static List<Segment> evenlySpaced(int count, double score) {
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            segments.add(TestData.scored(String.format("s%03d", i), i * 40.0, i * 40.0 + 30, score));
        }
        return segments;
    }

    @Test
    void stopsOnceTargetDurationIsReached() {
        SelectionOutcome outcome = selector.select(evenlySpaced(100, 0.9), config(0.25));

        assertThat(outcome.clips()).hasSize(30);
        assertThat(outcome.clips().get(0).t0()).isZero();
        assertThat(outcome.clips()).extracting(Clip::id).startsWith("s000", "s001").endsWith("s029");
        assertThat(outcome.clips().stream().mapToDouble(Clip::duration).sum()).isEqualTo(900.0);
        assertThat(outcome.thresholdRelaxed()).isFalse();
        assertThat(outcome.percentileFallback()).isFalse();
    }

    @Test
    void sameInputGivesSameSelection() {
        List<Segment> segments = overlapping();

        SelectionOutcome first = selector.select(segments, config(0.25));
        SelectionOutcome second = selector.select(segments, config(0.25));

        assertThat(first.clips()).isEqualTo(second.clips());
    }

    @Test
    void acceptedClipsNeverOverlapAndKeepTheGap() {
        SelectionOutcome outcome = selector.select(overlapping(), config(0.25));

        List<Clip> clips = outcome.clips();
        assertThat(clips).isNotEmpty();
        for (int i = 1; i < clips.size(); i++) {
            assertThat(clips.get(i).t0() - clips.get(i - 1).t1()).isGreaterThanOrEqualTo(5.0);
        }
        assertThat(clips).allSatisfy(c -> assertThat(c.duration()).isBetween(20.0, 60.0));
    }

    @Test
    void fallsBackToPercentileCutWhenNothingPasses() {
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            segments.add(TestData.scored(String.format("s%03d", i), i * 40.0, i * 40.0 + 30, 0.01 * (i + 1)));
        }

        SelectionOutcome outcome = selector.select(segments, config(0.25));

        assertThat(outcome.percentileFallback()).isTrue();
        assertThat(outcome.effectiveThreshold()).isCloseTo(0.082, within(1e-9));
        assertThat(outcome.clips()).extracting(Clip::id).containsExactly("s008", "s009");
    }

    @Test
    void relaxesThresholdOnceWhenPoolIsThin() {
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            segments.add(TestData.scored(String.format("s%03d", i), i * 40.0, i * 40.0 + 30, i < 5 ? 0.3 : 0.18));
        }

        SelectionOutcome outcome = selector.select(segments, config(0.25));

        assertThat(outcome.thresholdRelaxed()).isTrue();
        assertThat(outcome.effectiveThreshold()).isCloseTo(0.15, within(1e-9));
        assertThat(outcome.candidatePool()).hasSize(10);
        assertThat(outcome.broadPool()).hasSize(10);
    }

    @Test
    void durationFilterDropsTooShortAndTooLong() {
        List<Segment> segments = List.of(
                TestData.scored("long", 0, 100, 0.9),
                TestData.scored("ok", 200, 240, 0.8),
                TestData.scored("short", 300, 310, 0.9));

        CandidateSelector.FilterResult result = selector.filter(
                segments.stream().map(Clip::of).toList(), 0.25, config(0.25));

        assertThat(result.pool()).extracting(Clip::id).containsExactly("ok");
    }

    @Test
    void emptyInputGivesEmptyOutcome() {
        SelectionOutcome outcome = selector.select(List.of(), config(0.25));

        assertThat(outcome.clips()).isEmpty();
        assertThat(outcome.effectiveThreshold()).isEqualTo(0.25);
    }

    private static List<Segment> overlapping() {
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            segments.add(TestData.scored(String.format("o%03d", i), i * 15.0, i * 15.0 + 40, 0.5 + (i % 7) * 0.05));
        }
        return segments;
    }
}
