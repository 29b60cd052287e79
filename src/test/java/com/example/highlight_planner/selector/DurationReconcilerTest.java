package com.example.highlight_planner.selector;

import com.example.highlight_planner.TestData;
import com.example.highlight_planner.model.Clip;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DurationReconcilerTest {

    private final DurationReconciler reconciler = new DurationReconciler();

    private static final SelectionConfig CONFIG =
            new SelectionConfig(20, 120, 300, 3, 15, 0.25, 5, 5, 0.6, 5, 4, 0.15, 1.1, 8, 3, 10, 40, 80);

    @Test
    void overshootIsTrimmedThenLowestScoreDropped() {
        List<Clip> clips = List.of(
                TestData.clip("a", 0, 60, 0.9),
                TestData.clip("b", 100, 160, 0.5),
                TestData.clip("c", 200, 290, 0.8),
                TestData.clip("d", 300, 390, 0.7),
                TestData.clip("e", 400, 490, 0.6));

        ReconcileOutcome outcome = reconciler.reconcile(clips, List.of(), CONFIG);

        assertThat(outcome.trimmedSeconds()).isCloseTo(58.5, within(1e-9));
        assertThat(outcome.trimmedClips()).isEqualTo(5);
        assertThat(outcome.dropped()).isEqualTo(1);
        assertThat(outcome.clips()).extracting(Clip::id).containsExactly("a", "c", "d", "e");
        assertThat(outcome.totalDuration()).isLessThanOrEqualTo(300 * 1.1);
        assertThat(outcome.clips()).allSatisfy(c -> assertThat(c.duration()).isGreaterThanOrEqualTo(10.0));
        assertThat(outcome.clips().get(1).t0()).isEqualTo(200);
        assertThat(outcome.clips().get(1).t1()).isEqualTo(276.5);
    }

    @Test
    void clipsAlreadyAtGuardAreDroppedWhenNothingCanBeTrimmed() {
        List<Clip> clips = new ArrayList<>();
        for (int i = 0; i < 33; i++) {
            clips.add(TestData.clip("k" + i, i * 20, i * 20 + 10, 0.9));
        }
        clips.add(TestData.clip("low1", 700, 710, 0.2));
        clips.add(TestData.clip("low2", 720, 730, 0.3));

        ReconcileOutcome outcome = reconciler.reconcile(clips, List.of(), CONFIG);

        assertThat(outcome.trimmedClips()).isZero();
        assertThat(outcome.dropped()).isEqualTo(2);
        assertThat(outcome.totalDuration()).isEqualTo(330.0);
        assertThat(outcome.clips()).extracting(Clip::id).doesNotContain("low1", "low2");
    }

    @Test
    void smallOvershootWithinSlackIsLeftAlone() {
        List<Clip> clips = List.of(
                TestData.clip("a", 0, 120, 0.9),
                TestData.clip("b", 200, 320, 0.8),
                TestData.clip("c", 400, 500, 0.7));

        ReconcileOutcome outcome = reconciler.reconcile(clips, List.of(), CONFIG);

        assertThat(outcome.trimmedClips()).isZero();
        assertThat(outcome.clips()).hasSize(3);
    }

    @Test
    void shortfallIsToppedUpFromBroadPool() {
        Clip kept = TestData.clip("a", 0, 100, 0.9);
        List<Clip> pool = List.of(
                kept,
                TestData.clip("tooLong", 500, 700, 0.95),
                TestData.clip("p1", 200, 290, 0.8),
                TestData.clip("overlapsP1", 150, 210, 0.7),
                TestData.clip("p3", 400, 440, 0.6),
                TestData.clip("tooShort", 800, 810, 0.99));

        ReconcileOutcome outcome = reconciler.reconcile(List.of(kept), pool, CONFIG);

        assertThat(outcome.toppedUp()).isEqualTo(2);
        assertThat(outcome.clips()).extracting(Clip::id).containsExactly("a", "p1", "p3");
        assertThat(outcome.totalDuration()).isEqualTo(230.0);
    }
}
