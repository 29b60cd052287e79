package com.example.highlight_planner.selector;

import com.example.highlight_planner.TestData;
import com.example.highlight_planner.model.Clip;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ClipMergerTest {

    private final ClipMerger merger = new ClipMerger();

    @Test
    void mergedClipCoversTheGap() {
        List<Clip> merged = merger.smartMerge(List.of(
                TestData.clip("a", 0, 5, 0.8),
                TestData.clip("b", 7, 14, 0.7)), 10, 60, 0.6);

        assertThat(merged).hasSize(1);
        Clip clip = merged.get(0);
        assertThat(clip.t0()).isZero();
        assertThat(clip.t1()).isEqualTo(14);
        assertThat(clip.duration()).isEqualTo(14);
        assertThat(clip.mergedFrom()).containsExactly("a", "b");
        assertThat(clip.score()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void chainsConsecutiveMerges() {
        List<Clip> merged = merger.smartMerge(List.of(
                TestData.clip("c", 16, 20, 0.6),
                TestData.clip("a", 0, 5, 0.9),
                TestData.clip("b", 7, 14, 0.9)), 5, 60, 0.6);

        assertThat(merged).extracting(Clip::id).containsExactly("a+b+c");
        assertThat(merged.get(0).score()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void keepsClipsApartWhenCombinedSpanIsTooLong() {
        List<Clip> merged = merger.smartMerge(List.of(
                TestData.clip("a", 0, 30, 0.9),
                TestData.clip("b", 35, 70, 0.9)), 10, 60, 0.6);

        assertThat(merged).extracting(Clip::id).containsExactly("a", "b");
    }

    @Test
    void weakNeighbourIsNotAbsorbed() {
        List<Clip> merged = merger.smartMerge(List.of(
                TestData.clip("a", 0, 5, 0.9),
                TestData.clip("b", 7, 14, 0.5)), 10, 60, 0.6);

        assertThat(merged).hasSize(2);
    }
}
