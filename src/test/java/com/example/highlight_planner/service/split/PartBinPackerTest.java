package com.example.highlight_planner.service.split;

import com.example.highlight_planner.TestData;
import com.example.highlight_planner.model.Clip;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartBinPackerTest {

    private final PartBinPacker packer = new PartBinPacker(1.15);

    @Test
    void fullPartIsSkippedUntilEveryPartIsFull() {
        List<List<Clip>> parts = packer.pack(List.of(
                TestData.clip("c1", 0, 120, 0.7),
                TestData.clip("c2", 200, 320, 0.7),
                TestData.clip("c3", 400, 520, 0.7)), 2, 100);

        assertThat(parts).hasSize(2);
        assertThat(parts.get(0)).extracting(Clip::id).containsExactly("c1", "c3");
        assertThat(parts.get(1)).extracting(Clip::id).containsExactly("c2");
    }

    @Test
    void equallyFilledPartsFavourTheWeakerAverage() {
        List<List<Clip>> parts = packer.pack(List.of(
                TestData.clip("strong", 0, 10, 0.9),
                TestData.clip("weak", 20, 30, 0.1),
                TestData.clip("mid", 40, 50, 0.5)), 2, 100);

        assertThat(parts.get(0)).extracting(Clip::id).containsExactly("strong");
        assertThat(parts.get(1)).extracting(Clip::id).containsExactly("weak", "mid");
    }

    @Test
    void emptyPartsAreRemoved() {
        List<List<Clip>> parts = packer.pack(List.of(TestData.clip("only", 0, 60, 0.9)), 3, 720);

        assertThat(parts).hasSize(1);
    }

    @Test
    void everyClipLandsInExactlyOnePart() {
        List<Clip> clips = List.of(
                TestData.clip("a", 0, 100, 0.9),
                TestData.clip("b", 200, 300, 0.4),
                TestData.clip("c", 400, 500, 0.7),
                TestData.clip("d", 600, 700, 0.6),
                TestData.clip("e", 800, 900, 0.8));

        List<List<Clip>> parts = packer.pack(clips, 3, 150);

        assertThat(parts.stream().flatMap(List::stream).map(Clip::id))
                .containsExactlyInAnyOrder("a", "b", "c", "d", "e");
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new PartBinPacker(0.9)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> packer.pack(List.of(), 0, 100)).isInstanceOf(IllegalArgumentException.class);
    }
}
