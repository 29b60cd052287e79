package com.example.highlight_planner.model;

import com.example.highlight_planner.TestData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ClipTest {

    @Test
    void mergeSpansTheGapAndAveragesOverConstituents() {
        Clip a = TestData.clip("a", 0, 10, 0.9, "budget");
        Clip b = TestData.clip("b", 12, 20, 0.6, "tax", "budget");
        Clip c = TestData.clip("c", 25, 30, 0.3);

        Clip merged = a.mergeWith(b).mergeWith(c);

        assertThat(merged.id()).isEqualTo("a+b+c");
        assertThat(merged.t0()).isZero();
        assertThat(merged.t1()).isEqualTo(30);
        assertThat(merged.duration()).isEqualTo(30);
        assertThat(merged.mergedFrom()).containsExactly("a", "b", "c");
        assertThat(merged.score()).isCloseTo(0.6, within(1e-9));
        assertThat(merged.keywords()).extracting(KeywordHit::token).containsExactly("budget", "tax");
    }

    @Test
    void withEndRecordsTrimmedSeconds() {
        Clip clip = TestData.clip("a", 100, 190, 0.8);

        Clip trimmed = clip.withEnd(176.5);

        assertThat(trimmed.duration()).isEqualTo(76.5);
        assertThat(trimmed.trimmedSeconds()).isEqualTo(13.5);
        assertThat(trimmed.t0()).isEqualTo(100);
    }

    @Test
    void unscoredSegmentCannotBecomeClip() {
        Segment segment = Segment.unscored("s1", 0, 10, "", null, null);

        assertThatThrownBy(() -> Clip.of(segment)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void segmentRejectsEmptySpan() {
        assertThatThrownBy(() -> Segment.unscored("s1", 10, 10, "", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("t1 > t0");
    }
}
