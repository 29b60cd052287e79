package com.example.highlight_planner.selector;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SelectionConfigTest {

    @Test
    void defaultsAreValid() {
        SelectionConfig cfg = SelectionConfig.defaults();

        assertThat(cfg.targetTotalDuration()).isEqualTo(900);
        assertThat(cfg.selectionCeiling()).isCloseTo(1080.0, within(1e-9));
    }

    @Test
    void rejectsInvertedClipDurations() {
        assertThatThrownBy(() -> new SelectionConfig(180, 90, 900, 8, 15, 0.25, 30, 5, 0.6, 5, 4, 0.15, 1.1, 8, 3, 10, 40, 80))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("minClipDuration must be < maxClipDuration");
    }

    @Test
    void rejectsTargetBelowMinimumSelection() {
        assertThatThrownBy(() -> SelectionConfig.defaults().withTargetTotalDuration(600))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("targetTotalDuration");
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> SelectionConfig.defaults().withMinScoreThreshold(1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
