package com.example.highlight_planner.service.split;

import com.example.highlight_planner.TestData;
import com.example.highlight_planner.config.SplitterProperties;
import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.PlannedPart;
import com.example.highlight_planner.model.SplitPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SplitPlannerTest {

    private SplitPlanner planner;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-10T12:00:00Z"), ZoneOffset.UTC);
        planner = new SplitPlanner(new SplitterProperties(), clock);
    }

    @Test
    void partCountFollowsDurationLadder() {
        assertThat(planner.numParts(1800)).isEqualTo(1);
        assertThat(planner.numParts(3600)).isEqualTo(2);
        assertThat(planner.numParts(5400)).isEqualTo(2);
        assertThat(planner.numParts(10800)).isEqualTo(3);
        assertThat(planner.numParts(18000)).isEqualTo(4);
        assertThat(planner.numParts(30000)).isEqualTo(3);
        assertThat(planner.numParts(86400)).isEqualTo(6);
        assertThat(planner.numParts(100000)).isEqualTo(6);
    }

    @Test
    void fiveHourSourceGetsFourPartsAtMinimumLength() {
        SplitPlan plan = planner.calculateSplitStrategy(18000, null, null);

        assertThat(plan.numParts()).isEqualTo(4);
        assertThat(plan.targetDurationPerPart()).isEqualTo(720);
        assertThat(plan.totalTargetDuration()).isEqualTo(2880);
        assertThat(plan.minScoreThreshold()).isEqualTo(0.50);
        assertThat(plan.compressionRatio()).isCloseTo(0.16, within(1e-9));
        assertThat(plan.reason()).isEqualTo("source 5.0h in 4-6h: 4 parts");
        assertThat(plan.parts()).isEmpty();
    }

    @Test
    void perPartTargetIsClampedToMaximum() {
        SplitPlan plan = planner.calculateSplitStrategy(86400, null, null);

        assertThat(plan.numParts()).isEqualTo(6);
        assertThat(plan.targetDurationPerPart()).isEqualTo(1200);
        assertThat(plan.minScoreThreshold()).isEqualTo(0.55);
        assertThat(plan.reason()).contains("ceil(duration / 4h) = 6 parts");
    }

    @Test
    void shortSourceIsSinglePart() {
        SplitPlan plan = planner.calculateSplitStrategy(1800, null, null);

        assertThat(plan.numParts()).isEqualTo(1);
        assertThat(plan.minScoreThreshold()).isEqualTo(0.45);
        assertThat(plan.reason()).contains("single part");
    }

    @Test
    void overridesAreAppliedAndExplained() {
        SplitPlan plan = planner.calculateSplitStrategy(18000, 2, 15);

        assertThat(plan.numParts()).isEqualTo(2);
        assertThat(plan.targetDurationPerPart()).isEqualTo(900);
        assertThat(plan.totalTargetDuration()).isEqualTo(1800);
        assertThat(plan.reason())
                .contains("manual override: 2 parts")
                .contains("manual override: 15 min per part");
    }

    @Test
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> planner.calculateSplitStrategy(0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planner.calculateSplitStrategy(3600, 7, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planner.calculateSplitStrategy(3600, null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void splittingAppliesFromOneHour() {
        assertThat(planner.appliesTo(3599)).isFalse();
        assertThat(planner.appliesTo(3600)).isTrue();
    }

    @Test
    void planPartsPacksSchedulesAndTitles() {
        SplitPlan plan = planner.calculateSplitStrategy(5400, null, null);
        List<Clip> clips = List.of(
                TestData.clip("c1", 0, 200, 0.9, "budget"),
                TestData.clip("c2", 1000, 1200, 0.5),
                TestData.clip("c3", 2000, 2200, 0.8),
                TestData.clip("c4", 3000, 3200, 0.6));

        SplitPlan packed = planner.planParts(plan, clips, "Sejm", null);

        assertThat(packed.parts()).hasSize(2);
        PlannedPart first = packed.parts().get(0);
        PlannedPart second = packed.parts().get(1);
        assertThat(first.clips()).extracting(Clip::id).containsExactly("c1", "c4");
        assertThat(second.clips()).extracting(Clip::id).containsExactly("c2", "c3");
        assertThat(first.premiereAt()).isEqualTo(OffsetDateTime.parse("2025-01-11T18:00:00+01:00"));
        assertThat(second.premiereAt()).isEqualTo(OffsetDateTime.parse("2025-01-12T18:00:00+01:00"));
        assertThat(first.premiereEpochSecond()).isEqualTo(first.premiereAt().toEpochSecond());
        assertThat(first.filenameSuffix()).isEqualTo("_part1of2");
        assertThat(first.title()).isEqualTo("Sejm: Budget | Part 1/2 | 11.01.2025");
        assertThat(first.keywords()).containsExactly("budget");
        assertThat(first.duration()).isEqualTo(400);
        assertThat(first.avgScore()).isCloseTo(0.75, within(1e-9));
        assertThat(packed.numParts()).isEqualTo(plan.numParts());
        assertThat(packed.reason()).isEqualTo(plan.reason());

        assertThatThrownBy(() -> planner.planParts(packed, clips, "Sejm", null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void explicitBaseDateWins() {
        SplitPlan plan = planner.calculateSplitStrategy(1800, null, null);

        SplitPlan packed = planner.planParts(plan, List.of(TestData.clip("c1", 0, 100, 0.9)), null,
                LocalDate.of(2025, 6, 1));

        PlannedPart part = packed.parts().get(0);
        assertThat(part.premiereAt()).isEqualTo(OffsetDateTime.parse("2025-06-01T18:00:00+02:00"));
        assertThat(part.filenameSuffix()).isEmpty();
        assertThat(part.title()).isEqualTo("Highlights | Part 1/1 | 01.06.2025");
    }
}
