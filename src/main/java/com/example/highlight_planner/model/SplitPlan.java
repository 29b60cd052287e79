package com.example.highlight_planner.model;

import com.example.highlight_planner.util.DurationFormat;

import java.util.List;
import java.util.Locale;

/**
 * Authoritative record of how a source is divided into parts. The strategy fields are fixed when
 * the plan is computed; {@link #withParts(List)} only attaches the packed parts.
 */
public record SplitPlan(double sourceDuration,
                        int numParts,
                        int targetDurationPerPart,
                        int totalTargetDuration,
                        double minScoreThreshold,
                        double compressionRatio,
                        String reason,
                        List<PlannedPart> parts) {

    public SplitPlan {
        if (numParts < 1) {
            throw new IllegalArgumentException("numParts must be >= 1");
        }
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public boolean hasParts() {
        return !parts.isEmpty();
    }

    public SplitPlan withParts(List<PlannedPart> packed) {
        if (hasParts()) {
            throw new IllegalStateException("split plan parts are already populated");
        }
        return new SplitPlan(sourceDuration, numParts, targetDurationPerPart, totalTargetDuration,
                minScoreThreshold, compressionRatio, reason, packed);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Source: ").append(DurationFormat.readable(sourceDuration)).append('\n');
        sb.append("Parts: ").append(numParts).append('\n');
        sb.append("Target per part: ").append(DurationFormat.readable(targetDurationPerPart)).append('\n');
        sb.append("Total target: ").append(DurationFormat.readable(totalTargetDuration)).append('\n');
        sb.append(String.format(Locale.ROOT, "Compression: %.1f%%%n", compressionRatio * 100));
        sb.append(String.format(Locale.ROOT, "Min score: %.2f%n", minScoreThreshold));
        sb.append("Reason: ").append(reason);
        for (PlannedPart part : parts) {
            sb.append('\n').append(String.format(Locale.ROOT, "  Part %d/%d: %d clips, %s, avg %.2f, premiere %s",
                    part.partNumber(), part.totalParts(), part.clipCount(), DurationFormat.readable(part.duration()),
                    part.avgScore(), part.premiereAt()));
        }
        return sb.toString();
    }
}
