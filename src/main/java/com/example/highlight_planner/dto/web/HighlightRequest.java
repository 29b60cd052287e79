package com.example.highlight_planner.dto.web;

import com.example.highlight_planner.model.ProcessingMode;
import com.example.highlight_planner.model.WeightProfile;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * @param chatHistogram  per-second message counts; takes precedence over {@code chatExport}
 * @param chatExport     raw chat export to derive the histogram from
 * @param weights        replaces the mode weight profile when present
 * @param split          {@code false} disables part planning for this request
 */
public record HighlightRequest(ProcessingMode mode,
                               @PositiveOrZero Double sourceDurationSec,
                               @NotNull List<SegmentInput> segments,
                               Map<Integer, Integer> chatHistogram,
                               JsonNode chatExport,
                               @Size(max = 2000) String prompt,
                               WeightProfile weights,
                               SelectionOverrides selection,
                               Boolean split,
                               @Min(1) @Max(6) Integer parts,
                               @Min(1) Integer targetMinutes,
                               String baseTitle,
                               LocalDate premiereBaseDate) {
}
