package com.example.highlight_planner.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * One releasable part of a split plan.
 */
public record PlannedPart(int partNumber,
                          int totalParts,
                          String title,
                          OffsetDateTime premiereAt,
                          long premiereEpochSecond,
                          List<Clip> clips,
                          double duration,
                          int clipCount,
                          double avgScore,
                          List<String> keywords,
                          String filenameSuffix) {

    public PlannedPart {
        clips = clips == null ? List.of() : List.copyOf(clips);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        filenameSuffix = filenameSuffix == null ? "" : filenameSuffix;
    }
}
