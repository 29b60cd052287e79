package com.example.highlight_planner.service.split;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Part {@code i} (0-indexed) premieres at {@code baseDate + i days} at a fixed time of day.
 */
public class PremiereScheduler {

    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime timeOfDay;
    private final int firstDayOffset;

    public PremiereScheduler(Clock clock, ZoneId zone, int hour, int minute, int firstDayOffset) {
        if (firstDayOffset < 0) {
            throw new IllegalArgumentException("firstDayOffset must be >= 0");
        }
        this.clock = clock;
        this.zone = zone;
        this.timeOfDay = LocalTime.of(hour, minute);
        this.firstDayOffset = firstDayOffset;
    }

    /**
     * Default base date: today in the configured zone plus the first-premiere offset.
     */
    public LocalDate defaultBaseDate() {
        return LocalDate.now(clock.withZone(zone)).plusDays(firstDayOffset);
    }

    public OffsetDateTime premiereAt(LocalDate baseDate, int partIndex) {
        LocalDate date = (baseDate != null ? baseDate : defaultBaseDate()).plusDays(partIndex);
        return date.atTime(timeOfDay).atZone(zone).toOffsetDateTime();
    }
}
