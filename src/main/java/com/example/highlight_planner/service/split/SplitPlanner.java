package com.example.highlight_planner.service.split;

import com.example.highlight_planner.config.SplitterProperties;
import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.KeywordHit;
import com.example.highlight_planner.model.PlannedPart;
import com.example.highlight_planner.model.SplitPlan;
import com.example.highlight_planner.util.DurationFormat;
import com.example.highlight_planner.util.ScoreMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Computes the split strategy of a source and, once the final clips are known, packs them into
 * scheduled parts.
 */
@Component
public class SplitPlanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(SplitPlanner.class);

    static final int MAX_PARTS = 6;
    static final double HOUR = 3600;
    static final int PART_KEYWORDS = 10;
    static final int KEYWORD_SOURCE_CLIPS = 5;

    private final SplitterProperties properties;
    private final PartBinPacker binPacker;
    private final PremiereScheduler scheduler;
    private final PartTitleGenerator titleGenerator;

    @Autowired
    public SplitPlanner(SplitterProperties properties, Clock clock) {
        this(properties,
                new PartBinPacker(properties.getOverfillFactor()),
                new PremiereScheduler(clock, ZoneId.of(properties.getTimeZone()), properties.getPremiereHour(),
                        properties.getPremiereMinute(), properties.getFirstPremiereOffsetDays()),
                new PartTitleGenerator(properties.getEntities(), properties.isUseEntitiesInTitle(),
                        properties.getTitleMaxLength()));
    }

    SplitPlanner(SplitterProperties properties, PartBinPacker binPacker, PremiereScheduler scheduler,
                 PartTitleGenerator titleGenerator) {
        this.properties = properties;
        this.binPacker = binPacker;
        this.scheduler = scheduler;
        this.titleGenerator = titleGenerator;
    }

    /**
     * Whether a source of this length is planned as parts at all.
     */
    public boolean appliesTo(double sourceDuration) {
        return properties.isEnabled() && sourceDuration >= properties.getMinDurationForSplit();
    }

    /**
     * Pure function of the source duration and optional manual overrides.
     *
     * @param overrideParts         forced part count, or {@code null}
     * @param overrideTargetMinutes forced per-part duration in minutes, or {@code null}
     */
    public SplitPlan calculateSplitStrategy(double sourceDuration, Integer overrideParts, Integer overrideTargetMinutes) {
        if (!Double.isFinite(sourceDuration) || sourceDuration <= 0) {
            throw new IllegalArgumentException("sourceDuration must be > 0");
        }
        if (overrideParts != null && (overrideParts < 1 || overrideParts > MAX_PARTS)) {
            throw new IllegalArgumentException("parts override must be between 1 and " + MAX_PARTS);
        }
        if (overrideTargetMinutes != null && overrideTargetMinutes < 1) {
            throw new IllegalArgumentException("targetMinutes override must be >= 1");
        }

        int numParts = numParts(sourceDuration);
        StringBuilder reason = new StringBuilder(explain(sourceDuration, numParts));
        if (overrideParts != null) {
            numParts = overrideParts;
            reason.append(" | manual override: ").append(overrideParts).append(" parts");
        }

        int perPart;
        if (overrideTargetMinutes != null) {
            perPart = overrideTargetMinutes * 60;
            reason.append(" | manual override: ").append(overrideTargetMinutes).append(" min per part");
        } else {
            perPart = targetPerPart(sourceDuration, numParts);
        }

        int total = perPart * numParts;
        double threshold = scoreThreshold(sourceDuration);
        SplitPlan plan = new SplitPlan(sourceDuration, numParts, perPart, total, threshold,
                total / sourceDuration, reason.toString(), List.of());
        LOGGER.info("SPLIT source={} parts={} perPart={}s threshold={} reason={}",
                DurationFormat.readable(sourceDuration), numParts, perPart, threshold, plan.reason());
        return plan;
    }

    int numParts(double duration) {
        if (duration < HOUR) return 1;
        if (duration < 2 * HOUR) return 2;
        if (duration < 4 * HOUR) return 3;
        if (duration < 6 * HOUR) return 4;
        return Math.min(MAX_PARTS, (int) Math.ceil(duration / (4 * HOUR)));
    }

    int targetPerPart(double duration, int numParts) {
        double raw = properties.getCompressionRatio() * duration / numParts;
        return (int) ScoreMath.clamp(raw, properties.getPartMinDuration(), properties.getPartMaxDuration());
    }

    double scoreThreshold(double duration) {
        if (duration > properties.getVeryLongSourceSec()) {
            return properties.getVeryLongScoreThreshold();
        }
        if (duration > properties.getLongSourceSec()) {
            return properties.getLongScoreThreshold();
        }
        return properties.getBaseScoreThreshold();
    }

    private static String explain(double duration, int numParts) {
        String hours = String.format(Locale.ROOT, "%.1fh", duration / HOUR);
        return switch (numParts) {
            case 1 -> "source " + hours + " < 1h: single part";
            case 2 -> "source " + hours + " in 1-2h: 2 parts";
            case 3 -> "source " + hours + " in 2-4h: 3 parts";
            case 4 -> "source " + hours + " in 4-6h: 4 parts";
            default -> "source " + hours + " > 6h: ceil(duration / 4h) = " + numParts + " parts (max " + MAX_PARTS + ")";
        };
    }

    /**
     * Packs the final clips into the plan's parts and schedules them. The strategy fields of
     * {@code plan} are carried over unchanged.
     *
     * @param baseDate date of the first premiere, or {@code null} for the configured default
     */
    public SplitPlan planParts(SplitPlan plan, List<Clip> clips, String baseTitle, LocalDate baseDate) {
        List<List<Clip>> packed = binPacker.pack(clips, plan.numParts(), plan.targetDurationPerPart());
        LocalDate firstDate = baseDate != null ? baseDate : scheduler.defaultBaseDate();
        String title = baseTitle != null && !baseTitle.isBlank() ? baseTitle : properties.getBaseTitle();

        int total = packed.size();
        List<PlannedPart> parts = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            List<Clip> partClips = packed.get(i);
            int number = i + 1;
            OffsetDateTime premiere = scheduler.premiereAt(firstDate, i);
            double duration = partClips.stream().mapToDouble(Clip::duration).sum();
            double avg = partClips.stream().mapToDouble(Clip::score).average().orElse(0.0);
            parts.add(new PlannedPart(number, total,
                    titleGenerator.generate(partClips, number, total, premiere.toLocalDate(), title),
                    premiere, premiere.toEpochSecond(), partClips, duration, partClips.size(), avg,
                    keywords(partClips),
                    total > 1 ? "_part" + number + "of" + total : ""));
            LOGGER.info("SPLIT part {}/{} clips={} duration={} avg={} premiere={}", number, total, partClips.size(),
                    DurationFormat.readable(duration), String.format(Locale.ROOT, "%.2f", avg), premiere);
        }
        return plan.withParts(parts);
    }

    private static List<String> keywords(List<Clip> partClips) {
        List<String> out = new ArrayList<>();
        for (Clip clip : partClips.subList(0, Math.min(KEYWORD_SOURCE_CLIPS, partClips.size()))) {
            for (KeywordHit hit : clip.keywords()) {
                if (!out.contains(hit.token())) {
                    out.add(hit.token());
                }
            }
        }
        return out.size() > PART_KEYWORDS ? List.copyOf(out.subList(0, PART_KEYWORDS)) : out;
    }
}
