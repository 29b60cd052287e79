package com.example.highlight_planner.service.split;

import com.example.highlight_planner.model.Clip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass heuristic that distributes clips over parts, balancing fill time and quality.
 *
 * <p>Each clip, in chronological order, goes to the part with the lowest
 * {@code 0.6 * fill + 0.4 * (partAvgScore - meanScore)}; a part already past
 * {@code target * overfill} no longer receives clips unless every part is that full.</p>
 *
 * <p>The quality term is signed: among equally filled parts, the one with the weaker average
 * gets the clip. An empty part counts with average 0.</p>
 */
public class PartBinPacker {
    private static final Logger LOGGER = LoggerFactory.getLogger(PartBinPacker.class);

    static final double FILL_WEIGHT = 0.6;
    static final double QUALITY_WEIGHT = 0.4;

    private final double overfillFactor;

    public PartBinPacker(double overfillFactor) {
        if (overfillFactor < 1.0) {
            throw new IllegalArgumentException("overfillFactor must be >= 1");
        }
        this.overfillFactor = overfillFactor;
    }

    /**
     * @return non-empty parts, each sorted chronologically
     */
    public List<List<Clip>> pack(List<Clip> clips, int numParts, double targetPerPart) {
        if (numParts < 1 || targetPerPart <= 0) {
            throw new IllegalArgumentException("numParts must be >= 1 and targetPerPart > 0");
        }
        List<Clip> ordered = new ArrayList<>(clips);
        ordered.sort(Clip.BY_START);
        if (numParts == 1) {
            return ordered.isEmpty() ? List.of() : List.of(ordered);
        }

        double meanScore = ordered.stream().mapToDouble(Clip::score).average().orElse(0.0);
        List<List<Clip>> parts = new ArrayList<>(numParts);
        double[] durations = new double[numParts];
        double[] scoreSums = new double[numParts];
        for (int i = 0; i < numParts; i++) {
            parts.add(new ArrayList<>());
        }

        double full = targetPerPart * overfillFactor;
        for (Clip clip : ordered) {
            int best = -1;
            double bestScore = Double.POSITIVE_INFINITY;
            for (int i = 0; i < numParts; i++) {
                if (durations[i] >= full) {
                    continue;
                }
                double avg = parts.get(i).isEmpty() ? 0.0 : scoreSums[i] / parts.get(i).size();
                double score = FILL_WEIGHT * (durations[i] / targetPerPart) + QUALITY_WEIGHT * (avg - meanScore);
                if (score < bestScore) {
                    bestScore = score;
                    best = i;
                }
            }
            if (best < 0) {
                best = leastFilled(durations);
                LOGGER.debug("SPLIT every part full, {} goes to part {}", clip.id(), best + 1);
            }
            parts.get(best).add(clip);
            durations[best] += clip.duration();
            scoreSums[best] += clip.score();
        }

        List<List<Clip>> nonEmpty = new ArrayList<>();
        for (List<Clip> part : parts) {
            if (!part.isEmpty()) {
                part.sort(Clip.BY_START);
                nonEmpty.add(List.copyOf(part));
            }
        }
        if (nonEmpty.size() < numParts) {
            LOGGER.info("SPLIT dropped {} empty parts", numParts - nonEmpty.size());
        }
        return nonEmpty;
    }

    private static int leastFilled(double[] durations) {
        int best = 0;
        for (int i = 1; i < durations.length; i++) {
            if (durations[i] < durations[best]) {
                best = i;
            }
        }
        return best;
    }
}
