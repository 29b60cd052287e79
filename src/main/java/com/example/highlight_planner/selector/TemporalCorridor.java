package com.example.highlight_planner.selector;

import com.example.highlight_planner.model.Clip;

import java.util.Collection;

/**
 * Every accepted clip blocks {@code [t0 - gap, t1 + gap]}. Touching spans count as overlapping.
 */
final class TemporalCorridor {

    private TemporalCorridor() {
    }

    static boolean isClear(double t0, double t1, Collection<Clip> accepted, double gap) {
        for (Clip other : accepted) {
            boolean before = t1 < other.t0() && other.t0() - t1 >= gap;
            boolean after = t0 > other.t1() && t0 - other.t1() >= gap;
            if (!before && !after) {
                return false;
            }
        }
        return true;
    }

    static double totalDuration(Collection<Clip> clips) {
        double total = 0;
        for (Clip clip : clips) {
            total += clip.duration();
        }
        return total;
    }
}
