package com.example.highlight_planner.scoring;

import com.example.highlight_planner.model.ChatHistogram;

/**
 * Turns a per-second chat histogram into a burst score for one time span.
 *
 * <p>The baseline is the mean rate over the window before the span; the peak is the busiest second
 * within the span plus a short trailing extension, since chat reacts with a delay.</p>
 */
public class ChatBurstCalculator {

    private final int baselineWindowSec;
    private final int peakExtensionSec;

    public ChatBurstCalculator(int baselineWindowSec, int peakExtensionSec) {
        if (baselineWindowSec < 1 || peakExtensionSec < 0) {
            throw new IllegalArgumentException("baselineWindowSec must be >= 1 and peakExtensionSec >= 0");
        }
        this.baselineWindowSec = baselineWindowSec;
        this.peakExtensionSec = peakExtensionSec;
    }

    public double score(double t0, double t1, ChatHistogram chat) {
        if (chat == null || chat.isEmpty()) {
            return 0.0;
        }
        return bucket(multiplier(t0, t1, chat));
    }

    public double multiplier(double t0, double t1, ChatHistogram chat) {
        int start = Math.max(0, (int) Math.floor(t0));
        int end = Math.max(start, (int) Math.floor(t1));

        int baselineStart = Math.max(0, start - baselineWindowSec);
        long baselineSum = 0;
        for (int second = baselineStart; second < start; second++) {
            baselineSum += chat.count(second);
        }
        double baseline = baselineSum / (double) Math.max(start - baselineStart, 1);

        int peak = 0;
        for (int second = start; second <= end + peakExtensionSec; second++) {
            peak = Math.max(peak, chat.count(second));
        }
        return peak / Math.max(baseline, 1.0);
    }

    /**
     * Monotonic step function from peak/baseline multiplier to [0,1].
     */
    public static double bucket(double multiplier) {
        if (multiplier >= 15) return 1.00;
        if (multiplier >= 10) return 0.95;
        if (multiplier >= 7) return 0.85;
        if (multiplier >= 5) return 0.70;
        if (multiplier >= 3) return 0.50;
        if (multiplier >= 2) return 0.30;
        return 0.10;
    }
}
