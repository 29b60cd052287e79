package com.example.highlight_planner.model;

import com.example.highlight_planner.util.ScoreMath;

import java.util.List;

/**
 * Independent per-segment signals, each clamped to [0,1].
 */
public record SubScores(double acoustic,
                        double keyword,
                        double semantic,
                        double chatBurst,
                        double promptSimilarity) {

    public static final SubScores ZERO = new SubScores(0, 0, 0, 0, 0);

    public SubScores {
        acoustic = ScoreMath.clamp(acoustic);
        keyword = ScoreMath.clamp(keyword);
        semantic = ScoreMath.clamp(semantic);
        chatBurst = ScoreMath.clamp(chatBurst);
        promptSimilarity = ScoreMath.clamp(promptSimilarity);
    }

    public SubScores withSemantic(double value) {
        return new SubScores(acoustic, keyword, value, chatBurst, promptSimilarity);
    }

    /**
     * Weighted mean, used when clips are merged.
     */
    public static SubScores weightedMean(SubScores a, int weightA, SubScores b, int weightB) {
        double total = weightA + weightB;
        return new SubScores(
                (a.acoustic * weightA + b.acoustic * weightB) / total,
                (a.keyword * weightA + b.keyword * weightB) / total,
                (a.semantic * weightA + b.semantic * weightB) / total,
                (a.chatBurst * weightA + b.chatBurst * weightB) / total,
                (a.promptSimilarity * weightA + b.promptSimilarity * weightB) / total);
    }

    public static SubScores mean(List<SubScores> scores) {
        if (scores == null || scores.isEmpty()) {
            return ZERO;
        }
        double ac = 0, kw = 0, se = 0, ch = 0, pr = 0;
        for (SubScores s : scores) {
            ac += s.acoustic;
            kw += s.keyword;
            se += s.semantic;
            ch += s.chatBurst;
            pr += s.promptSimilarity;
        }
        int n = scores.size();
        return new SubScores(ac / n, kw / n, se / n, ch / n, pr / n);
    }
}
