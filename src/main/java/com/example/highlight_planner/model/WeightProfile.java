package com.example.highlight_planner.model;

/**
 * Non-negative weights of the composite score.
 */
public record WeightProfile(double chatBurst, double acoustic, double semantic, double promptBoost) {

    public WeightProfile {
        requireWeight("chatBurst", chatBurst);
        requireWeight("acoustic", acoustic);
        requireWeight("semantic", semantic);
        requireWeight("promptBoost", promptBoost);
    }

    public double total() {
        return chatBurst + acoustic + semantic + promptBoost;
    }

    /**
     * Zeroes the chat weight and hands its mass to acoustic and semantic in proportion to their
     * current weights, or evenly when both are zero. The prompt weight is left untouched.
     */
    public WeightProfile withoutChat() {
        if (chatBurst == 0.0) {
            return this;
        }
        double remaining = acoustic + semantic;
        double newAcoustic;
        double newSemantic;
        if (remaining > 0.0) {
            newAcoustic = acoustic + chatBurst * (acoustic / remaining);
            newSemantic = semantic + chatBurst * (semantic / remaining);
        } else {
            newAcoustic = chatBurst * 0.5;
            newSemantic = chatBurst * 0.5;
        }
        return new WeightProfile(0.0, newAcoustic, newSemantic, promptBoost);
    }

    private static void requireWeight(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(name + " weight must be a finite value >= 0");
        }
    }
}
