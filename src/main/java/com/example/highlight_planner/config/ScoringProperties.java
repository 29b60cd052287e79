package com.example.highlight_planner.config;

import com.example.highlight_planner.model.WeightProfile;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Aggregator knobs and the weight profile of each processing mode.
 */
@ConfigurationProperties(prefix = "highlight.scoring")
public class ScoringProperties {

    private int prefilterTopN = 40;
    private double keywordForceIncludeThreshold = 5.0;
    private int semanticBatchSize = 10;
    private int semanticParallelism = 1;
    private double neutralSemanticScore = 0.5;
    private double positionDiversityBonus = 0.1;
    private int chatBaselineWindowSec = 180;
    private int chatPeakExtensionSec = 10;

    private Weights stream = new Weights(0.65, 0.15, 0.15, 0.05);
    private Weights politicalSession = new Weights(0.05, 0.35, 0.55, 0.05);

    public int getPrefilterTopN() {
        return prefilterTopN;
    }

    public void setPrefilterTopN(int prefilterTopN) {
        this.prefilterTopN = prefilterTopN;
    }

    public double getKeywordForceIncludeThreshold() {
        return keywordForceIncludeThreshold;
    }

    public void setKeywordForceIncludeThreshold(double keywordForceIncludeThreshold) {
        this.keywordForceIncludeThreshold = keywordForceIncludeThreshold;
    }

    public int getSemanticBatchSize() {
        return semanticBatchSize;
    }

    public void setSemanticBatchSize(int semanticBatchSize) {
        this.semanticBatchSize = semanticBatchSize;
    }

    public int getSemanticParallelism() {
        return semanticParallelism;
    }

    public void setSemanticParallelism(int semanticParallelism) {
        this.semanticParallelism = semanticParallelism;
    }

    public double getNeutralSemanticScore() {
        return neutralSemanticScore;
    }

    public void setNeutralSemanticScore(double neutralSemanticScore) {
        this.neutralSemanticScore = neutralSemanticScore;
    }

    public double getPositionDiversityBonus() {
        return positionDiversityBonus;
    }

    public void setPositionDiversityBonus(double positionDiversityBonus) {
        this.positionDiversityBonus = positionDiversityBonus;
    }

    public int getChatBaselineWindowSec() {
        return chatBaselineWindowSec;
    }

    public void setChatBaselineWindowSec(int chatBaselineWindowSec) {
        this.chatBaselineWindowSec = chatBaselineWindowSec;
    }

    public int getChatPeakExtensionSec() {
        return chatPeakExtensionSec;
    }

    public void setChatPeakExtensionSec(int chatPeakExtensionSec) {
        this.chatPeakExtensionSec = chatPeakExtensionSec;
    }

    public Weights getStream() {
        return stream;
    }

    public void setStream(Weights stream) {
        this.stream = stream;
    }

    public Weights getPoliticalSession() {
        return politicalSession;
    }

    public void setPoliticalSession(Weights politicalSession) {
        this.politicalSession = politicalSession;
    }

    public static class Weights {
        private double chatBurst;
        private double acoustic;
        private double semantic;
        private double promptBoost;

        public Weights() {
        }

        public Weights(double chatBurst, double acoustic, double semantic, double promptBoost) {
            this.chatBurst = chatBurst;
            this.acoustic = acoustic;
            this.semantic = semantic;
            this.promptBoost = promptBoost;
        }

        public WeightProfile toProfile() {
            return new WeightProfile(chatBurst, acoustic, semantic, promptBoost);
        }

        public double getChatBurst() {
            return chatBurst;
        }

        public void setChatBurst(double chatBurst) {
            this.chatBurst = chatBurst;
        }

        public double getAcoustic() {
            return acoustic;
        }

        public void setAcoustic(double acoustic) {
            this.acoustic = acoustic;
        }

        public double getSemantic() {
            return semantic;
        }

        public void setSemantic(double semantic) {
            this.semantic = semantic;
        }

        public double getPromptBoost() {
            return promptBoost;
        }

        public void setPromptBoost(double promptBoost) {
            this.promptBoost = promptBoost;
        }
    }
}
