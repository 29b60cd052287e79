package com.example.highlight_planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configures multi-part splitting, premiere scheduling and part titles.
 */
@ConfigurationProperties(prefix = "highlight.splitter")
public class SplitterProperties {

    private boolean enabled = true;
    private double minDurationForSplit = 3600;
    private double compressionRatio = 0.10;
    private int partMinDuration = 720;
    private int partMaxDuration = 1200;
    private double longSourceSec = 14400;
    private double veryLongSourceSec = 21600;
    private double baseScoreThreshold = 0.45;
    private double longScoreThreshold = 0.50;
    private double veryLongScoreThreshold = 0.55;
    private double overfillFactor = 1.15;

    private int premiereHour = 18;
    private int premiereMinute = 0;
    private String timeZone = "Europe/Warsaw";
    private int firstPremiereOffsetDays = 1;

    private boolean useEntitiesInTitle = true;
    private List<String> entities = new ArrayList<>();
    private String baseTitle = "Highlights";
    private int titleMaxLength = 100;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getMinDurationForSplit() {
        return minDurationForSplit;
    }

    public void setMinDurationForSplit(double minDurationForSplit) {
        this.minDurationForSplit = minDurationForSplit;
    }

    public double getCompressionRatio() {
        return compressionRatio;
    }

    public void setCompressionRatio(double compressionRatio) {
        this.compressionRatio = compressionRatio;
    }

    public int getPartMinDuration() {
        return partMinDuration;
    }

    public void setPartMinDuration(int partMinDuration) {
        this.partMinDuration = partMinDuration;
    }

    public int getPartMaxDuration() {
        return partMaxDuration;
    }

    public void setPartMaxDuration(int partMaxDuration) {
        this.partMaxDuration = partMaxDuration;
    }

    public double getLongSourceSec() {
        return longSourceSec;
    }

    public void setLongSourceSec(double longSourceSec) {
        this.longSourceSec = longSourceSec;
    }

    public double getVeryLongSourceSec() {
        return veryLongSourceSec;
    }

    public void setVeryLongSourceSec(double veryLongSourceSec) {
        this.veryLongSourceSec = veryLongSourceSec;
    }

    public double getBaseScoreThreshold() {
        return baseScoreThreshold;
    }

    public void setBaseScoreThreshold(double baseScoreThreshold) {
        this.baseScoreThreshold = baseScoreThreshold;
    }

    public double getLongScoreThreshold() {
        return longScoreThreshold;
    }

    public void setLongScoreThreshold(double longScoreThreshold) {
        this.longScoreThreshold = longScoreThreshold;
    }

    public double getVeryLongScoreThreshold() {
        return veryLongScoreThreshold;
    }

    public void setVeryLongScoreThreshold(double veryLongScoreThreshold) {
        this.veryLongScoreThreshold = veryLongScoreThreshold;
    }

    public double getOverfillFactor() {
        return overfillFactor;
    }

    public void setOverfillFactor(double overfillFactor) {
        this.overfillFactor = overfillFactor;
    }

    public int getPremiereHour() {
        return premiereHour;
    }

    public void setPremiereHour(int premiereHour) {
        this.premiereHour = premiereHour;
    }

    public int getPremiereMinute() {
        return premiereMinute;
    }

    public void setPremiereMinute(int premiereMinute) {
        this.premiereMinute = premiereMinute;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public int getFirstPremiereOffsetDays() {
        return firstPremiereOffsetDays;
    }

    public void setFirstPremiereOffsetDays(int firstPremiereOffsetDays) {
        this.firstPremiereOffsetDays = firstPremiereOffsetDays;
    }

    public boolean isUseEntitiesInTitle() {
        return useEntitiesInTitle;
    }

    public void setUseEntitiesInTitle(boolean useEntitiesInTitle) {
        this.useEntitiesInTitle = useEntitiesInTitle;
    }

    public List<String> getEntities() {
        return entities;
    }

    public void setEntities(List<String> entities) {
        this.entities = entities;
    }

    public String getBaseTitle() {
        return baseTitle;
    }

    public void setBaseTitle(String baseTitle) {
        this.baseTitle = baseTitle;
    }

    public int getTitleMaxLength() {
        return titleMaxLength;
    }

    public void setTitleMaxLength(int titleMaxLength) {
        this.titleMaxLength = titleMaxLength;
    }
}
