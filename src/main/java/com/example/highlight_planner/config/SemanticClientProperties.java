package com.example.highlight_planner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings of the external semantic assessment service. Without a base URL the
 * collaborator is treated as unavailable.
 */
@ConfigurationProperties(prefix = "highlight.semantic")
public class SemanticClientProperties {

    private String baseUrl;
    private String path = "/v1/assess";
    private String apiKey;
    private int connectTimeoutMs = 5000;
    private int responseTimeoutSec = 30;
    private int maxTranscriptChars = 400;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getResponseTimeoutSec() {
        return responseTimeoutSec;
    }

    public void setResponseTimeoutSec(int responseTimeoutSec) {
        this.responseTimeoutSec = responseTimeoutSec;
    }

    public int getMaxTranscriptChars() {
        return maxTranscriptChars;
    }

    public void setMaxTranscriptChars(int maxTranscriptChars) {
        this.maxTranscriptChars = maxTranscriptChars;
    }
}
