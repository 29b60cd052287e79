package com.example.highlight_planner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProcessingMode {
    POLITICAL_SESSION("political_session"),
    STREAM("stream");

    private final String code;

    ProcessingMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ProcessingMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return POLITICAL_SESSION;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "political_session", "political", "session", "sejm" -> POLITICAL_SESSION;
            case "stream", "live", "livestream", "vod" -> STREAM;
            default -> throw new IllegalArgumentException("Unknown processing mode: " + value);
        };
    }
}
