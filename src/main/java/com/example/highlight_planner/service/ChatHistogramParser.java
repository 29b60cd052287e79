package com.example.highlight_planner.service;

import com.example.highlight_planner.model.ChatHistogram;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a per-second histogram from a raw chat export.
 *
 * <p>Accepts a top-level array of messages or an object holding one under {@code messages},
 * {@code comments}, {@code data} or {@code chat}. Understands TwitchDownloader comments
 * ({@code content_offset_seconds}), yt-dlp replay items ({@code replayChatItemAction.videoOffsetTimeMsec})
 * and generic second or millisecond offsets. Generic values above 1e12 are milliseconds.</p>
 */
@Component
public class ChatHistogramParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChatHistogramParser.class);

    private static final List<String> CONTAINER_KEYS = List.of("messages", "comments", "data", "chat");
    private static final List<String> SECOND_KEYS = List.of("content_offset_seconds", "timestamp", "time", "offset", "offsetSeconds");
    private static final List<String> MILLIS_KEYS = List.of("timestamp_ms", "offset_ms", "videoOffsetTimeMsec");
    private static final double MILLIS_THRESHOLD = 1e12;

    public ChatHistogram parse(JsonNode export) {
        if (export == null || export.isNull() || export.isMissingNode()) {
            return ChatHistogram.empty();
        }
        JsonNode messages = export.isArray() ? export : null;
        if (messages == null && export.isObject()) {
            for (String key : CONTAINER_KEYS) {
                if (export.path(key).isArray()) {
                    messages = export.get(key);
                    break;
                }
            }
        }
        if (messages == null) {
            LOGGER.warn("CHAT export has no message array, treating as empty");
            return ChatHistogram.empty();
        }

        Map<Integer, Integer> counts = new HashMap<>();
        int skipped = 0;
        for (JsonNode message : messages) {
            Double seconds = timestamp(message);
            if (seconds == null) {
                skipped++;
                continue;
            }
            counts.merge((int) Math.max(0, seconds), 1, Integer::sum);
        }
        ChatHistogram histogram = ChatHistogram.of(counts);
        LOGGER.info("CHAT parsed messages={} seconds={} skipped={}", messages.size() - skipped, counts.size(), skipped);
        return histogram;
    }

    private static Double timestamp(JsonNode message) {
        if (message == null || !message.isObject()) {
            return null;
        }
        if (message.has("replayChatItemAction")) {
            return timestamp(message.get("replayChatItemAction"));
        }
        for (String key : MILLIS_KEYS) {
            Double value = number(message, key);
            if (value != null) {
                return value / 1000.0;
            }
        }
        for (String key : SECOND_KEYS) {
            Double value = number(message, key);
            if (value != null) {
                return value > MILLIS_THRESHOLD ? value / 1000.0 : value;
            }
        }
        return null;
    }

    private static Double number(JsonNode message, String key) {
        JsonNode node = message.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        Double value = null;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException ex) {
                LOGGER.debug("CHAT unparseable {}={}", key, node.asText());
            }
        }
        return value != null && Double.isFinite(value) ? value : null;
    }
}
