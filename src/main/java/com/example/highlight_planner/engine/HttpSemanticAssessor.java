package com.example.highlight_planner.engine;

import com.example.highlight_planner.config.SemanticClientProperties;
import com.example.highlight_planner.dto.SemanticItem;
import com.example.highlight_planner.engine.Interfaces.SemanticAssessor;
import com.example.highlight_planner.util.ScoreMath;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts a batch of transcripts to the assessment service.
 *
 * <p>Request: {@code {"items":[{"id":..,"transcript":..}]}}. The response holds a {@code scores}
 * array, either objects {@code {"id":..,"score":..}} or bare numbers in request order.</p>
 */
public class HttpSemanticAssessor implements SemanticAssessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpSemanticAssessor.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final SemanticClientProperties properties;

    public HttpSemanticAssessor(WebClient webClient, ObjectMapper objectMapper, SemanticClientProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public Map<String, Double> assess(List<SemanticItem> batch) {
        if (batch == null || batch.isEmpty()) {
            return Map.of();
        }
        List<Map<String, String>> items = new ArrayList<>(batch.size());
        for (SemanticItem item : batch) {
            items.add(Map.of("id", item.id(), "transcript", truncate(item.transcript())));
        }
        try {
            String payload = webClient.post()
                    .uri(properties.getPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("items", items))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (payload == null || payload.isBlank()) {
                throw new SemanticAssessmentException("SEMANTIC empty response for batch of " + batch.size());
            }
            return parseScores(objectMapper.readTree(payload), batch);
        } catch (WebClientResponseException ex) {
            throw new SemanticAssessmentException("SEMANTIC status=" + ex.getStatusCode().value(), ex);
        } catch (WebClientRequestException | JsonProcessingException ex) {
            throw new SemanticAssessmentException("SEMANTIC request failed: " + ex.getMessage(), ex);
        }
    }

    Map<String, Double> parseScores(JsonNode root, List<SemanticItem> batch) {
        JsonNode scores = root.isArray() ? root : root.path("scores");
        if (!scores.isArray()) {
            throw new SemanticAssessmentException("SEMANTIC response has no scores array");
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 0; i < scores.size(); i++) {
            JsonNode node = scores.get(i);
            if (node.isNumber()) {
                if (i < batch.size()) {
                    out.put(batch.get(i).id(), ScoreMath.clamp(node.asDouble()));
                }
            } else if (node.hasNonNull("id") && node.path("score").isNumber()) {
                out.put(node.get("id").asText(), ScoreMath.clamp(node.get("score").asDouble()));
            }
        }
        if (out.size() < batch.size()) {
            LOGGER.debug("SEMANTIC partial response scored={} requested={}", out.size(), batch.size());
        }
        return out;
    }

    private String truncate(String transcript) {
        if (transcript == null) {
            return "";
        }
        int limit = Math.max(1, properties.getMaxTranscriptChars());
        return transcript.length() <= limit ? transcript : transcript.substring(0, limit);
    }
}
