package com.example.highlight_planner.service;

import com.example.highlight_planner.config.ArtifactProperties;
import com.example.highlight_planner.dto.ShortCandidate;
import com.example.highlight_planner.model.Clip;
import com.example.highlight_planner.model.Segment;
import com.example.highlight_planner.model.SplitPlan;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Writes the intermediate documents of a run as JSON under {@code <directory>/<runId>/}.
 */
@Component
public class RunArtifactWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunArtifactWriter.class);

    private final ArtifactProperties properties;
    private final ObjectMapper objectMapper;

    public RunArtifactWriter(ArtifactProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public void write(UUID runId, List<Segment> scored, List<Clip> clips, List<ShortCandidate> shorts, SplitPlan plan) {
        if (!properties.isEnabled()) {
            return;
        }
        Path dir = Path.of(properties.getDirectory()).resolve(runId.toString());
        try {
            Files.createDirectories(dir);
            writeJson(dir.resolve("scored_segments.json"), scored);
            writeJson(dir.resolve("selected_clips.json"), clips);
            writeJson(dir.resolve("shorts_candidates.json"), shorts);
            if (plan != null) {
                writeJson(dir.resolve("split_plan.json"), plan);
            }
            LOGGER.info("ARTIFACTS written dir={}", dir);
        } catch (IOException ex) {
            LOGGER.warn("ARTIFACTS could not be written to {}: {}", dir, ex.getMessage());
        }
    }

    private void writeJson(Path file, Object value) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
    }
}
