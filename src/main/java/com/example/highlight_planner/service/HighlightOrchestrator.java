package com.example.highlight_planner.service;

import com.example.highlight_planner.config.SelectionProperties;
import com.example.highlight_planner.dto.HighlightResult;
import com.example.highlight_planner.dto.web.HighlightRequest;
import com.example.highlight_planner.model.ChatHistogram;
import com.example.highlight_planner.model.ProcessingMode;
import com.example.highlight_planner.selector.SelectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for callers: validates a request, holds the single-flight lock for the duration
 * of the run and translates cancellation into a result.
 */
@Service
public class HighlightOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(HighlightOrchestrator.class);

    private final HighlightPipeline pipeline;
    private final RunGuard runGuard;
    private final SegmentInputMapper segmentMapper;
    private final ChatHistogramParser chatParser;
    private final SelectionProperties selectionProperties;

    public HighlightOrchestrator(HighlightPipeline pipeline,
                                 RunGuard runGuard,
                                 SegmentInputMapper segmentMapper,
                                 ChatHistogramParser chatParser,
                                 SelectionProperties selectionProperties) {
        this.pipeline = pipeline;
        this.runGuard = runGuard;
        this.segmentMapper = segmentMapper;
        this.chatParser = chatParser;
        this.selectionProperties = selectionProperties;
    }

    public HighlightResult plan(HighlightRequest request) {
        HighlightJob job = toJob(request);
        RunHandle handle = runGuard.tryAcquire()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.CONFLICT, "RUN_IN_PROGRESS"));
        try {
            return pipeline.run(job, handle);
        } catch (RunCancelledException ex) {
            LOGGER.info("RUN cancelled id={} stage={}", ex.getRunId(), ex.getStage());
            return HighlightResult.cancelled(handle.id(), job.mode(), ex.getStage());
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("RUN id={} rejected: {}", handle.id(), ex.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_CONFIGURATION", ex);
        } finally {
            runGuard.release(handle);
        }
    }

    /**
     * Requests cancellation of the active run; it stops at the next stage boundary.
     *
     * @return id of the run asked to stop, empty when nothing is running
     */
    public Optional<UUID> cancelCurrent() {
        return runGuard.current().map(handle -> {
            handle.cancel();
            LOGGER.info("RUN cancellation requested id={}", handle.id());
            return handle.id();
        });
    }

    HighlightJob toJob(HighlightRequest request) {
        try {
            SelectionConfig selection = selectionProperties.toConfig();
            if (request.selection() != null) {
                selection = request.selection().applyTo(selection);
            }
            ChatHistogram chat = request.chatHistogram() != null && !request.chatHistogram().isEmpty()
                    ? ChatHistogram.of(request.chatHistogram())
                    : chatParser.parse(request.chatExport());
            SegmentInputMapper.Mapped mapped = segmentMapper.map(request.segments());
            return new HighlightJob(
                    request.mode() == null ? ProcessingMode.POLITICAL_SESSION : request.mode(),
                    request.sourceDurationSec() == null ? 0.0 : request.sourceDurationSec(),
                    mapped.segments(),
                    mapped.rejectedIds(),
                    chat,
                    request.prompt(),
                    request.weights(),
                    selection,
                    selectionProperties.getShorts().toConfig(),
                    request.split() == null || request.split(),
                    request.parts(),
                    request.targetMinutes(),
                    request.baseTitle(),
                    request.premiereBaseDate());
        } catch (IllegalArgumentException ex) {
            LOGGER.warn("RUN invalid configuration: {}", ex.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_CONFIGURATION", ex);
        }
    }
}
