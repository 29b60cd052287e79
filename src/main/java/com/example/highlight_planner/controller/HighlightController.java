package com.example.highlight_planner.controller;

import com.example.highlight_planner.dto.HighlightResult;
import com.example.highlight_planner.dto.web.HighlightRequest;
import com.example.highlight_planner.model.SplitPlan;
import com.example.highlight_planner.service.HighlightOrchestrator;
import com.example.highlight_planner.service.split.SplitPlanner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/v1/highlights")
@Validated
public class HighlightController {

    private final HighlightOrchestrator orchestrator;
    private final SplitPlanner splitPlanner;

    public HighlightController(HighlightOrchestrator orchestrator, SplitPlanner splitPlanner) {
        this.orchestrator = orchestrator;
        this.splitPlanner = splitPlanner;
    }

    @Operation(summary = "Score, select and plan highlight clips for one source")
    @ApiResponse(responseCode = "200", description = "Run finished, cancelled or found no candidates")
    @ApiResponse(responseCode = "400", description = "Invalid request or selection configuration")
    @ApiResponse(responseCode = "409", description = "Another run is in progress")
    @PostMapping("/plan")
    public HighlightResult plan(@Valid @RequestBody HighlightRequest request) {
        return orchestrator.plan(request);
    }

    @Operation(summary = "Preview how a source of the given length would be split into parts")
    @GetMapping("/split-plan")
    public SplitPlan previewSplit(@RequestParam double sourceDurationSec,
                                  @RequestParam(required = false) Integer parts,
                                  @RequestParam(required = false) Integer targetMinutes) {
        try {
            return splitPlanner.calculateSplitStrategy(sourceDurationSec, parts, targetMinutes);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "INVALID_SPLIT_REQUEST", ex);
        }
    }

    @Operation(summary = "Ask the active run to stop at its next stage boundary")
    @ApiResponse(responseCode = "202", description = "Cancellation requested")
    @ApiResponse(responseCode = "404", description = "No run is active")
    @DeleteMapping("/runs/current")
    public ResponseEntity<Map<String, Object>> cancelCurrent() {
        return orchestrator.cancelCurrent()
                .map(runId -> ResponseEntity.status(HttpStatus.ACCEPTED)
                        .body(Map.<String, Object>of("runId", runId, "status", "CANCELLING")))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "NO_ACTIVE_RUN"));
    }
}
