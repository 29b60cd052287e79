package com.example.highlight_planner.service;

import java.util.UUID;

/**
 * Raised at a stage boundary once the active run was asked to stop.
 */
public class RunCancelledException extends RuntimeException {
    private final UUID runId;
    private final String stage;

    public RunCancelledException(UUID runId, String stage) {
        super("Run " + runId + " cancelled before stage " + stage);
        this.runId = runId;
        this.stage = stage;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getStage() {
        return stage;
    }
}
