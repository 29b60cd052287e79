package com.example.highlight_planner.service;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Identity and cancellation flag of one pipeline run.
 */
public final class RunHandle {
    private final UUID id;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RunHandle(UUID id, Instant startedAt) {
        this.id = id;
        this.startedAt = startedAt;
    }

    public UUID id() {
        return id;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws RunCancelledException if cancellation was requested
     */
    public void checkpoint(String stage) {
        if (cancelled.get()) {
            throw new RunCancelledException(id, stage);
        }
    }
}
