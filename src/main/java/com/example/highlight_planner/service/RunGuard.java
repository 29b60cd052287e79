package com.example.highlight_planner.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-flight lock: at most one pipeline run is active at a time.
 */
@Component
public class RunGuard {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunGuard.class);

    private final AtomicReference<RunHandle> active = new AtomicReference<>();
    private final Clock clock;

    public RunGuard(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return a fresh handle, or empty when another run holds the lock
     */
    public Optional<RunHandle> tryAcquire() {
        RunHandle handle = new RunHandle(UUID.randomUUID(), clock.instant());
        if (active.compareAndSet(null, handle)) {
            LOGGER.debug("RUN acquired id={}", handle.id());
            return Optional.of(handle);
        }
        return Optional.empty();
    }

    public void release(RunHandle handle) {
        if (!active.compareAndSet(handle, null)) {
            LOGGER.warn("RUN release ignored, id={} is not the active run", handle.id());
            return;
        }
        LOGGER.debug("RUN released id={}", handle.id());
    }

    public Optional<RunHandle> current() {
        return Optional.ofNullable(active.get());
    }
}
