package com.example.highlight_planner.service;

import com.example.highlight_planner.config.SelectionProperties;
import com.example.highlight_planner.dto.HighlightResult;
import com.example.highlight_planner.dto.web.HighlightRequest;
import com.example.highlight_planner.dto.web.SegmentInput;
import com.example.highlight_planner.dto.web.SelectionOverrides;
import com.example.highlight_planner.model.ProcessingMode;
import com.example.highlight_planner.util.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HighlightOrchestratorTest {

    @Mock
    private HighlightPipeline pipeline;

    private RunGuard runGuard;
    private HighlightOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        runGuard = new RunGuard(Clock.systemUTC());
        orchestrator = new HighlightOrchestrator(pipeline, runGuard, new SegmentInputMapper(),
                new ChatHistogramParser(), new SelectionProperties());
    }

    private static HighlightRequest request(List<SegmentInput> segments, SelectionOverrides selection) {
        return new HighlightRequest(ProcessingMode.STREAM, 600.0, segments, Map.of(10, 3), null, "budget",
                null, selection, null, null, null, null, null);
    }

    @Test
    void runsPipelineAndReleasesLock() {
        HighlightResult expected = new HighlightResult(UUID.randomUUID(), RunStatus.COMPLETED, null,
                ProcessingMode.STREAM, 600, List.of(), 0, List.of(), null, null, null);
        when(pipeline.run(any(HighlightJob.class), any(RunHandle.class))).thenReturn(expected);

        HighlightResult result = orchestrator.plan(request(List.of(
                new SegmentInput("a", 0.0, 30.0, null, null, null),
                new SegmentInput("bad", 30.0, 10.0, null, null, null)), null));

        assertThat(result).isSameAs(expected);
        assertThat(runGuard.current()).isEmpty();
        ArgumentCaptor<HighlightJob> job = ArgumentCaptor.forClass(HighlightJob.class);
        verify(pipeline).run(job.capture(), any(RunHandle.class));
        assertThat(job.getValue().segments()).hasSize(1);
        assertThat(job.getValue().rejectedSegmentIds()).containsExactly("bad");
        assertThat(job.getValue().chat().count(10)).isEqualTo(3);
        assertThat(job.getValue().splitEnabled()).isTrue();
        assertThat(job.getValue().mode()).isEqualTo(ProcessingMode.STREAM);
    }

    @Test
    void concurrentRunIsRejected() {
        runGuard.tryAcquire();

        assertThatThrownBy(() -> orchestrator.plan(request(List.of(), null)))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(ex -> {
                    ResponseStatusException rse = (ResponseStatusException) ex;
                    assertThat(rse.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(rse.getReason()).isEqualTo("RUN_IN_PROGRESS");
                });
        verify(pipeline, never()).run(any(), any());
    }

    @Test
    void cancellationBecomesCancelledResult() {
        when(pipeline.run(any(HighlightJob.class), any(RunHandle.class))).thenAnswer(invocation -> {
            RunHandle handle = invocation.getArgument(1);
            throw new RunCancelledException(handle.id(), "balance");
        });

        HighlightResult result = orchestrator.plan(request(List.of(), null));

        assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(result.message()).contains("balance");
        assertThat(runGuard.current()).isEmpty();
    }

    @Test
    void invalidSelectionOverrideIsBadRequest() {
        SelectionOverrides inverted = new SelectionOverrides(200.0, 100.0, null, null, null, null);

        assertThatThrownBy(() -> orchestrator.plan(request(List.of(), inverted)))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
        verify(pipeline, never()).run(any(), any());
        assertThat(runGuard.current()).isEmpty();
    }

    @Test
    void cancelCurrentFlagsActiveRun() {
        assertThat(orchestrator.cancelCurrent()).isEmpty();

        RunHandle handle = runGuard.tryAcquire().orElseThrow();

        assertThat(orchestrator.cancelCurrent()).contains(handle.id());
        assertThat(handle.isCancelled()).isTrue();
    }
}
