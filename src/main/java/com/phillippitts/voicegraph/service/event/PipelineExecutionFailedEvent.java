package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a pass failed. The same error is re-raised to the caller.
 */
public record PipelineExecutionFailedEvent(
        String pipelineId,
        UUID executionId,
        ProcessingContext context,
        Throwable error,
        Instant at
) {
    public PipelineExecutionFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
