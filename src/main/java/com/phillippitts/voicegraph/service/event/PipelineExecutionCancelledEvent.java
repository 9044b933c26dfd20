package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a pass observed a cancellation request and returned an empty result.
 */
public record PipelineExecutionCancelledEvent(
        String pipelineId,
        UUID executionId,
        ProcessingContext context,
        Instant at
) {
    public PipelineExecutionCancelledEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
