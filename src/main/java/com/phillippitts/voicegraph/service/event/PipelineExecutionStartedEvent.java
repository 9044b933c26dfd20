package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a pipeline pass has acquired the execution guard and begins routing.
 */
public record PipelineExecutionStartedEvent(
        String pipelineId,
        UUID executionId,
        ProcessingContext context,
        Instant startedAt
) {
}
