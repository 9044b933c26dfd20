package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when a pipeline pass collected its exit-point outputs.
 */
public record PipelineExecutionCompletedEvent(
        String pipelineId,
        UUID executionId,
        ProcessingContext context,
        Instant startedAt,
        Instant endedAt,
        List<AudioBuffer> results
) {
    public PipelineExecutionCompletedEvent {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public Duration duration() {
        return Duration.between(startedAt, endedAt);
    }
}
