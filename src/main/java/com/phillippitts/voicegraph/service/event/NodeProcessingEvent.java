package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Duration;
import java.time.Instant;

/**
 * Published by processor nodes after their processing hook produced an output.
 */
public record NodeProcessingEvent(
        String nodeId,
        Object input,
        Object output,
        ProcessingContext context,
        Duration processingTime,
        Instant at
) {
    public NodeProcessingEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
