package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Instant;

/**
 * Published once per transition of a streaming node from idle to streaming. The context is
 * bound to the new streaming cancellation scope.
 */
public record StreamingStartedEvent(String nodeId, ProcessingContext context, Instant at) {
    public StreamingStartedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
