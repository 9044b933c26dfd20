package com.phillippitts.voicegraph.service.event;

import java.time.Instant;

/**
 * Published once per transition of a streaming node from streaming back to idle.
 */
public record StreamingStoppedEvent(String nodeId, Instant at) {
    public StreamingStoppedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
