package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Instant;

/**
 * Published by a connection after its target accepted a payload.
 */
public record DataTransferredEvent(
        String connectionId,
        String sourceNodeId,
        String targetNodeId,
        Object data,
        ProcessingContext context,
        Instant at
) {
    public DataTransferredEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
