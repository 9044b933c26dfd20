package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.node.websocket.WebSocketMessageType;

import java.time.Instant;

/**
 * Published by the receive loop for every non-close frame, before node-specific handling.
 * {@code data} is a private copy of the frame bytes.
 */
public record WebSocketMessageReceivedEvent(
        String nodeId,
        byte[] data,
        WebSocketMessageType messageType,
        boolean endOfMessage,
        ProcessingContext context,
        Instant at
) {
    public WebSocketMessageReceivedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
