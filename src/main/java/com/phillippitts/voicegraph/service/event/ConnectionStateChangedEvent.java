package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.service.node.websocket.WebSocketState;

import java.time.Instant;

/**
 * Published by a WebSocket node after a connect or disconnect changed its transport state.
 */
public record ConnectionStateChangedEvent(
        String nodeId,
        WebSocketState previousState,
        WebSocketState currentState,
        Instant at
) {
    public ConnectionStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
