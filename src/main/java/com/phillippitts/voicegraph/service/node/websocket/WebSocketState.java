package com.phillippitts.voicegraph.service.node.websocket;

/**
 * Transport states: {@code NONE -> CONNECTING -> OPEN -> (CLOSE_SENT | CLOSE_RECEIVED) -> CLOSED}.
 */
public enum WebSocketState {
    NONE,
    CONNECTING,
    OPEN,
    CLOSE_SENT,
    CLOSE_RECEIVED,
    CLOSED
}
