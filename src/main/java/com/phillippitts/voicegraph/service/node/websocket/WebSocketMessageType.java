package com.phillippitts.voicegraph.service.node.websocket;

public enum WebSocketMessageType {
    TEXT,
    BINARY,
    CLOSE
}
