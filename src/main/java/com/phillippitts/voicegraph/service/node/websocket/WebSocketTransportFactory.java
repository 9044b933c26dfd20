package com.phillippitts.voicegraph.service.node.websocket;

/**
 * Creates a fresh transport for each connect attempt.
 */
@FunctionalInterface
public interface WebSocketTransportFactory {

    WebSocketTransport create();
}
