package com.phillippitts.voicegraph.service.node.websocket;

/**
 * Outcome of one {@link WebSocketTransport#receive} call.
 *
 * @param count number of bytes written into the caller's buffer
 * @param messageType frame type; {@link WebSocketMessageType#CLOSE} carries no payload
 * @param endOfMessage {@code false} if the message continues in the next result
 */
public record WebSocketReceiveResult(int count, WebSocketMessageType messageType, boolean endOfMessage) {

    public static WebSocketReceiveResult close() {
        return new WebSocketReceiveResult(0, WebSocketMessageType.CLOSE, true);
    }
}
