package com.phillippitts.voicegraph.service.node.websocket;

import com.phillippitts.voicegraph.exception.TransportException;

import java.net.URI;
import java.time.Duration;

/**
 * Client socket used by {@link AbstractWebSocketNode}. One instance covers one connection
 * attempt; after it leaves {@link WebSocketState#NONE} it is never reused for a new connect.
 *
 * @see OkHttpWebSocketTransport
 */
public interface WebSocketTransport {

    /** Normal closure status code. */
    int NORMAL_CLOSURE = 1000;

    WebSocketState getState();

    /**
     * Opens the socket, blocking until it is open or the attempt failed.
     *
     * @throws TransportException if the handshake fails or times out
     */
    void connect(URI endpoint);

    /**
     * Sends a frame. Partial frames ({@code endOfMessage == false}) are buffered until the
     * final fragment arrives.
     *
     * @throws TransportException if the socket is not open or the send is rejected
     */
    void send(byte[] data, WebSocketMessageType messageType, boolean endOfMessage);

    /**
     * Copies the next inbound frame (or the next part of it) into {@code buffer}.
     *
     * @return the receive result, or {@code null} if nothing arrived within {@code timeout}
     * @throws TransportException if the connection failed
     */
    WebSocketReceiveResult receive(byte[] buffer, Duration timeout);

    /**
     * Starts or completes the close handshake.
     */
    void close(int statusCode, String reason);

    /**
     * Releases the underlying socket without a handshake. Idempotent.
     */
    void release();
}
