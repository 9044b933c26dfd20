package com.phillippitts.voicegraph.exception;

/**
 * Thrown when a socket-level operation of a WebSocket node fails (connect, send, receive,
 * close handshake).
 */
public class TransportException extends VoiceGraphException {

    private final String nodeId;

    public TransportException(String message) {
        super(message);
        this.nodeId = "unknown";
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.nodeId = "unknown";
    }

    public TransportException(String message, String nodeId) {
        super(message + " (node: " + nodeId + ")");
        this.nodeId = nodeId;
    }

    public TransportException(String message, String nodeId, Throwable cause) {
        super(message + " (node: " + nodeId + ")", cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
