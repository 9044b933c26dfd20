package com.phillippitts.voicegraph.exception;

/**
 * Thrown when a send is attempted on a WebSocket node whose transport is not open.
 */
public class NotConnectedException extends TransportException {

    public NotConnectedException(String nodeId) {
        super("WebSocket is not connected", nodeId);
    }
}
