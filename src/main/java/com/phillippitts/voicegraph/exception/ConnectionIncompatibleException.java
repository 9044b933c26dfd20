package com.phillippitts.voicegraph.exception;

/**
 * Thrown during connection validation when the source and target nodes cannot be joined:
 * the source exposes no audio output, the target accepts no audio, or the source's output
 * format is not among the target's supported formats.
 *
 * <p>Raised instead of returning {@code false} so that callers can tell an actively
 * incompatible connection apart from one that has simply not been validated yet.
 */
public class ConnectionIncompatibleException extends VoiceGraphException {

    private final String sourceNodeId;
    private final String targetNodeId;

    public ConnectionIncompatibleException(String sourceNodeId, String targetNodeId, String message) {
        super(message + " (" + sourceNodeId + " -> " + targetNodeId + ")");
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
    }

    public String getSourceNodeId() {
        return sourceNodeId;
    }

    public String getTargetNodeId() {
        return targetNodeId;
    }
}
