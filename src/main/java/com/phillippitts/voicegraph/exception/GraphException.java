package com.phillippitts.voicegraph.exception;

/**
 * Thrown when a structural graph operation is rejected: duplicate node or connection id,
 * unknown id on connect/remove, or a node that is already owned by another pipeline.
 *
 * <p>Always fatal to the specific call and never retried. The graph is left unchanged.
 */
public class GraphException extends VoiceGraphException {

    private final String pipelineId;
    private final String elementId;

    public GraphException(String pipelineId, String elementId, String message) {
        super(message + " (pipeline: " + pipelineId + ")");
        this.pipelineId = pipelineId;
        this.elementId = elementId;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    /**
     * @return the node or connection id the rejected operation referred to
     */
    public String getElementId() {
        return elementId;
    }
}
