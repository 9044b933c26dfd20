package com.phillippitts.voicegraph.exception;

/**
 * Thrown when a propagation pass fails. Wraps the unexpected cause and carries the id of
 * the pipeline whose pass failed.
 */
public class PipelineExecutionException extends VoiceGraphException {

    private final String pipelineId;

    public PipelineExecutionException(String pipelineId, String message) {
        super(message + " (pipeline: " + pipelineId + ")");
        this.pipelineId = pipelineId;
    }

    public PipelineExecutionException(String pipelineId, String message, Throwable cause) {
        super(message + " (pipeline: " + pipelineId + ")", cause);
        this.pipelineId = pipelineId;
    }

    public String getPipelineId() {
        return pipelineId;
    }
}
