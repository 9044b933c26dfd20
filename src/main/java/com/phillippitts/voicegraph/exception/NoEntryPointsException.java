package com.phillippitts.voicegraph.exception;

/**
 * Thrown by {@code Pipeline.execute} when no enabled audio-input node is registered.
 */
public class NoEntryPointsException extends PipelineExecutionException {

    public NoEntryPointsException(String pipelineId) {
        super(pipelineId, "No entry points found in the pipeline");
    }
}
