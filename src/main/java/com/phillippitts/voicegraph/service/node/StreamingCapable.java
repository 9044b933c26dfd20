package com.phillippitts.voicegraph.service.node;

/**
 * Trait of nodes with an idle/streaming lifecycle. Both transitions are idempotent.
 */
public interface StreamingCapable extends Node {

    void startStreaming();

    void stopStreaming();

    boolean isStreaming();
}
