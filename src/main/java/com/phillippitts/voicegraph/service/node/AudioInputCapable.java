package com.phillippitts.voicegraph.service.node;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.util.List;

/**
 * Trait of nodes that accept audio buffers.
 */
public interface AudioInputCapable extends Node {

    /**
     * Formats this node accepts. An empty list accepts any format.
     */
    List<AudioFormat> getSupportedFormats();

    /**
     * Accepts a buffer, processes it and propagates the result downstream.
     *
     * @return {@code true} if the buffer was accepted
     */
    boolean acceptAudio(AudioBuffer buffer, ProcessingContext context);

    /**
     * Whether the pipeline should feed externally supplied audio into this node.
     * Pure sinks return {@code false} and only receive audio through connections.
     */
    default boolean isEntryPoint() {
        return true;
    }

    default boolean isFormatSupported(AudioFormat format) {
        List<AudioFormat> supported = getSupportedFormats();
        return supported.isEmpty() || supported.contains(format);
    }
}
