package com.phillippitts.voicegraph.service.node;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;

/**
 * Trait of nodes that yield processed audio.
 */
public interface AudioOutputCapable extends Node {

    /**
     * Declared output format, or {@code null} if the node cannot state one yet.
     */
    AudioFormat getOutputFormat();

    /**
     * Pulls the most recent output.
     *
     * @return latest output, or {@code null} if nothing has been produced
     */
    AudioBuffer pullAudioOutput(ProcessingContext context);
}
