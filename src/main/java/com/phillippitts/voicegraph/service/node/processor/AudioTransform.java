package com.phillippitts.voicegraph.service.node.processor;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.ProcessingContext;

/**
 * Per-channel transform applied by {@link AudioSplitterNode}.
 */
@FunctionalInterface
public interface AudioTransform {

    /**
     * @param buffer a private copy of the splitter input; may be modified or replaced
     * @return the buffer to send down the channel
     */
    AudioBuffer apply(AudioBuffer buffer, ProcessingContext context);
}
