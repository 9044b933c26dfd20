package com.phillippitts.voicegraph.service.node.processor;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.node.AbstractProcessorNode;

/**
 * Forwards audio unchanged. Useful as a junction or a tap point.
 */
public class PassthroughNode extends AbstractProcessorNode {

    public PassthroughNode(String id, String name) {
        super(id, name);
    }

    @Override
    protected AudioBuffer processAudio(AudioBuffer input, ProcessingContext context) {
        return input;
    }
}
