package com.phillippitts.voicegraph.testutil;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.node.AbstractProcessorNode;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Processor that records every buffer it receives and forwards it unchanged.
 *
 * <p>{@code onProcess} runs before forwarding; tests use it to throw or to cancel a context
 * mid-pass.
 */
public class RecordingNode extends AbstractProcessorNode {
    public final List<AudioBuffer> received = new CopyOnWriteArrayList<>();
    public volatile Consumer<ProcessingContext> onProcess = ctx -> { };
    public volatile boolean valid = true;

    public RecordingNode(String id) {
        super(id, id);
    }

    @Override
    public boolean validate() {
        return valid;
    }

    @Override
    protected AudioBuffer processAudio(AudioBuffer input, ProcessingContext context) {
        received.add(input);
        onProcess.accept(context);
        return input;
    }
}
