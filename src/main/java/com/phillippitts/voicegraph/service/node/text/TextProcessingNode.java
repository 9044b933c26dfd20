package com.phillippitts.voicegraph.service.node.text;

import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.event.TextProcessedEvent;
import com.phillippitts.voicegraph.service.node.streaming.AbstractStreamingNode;
import com.phillippitts.voicegraph.util.LogSanitizer;
import com.phillippitts.voicegraph.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs text payloads through an ordered chain of {@link TextProcessor}s and forwards the
 * result. Sits between a transcription node and a speech synthesis node, for example to
 * generate a reply.
 */
public class TextProcessingNode extends AbstractStreamingNode {

    private static final Logger LOG = LogManager.getLogger(TextProcessingNode.class);

    private final List<TextProcessor> processors = new CopyOnWriteArrayList<>();
    private volatile String lastOutput;

    public TextProcessingNode(String id, String name) {
        super(id, name);
    }

    public void addProcessor(TextProcessor processor) {
        processors.add(Objects.requireNonNull(processor, "processor"));
    }

    public boolean removeProcessor(TextProcessor processor) {
        return processors.remove(processor);
    }

    public int getProcessorCount() {
        return processors.size();
    }

    public String getLastOutput() {
        return lastOutput;
    }

    @Override
    public boolean acceptData(Object payload, ProcessingContext context) {
        if (!isEnabled() || !(payload instanceof CharSequence sequence)) {
            return false;
        }
        if (context != null && context.isCancellationRequested()) {
            return false;
        }
        String input = sequence.toString();
        long start = System.nanoTime();
        String output = input;
        try {
            for (TextProcessor processor : processors) {
                output = processor.process(output, context);
                if (output == null) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            getStatus().recordError(e.getMessage());
            throw e;
        }
        trackProcessing(TimeUtils.elapsedSince(start));
        if (output == null) {
            LOG.debug("Node '{}' dropped text: {}", getId(), LogSanitizer.preview(input));
            return true;
        }
        lastOutput = output;
        publish(new TextProcessedEvent(getId(), input, output, context, Instant.now()));
        propagateToOutputs(output, context);
        return true;
    }

    @Override
    protected void doReset() {
        lastOutput = null;
    }
}
