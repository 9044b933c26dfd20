package com.phillippitts.voicegraph.service.node;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.event.NodeProcessingEvent;
import com.phillippitts.voicegraph.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Base class for nodes that transform audio: accept a buffer, run
 * {@link #processAudio(AudioBuffer, ProcessingContext)}, remember the result and propagate it.
 *
 * <p>The supported-format list starts empty (any format accepted). The output format
 * follows the last processed buffer until a subclass pins it.
 *
 * @since 1.0
 */
public abstract class AbstractProcessorNode extends AbstractNode
        implements AudioInputCapable, AudioOutputCapable {

    private static final Logger LOG = LogManager.getLogger(AbstractProcessorNode.class);

    private final List<AudioFormat> supportedFormats = new CopyOnWriteArrayList<>();
    private volatile AudioFormat outputFormat = AudioFormat.DEFAULT;
    private volatile AudioBuffer lastInput;
    private volatile AudioBuffer lastOutput;

    protected AbstractProcessorNode(String id, String name) {
        super(id, name);
    }

    @Override
    public List<AudioFormat> getSupportedFormats() {
        return Collections.unmodifiableList(supportedFormats);
    }

    public void setSupportedFormats(List<AudioFormat> formats) {
        supportedFormats.clear();
        supportedFormats.addAll(formats);
    }

    @Override
    public AudioFormat getOutputFormat() {
        return outputFormat;
    }

    protected void setOutputFormat(AudioFormat outputFormat) {
        this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
    }

    @Override
    public AudioBuffer pullAudioOutput(ProcessingContext context) {
        return lastOutput;
    }

    public AudioBuffer getLastInput() {
        return lastInput;
    }

    @Override
    public boolean acceptAudio(AudioBuffer buffer, ProcessingContext context) {
        if (!isEnabled() || buffer == null) {
            return false;
        }
        if (context != null && context.isCancellationRequested()) {
            return false;
        }
        if (!isFormatSupported(buffer.format())) {
            String message = "Node '" + getId() + "' does not support format " + buffer.format();
            LOG.warn(message);
            if (context != null) {
                context.logWarning(message);
            }
            return false;
        }

        lastInput = buffer;
        long start = System.nanoTime();
        AudioBuffer output;
        try {
            output = processAudio(buffer, context);
        } catch (RuntimeException e) {
            getStatus().recordError(e.getMessage());
            throw e;
        }
        Duration elapsed = TimeUtils.elapsedSince(start);
        trackProcessing(elapsed);
        if (output == null) {
            return false;
        }

        lastOutput = output;
        outputFormat = output.format();
        publish(new NodeProcessingEvent(getId(), buffer, output, context, elapsed, Instant.now()));
        propagateProcessedAudio(output, context);
        return true;
    }

    /**
     * Forwards a processed buffer downstream. Defaults to every enabled outbound connection.
     */
    protected boolean propagateProcessedAudio(AudioBuffer output, ProcessingContext context) {
        return propagateToOutputs(output, context);
    }

    @Override
    protected void doReset() {
        lastInput = null;
        lastOutput = null;
    }

    /**
     * Transforms one buffer.
     *
     * @return the output buffer, or {@code null} to drop the input
     */
    protected abstract AudioBuffer processAudio(AudioBuffer input, ProcessingContext context);
}
