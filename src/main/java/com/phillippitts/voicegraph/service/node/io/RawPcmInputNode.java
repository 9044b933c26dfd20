package com.phillippitts.voicegraph.service.node.io;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.event.NodeProcessingEvent;
import com.phillippitts.voicegraph.service.node.AbstractNode;
import com.phillippitts.voicegraph.service.node.AudioInputCapable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry node for raw PCM supplied by the host application.
 *
 * <p>Accepted buffers are queued (so a host can drain what was fed) and propagated to every
 * outbound connection.
 */
public class RawPcmInputNode extends AbstractNode implements AudioInputCapable {

    private static final Logger LOG = LogManager.getLogger(RawPcmInputNode.class);

    private final List<AudioFormat> supportedFormats = new CopyOnWriteArrayList<>();
    private final Queue<AudioBuffer> queue = new ConcurrentLinkedQueue<>();

    public RawPcmInputNode(String id, String name) {
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
        queue.add(buffer);
        trackProcessing(Duration.ZERO);
        publish(new NodeProcessingEvent(getId(), buffer, buffer, context, Duration.ZERO, Instant.now()));
        propagateToOutputs(buffer, context);
        return true;
    }

    /**
     * Wraps raw bytes in a buffer and feeds it through {@link #acceptAudio}.
     */
    public boolean pushAudio(byte[] data, AudioFormat format, ProcessingContext context) {
        return acceptAudio(new AudioBuffer(data, format), context);
    }

    /**
     * @return the oldest queued buffer, or {@code null} if the queue is empty
     */
    public AudioBuffer nextQueuedAudio() {
        return queue.poll();
    }

    public boolean hasQueuedAudio() {
        return !queue.isEmpty();
    }

    public void clearQueue() {
        queue.clear();
    }

    @Override
    protected void doReset() {
        queue.clear();
    }
}
