package com.phillippitts.voicegraph.service.node.processor;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.exception.UnsupportedMixFormatException;
import com.phillippitts.voicegraph.service.audio.AudioMixing;
import com.phillippitts.voicegraph.service.node.AbstractProcessorNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mixes the most recent buffer from each source into one output.
 *
 * <p><b>Buffer table:</b> every accepted buffer is stored under a source id taken from the
 * context's transient data ({@value #SOURCE_ID_KEY}), or a fresh id when absent. Before each
 * mix, entries older than {@code maxBufferAgeMs} are evicted. Only buffers with the same
 * format as the oldest surviving entry take part.
 *
 * <p><b>Thread Safety:</b> the table is guarded by a lock private to this node, so sources
 * feeding the mixer from other threads never wait on the pipeline's execution guard.
 *
 * <p>{@link #reset()} drops buffered audio but keeps channel weights and settings.
 */
public class AudioMixerNode extends AbstractProcessorNode {

    private static final Logger LOG = LogManager.getLogger(AudioMixerNode.class);

    /** Transient-data key carrying the caller's source id. */
    public static final String SOURCE_ID_KEY = "sourceId";
    public static final String CONFIG_MAX_BUFFER_AGE_MS = "maxBufferAgeMs";
    public static final String CONFIG_NORMALIZE = "normalize";
    public static final long DEFAULT_MAX_BUFFER_AGE_MS = 5000;

    private final ReentrantLock bufferLock = new ReentrantLock();
    private final Map<String, TimestampedBuffer> buffers = new LinkedHashMap<>();
    private final Clock clock;
    private volatile double[] channelWeights = new double[0];

    public AudioMixerNode(String id, String name) {
        this(id, name, Clock.systemUTC());
    }

    public AudioMixerNode(String id, String name, Clock clock) {
        super(id, name);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public long getMaxBufferAgeMs() {
        return (long) getConfigurationNumber(CONFIG_MAX_BUFFER_AGE_MS, DEFAULT_MAX_BUFFER_AGE_MS);
    }

    public void setMaxBufferAgeMs(long maxBufferAgeMs) {
        if (maxBufferAgeMs <= 0) {
            throw new IllegalArgumentException("maxBufferAgeMs must be > 0");
        }
        setConfigurationValue(CONFIG_MAX_BUFFER_AGE_MS, maxBufferAgeMs);
    }

    public boolean isNormalize() {
        return getConfigurationFlag(CONFIG_NORMALIZE, true);
    }

    public void setNormalize(boolean normalize) {
        setConfigurationValue(CONFIG_NORMALIZE, normalize);
    }

    public double getChannelWeight(int channel) {
        double[] weights = channelWeights;
        return channel < weights.length ? weights[channel] : 1.0;
    }

    /**
     * Sets the weight applied to one channel of every source.
     */
    public void setChannelWeight(int channel, double weight) {
        if (channel < 0) {
            throw new IllegalArgumentException("channel must be >= 0");
        }
        double[] weights = channelWeights;
        double[] updated = Arrays.copyOf(weights, Math.max(weights.length, channel + 1));
        for (int i = weights.length; i < updated.length; i++) {
            updated[i] = 1.0;
        }
        updated[channel] = weight;
        channelWeights = updated;
    }

    public int getBufferedSourceCount() {
        bufferLock.lock();
        try {
            return buffers.size();
        } finally {
            bufferLock.unlock();
        }
    }

    @Override
    protected AudioBuffer processAudio(AudioBuffer input, ProcessingContext context) {
        String sourceId = context == null ? null : context.getTransientData(SOURCE_ID_KEY, String.class, null);
        if (sourceId == null) {
            sourceId = UUID.randomUUID().toString();
        }

        List<AudioBuffer> compatible;
        bufferLock.lock();
        try {
            Instant now = clock.instant();
            buffers.remove(sourceId);
            buffers.put(sourceId, new TimestampedBuffer(input, now));
            evictExpired(now);
            compatible = compatibleBuffers();
        } finally {
            bufferLock.unlock();
        }

        if (compatible.isEmpty()) {
            return input;
        }
        if (compatible.size() == 1) {
            return compatible.get(0);
        }
        try {
            return AudioMixing.mixSources(compatible, channelWeights, isNormalize());
        } catch (UnsupportedMixFormatException e) {
            LOG.warn("Node '{}': {}", getId(), e.getMessage());
            if (context != null) {
                context.logWarning(e.getMessage());
            }
            return compatible.get(0);
        }
    }

    private void evictExpired(Instant now) {
        Duration maxAge = Duration.ofMillis(getMaxBufferAgeMs());
        Iterator<TimestampedBuffer> it = buffers.values().iterator();
        while (it.hasNext()) {
            TimestampedBuffer entry = it.next();
            if (Duration.between(entry.admittedAt(), now).compareTo(maxAge) > 0) {
                it.remove();
            }
        }
    }

    private List<AudioBuffer> compatibleBuffers() {
        List<AudioBuffer> result = new ArrayList<>(buffers.size());
        AudioFormat reference = null;
        for (TimestampedBuffer entry : buffers.values()) {
            if (reference == null) {
                reference = entry.buffer().format();
            }
            if (entry.buffer().format().equals(reference)) {
                result.add(entry.buffer());
            }
        }
        return result;
    }

    @Override
    protected void doReset() {
        super.doReset();
        bufferLock.lock();
        try {
            buffers.clear();
        } finally {
            bufferLock.unlock();
        }
    }

    private record TimestampedBuffer(AudioBuffer buffer, Instant admittedAt) {
    }
}
