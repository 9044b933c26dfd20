package com.phillippitts.voicegraph.service.node.processor;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.node.AbstractProcessorNode;
import com.phillippitts.voicegraph.service.node.NodeConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fans one input out to named channels.
 *
 * <p>For every enabled channel the input is copied, the channel transform applied, and the
 * result propagated only to outbound connections tagged with that channel id. Untagged
 * connections receive the original input, which is also the node's own output.
 *
 * <p>Per-channel results of the current pass are stored in transient data under
 * {@code "splitter.<nodeId>.<channelId>"}.
 */
public class AudioSplitterNode extends AbstractProcessorNode {

    private static final Logger LOG = LogManager.getLogger(AudioSplitterNode.class);

    private final Map<String, SplitterChannel> channels = new LinkedHashMap<>();

    public AudioSplitterNode(String id, String name) {
        super(id, name);
    }

    public void addChannel(String channelId, AudioTransform transform) {
        synchronized (channels) {
            if (channels.containsKey(channelId)) {
                throw new IllegalArgumentException("Channel '" + channelId + "' already exists on node " + getId());
            }
            channels.put(channelId, new SplitterChannel(channelId, transform, true));
        }
    }

    public boolean removeChannel(String channelId) {
        synchronized (channels) {
            return channels.remove(channelId) != null;
        }
    }

    public void setChannelEnabled(String channelId, boolean enabled) {
        synchronized (channels) {
            SplitterChannel channel = channels.get(channelId);
            if (channel == null) {
                throw new IllegalArgumentException("Unknown channel '" + channelId + "' on node " + getId());
            }
            channels.put(channelId, channel.withEnabled(enabled));
        }
    }

    public List<SplitterChannel> getChannels() {
        synchronized (channels) {
            return List.copyOf(channels.values());
        }
    }

    public static String channelResultKey(String nodeId, String channelId) {
        return "splitter." + nodeId + "." + channelId;
    }

    @Override
    protected AudioBuffer processAudio(AudioBuffer input, ProcessingContext context) {
        List<SplitterChannel> enabled = new ArrayList<>();
        for (SplitterChannel channel : getChannels()) {
            if (channel.enabled()) {
                enabled.add(channel);
            }
        }
        for (SplitterChannel channel : enabled) {
            if (context != null && context.isCancellationRequested()) {
                break;
            }
            AudioBuffer channelBuffer = input.copy();
            if (channel.transform() != null) {
                channelBuffer = channel.transform().apply(channelBuffer, context);
            }
            if (channelBuffer == null) {
                continue;
            }
            if (context != null) {
                context.setTransientData(channelResultKey(getId(), channel.id()), channelBuffer);
            }
            boolean delivered = propagateToOutputs(channelBuffer, context,
                    connection -> channel.id().equals(connection.getChannelId()));
            LOG.debug("Splitter '{}' channel '{}' delivered={}", getId(), channel.id(), delivered);
        }
        return input;
    }

    @Override
    protected boolean propagateProcessedAudio(AudioBuffer output, ProcessingContext context) {
        return propagateToOutputs(output, context, connection -> connection.getChannelId() == null);
    }

    /**
     * Clears buffered audio and re-enables every channel. Transforms are kept.
     */
    @Override
    protected void doReset() {
        super.doReset();
        synchronized (channels) {
            channels.replaceAll((id, channel) -> channel.withEnabled(true));
        }
    }
}
