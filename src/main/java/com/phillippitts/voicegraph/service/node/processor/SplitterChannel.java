package com.phillippitts.voicegraph.service.node.processor;

/**
 * Named output channel of an {@link AudioSplitterNode}.
 *
 * @param id channel id matched against a connection's {@code channelId} configuration
 * @param transform optional transform, {@code null} for an unmodified copy
 * @param enabled whether the channel currently receives audio
 */
public record SplitterChannel(String id, AudioTransform transform, boolean enabled) {

    public SplitterChannel {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Channel id must not be blank");
        }
    }

    SplitterChannel withEnabled(boolean value) {
        return new SplitterChannel(id, transform, value);
    }
}
