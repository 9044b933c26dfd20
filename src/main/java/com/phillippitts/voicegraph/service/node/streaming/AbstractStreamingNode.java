package com.phillippitts.voicegraph.service.node.streaming;

import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.node.AbstractNode;
import com.phillippitts.voicegraph.service.node.StreamingCapable;

/**
 * Base class for nodes with a streaming lifecycle, backed by a {@link StreamingLifecycle}.
 *
 * <p>{@link #shutdown()} always stops streaming before the node-specific cleanup runs.
 *
 * @since 1.0
 */
public abstract class AbstractStreamingNode extends AbstractNode implements StreamingCapable {

    private final StreamingLifecycle lifecycle;

    protected AbstractStreamingNode(String id, String name) {
        super(id, name);
        this.lifecycle = new StreamingLifecycle(id, new StreamingLifecycle.Hooks() {
            @Override
            public void onStartStreaming(ProcessingContext streamingContext) {
                AbstractStreamingNode.this.onStartStreaming(streamingContext);
            }

            @Override
            public void onStopStreaming() {
                AbstractStreamingNode.this.onStopStreaming();
            }
        }, this::getEventPublisher);
    }

    @Override
    public void startStreaming() {
        lifecycle.start();
    }

    @Override
    public void stopStreaming() {
        lifecycle.stop();
    }

    @Override
    public boolean isStreaming() {
        return lifecycle.isStreaming();
    }

    protected ProcessingContext getStreamingContext() {
        return lifecycle.getStreamingContext();
    }

    @Override
    public void shutdown() {
        stopStreaming();
        super.shutdown();
    }

    /**
     * Node-specific work when streaming starts. The context's cancellation token fires
     * when streaming stops.
     */
    protected void onStartStreaming(ProcessingContext streamingContext) {
    }

    protected void onStopStreaming() {
    }
}
