package com.phillippitts.voicegraph.service.node.streaming;

import com.phillippitts.voicegraph.domain.CancellationSource;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.event.EventPublishing;
import com.phillippitts.voicegraph.service.event.StreamingStartedEvent;
import com.phillippitts.voicegraph.service.event.StreamingStoppedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Idle/streaming state machine that any node can own.
 *
 * <p>States: {@code IDLE -> STREAMING -> IDLE}. Each start allocates a fresh cancellation
 * scope and a streaming {@link ProcessingContext} bound to it; stop cancels and closes that
 * scope. Both transitions are idempotent, so shutdown paths may stop unconditionally.
 *
 * <p><b>Thread Safety:</b> transitions are serialized by a {@link ReentrantLock}. Hooks run
 * while the lock is held; a hook that calls back into {@link #stop()} sees the already
 * updated state.
 *
 * <p>If {@link Hooks#onStartStreaming(ProcessingContext)} throws, the scope is cancelled,
 * the node returns to idle, no started notification is raised and the exception propagates.
 *
 * @since 1.0
 */
public final class StreamingLifecycle {

    private static final Logger LOG = LogManager.getLogger(StreamingLifecycle.class);

    /**
     * Node-specific work performed on each transition.
     */
    public interface Hooks {

        /**
         * Called after the node entered the streaming state.
         *
         * @param streamingContext context bound to the new cancellation scope
         */
        void onStartStreaming(ProcessingContext streamingContext);

        /**
         * Called after the scope was cancelled and the node left the streaming state.
         */
        void onStopStreaming();
    }

    private final String nodeId;
    private final Hooks hooks;
    private final Supplier<ApplicationEventPublisher> publisherSupplier;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile boolean streaming;
    private CancellationSource scope;
    private volatile ProcessingContext streamingContext;

    public StreamingLifecycle(String nodeId, Hooks hooks, Supplier<ApplicationEventPublisher> publisherSupplier) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.publisherSupplier = publisherSupplier == null ? () -> null : publisherSupplier;
    }

    /**
     * Enters the streaming state.
     *
     * @return {@code true} if a transition happened, {@code false} if already streaming
     */
    public boolean start() {
        lock.lock();
        try {
            if (streaming) {
                return false;
            }
            CancellationSource source = new CancellationSource();
            ProcessingContext context = new ProcessingContext(null, source.token());
            scope = source;
            streamingContext = context;
            streaming = true;
            try {
                hooks.onStartStreaming(context);
            } catch (RuntimeException e) {
                source.cancel();
                source.close();
                scope = null;
                streamingContext = null;
                streaming = false;
                LOG.warn("Node '{}' failed to start streaming: {}", nodeId, e.getMessage());
                throw e;
            }
            EventPublishing.publish(publisherSupplier.get(), new StreamingStartedEvent(nodeId, context, Instant.now()));
            LOG.info("Node '{}' started streaming", nodeId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Leaves the streaming state.
     *
     * @return {@code true} if a transition happened, {@code false} if already idle
     */
    public boolean stop() {
        lock.lock();
        try {
            if (!streaming) {
                return false;
            }
            CancellationSource source = scope;
            source.cancel();
            streaming = false;
            try {
                hooks.onStopStreaming();
            } finally {
                source.close();
                scope = null;
                streamingContext = null;
                EventPublishing.publish(publisherSupplier.get(), new StreamingStoppedEvent(nodeId, Instant.now()));
                LOG.info("Node '{}' stopped streaming", nodeId);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isStreaming() {
        return streaming;
    }

    /**
     * Context of the current streaming session, or {@code null} when idle.
     */
    public ProcessingContext getStreamingContext() {
        return streamingContext;
    }
}
