package com.phillippitts.voicegraph.service.node;

import com.phillippitts.voicegraph.domain.ProcessingContext;
import org.springframework.context.ApplicationEventPublisher;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unit of audio or text processing with a stable identity inside one pipeline.
 *
 * <p>A node declares its capabilities by implementing the trait interfaces
 * {@link AudioInputCapable}, {@link AudioOutputCapable} and {@link StreamingCapable};
 * {@link #capabilities()} exposes that declaration to the routing code.
 *
 * <p><b>Ownership:</b> a node belongs to at most one pipeline at a time. The pipeline calls
 * {@link #attach(String, ApplicationEventPublisher)} when the node is added and
 * {@link #detach()} when it is removed.
 *
 * @see AbstractNode
 */
public interface Node {

    String getId();

    String getName();

    void setName(String name);

    boolean isEnabled();

    void setEnabled(boolean enabled);

    /**
     * Free-form configuration. Values persisted with a pipeline definition.
     */
    Map<String, Object> getConfiguration();

    /**
     * Inbound connections in the order they were made.
     */
    List<NodeConnection> getInputConnections();

    /**
     * Outbound connections in the order they were made.
     */
    List<NodeConnection> getOutputConnections();

    void addInputConnection(NodeConnection connection);

    void removeInputConnection(NodeConnection connection);

    void addOutputConnection(NodeConnection connection);

    void removeOutputConnection(NodeConnection connection);

    /**
     * Typed status the node's own algorithms read back.
     */
    NodeStatus getStatus();

    /**
     * Opaque diagnostics for observability tooling; never read by routing logic.
     */
    Map<String, Object> getDiagnostics();

    void initialize();

    void shutdown();

    void reset();

    /**
     * Node-level self check used by connection validation.
     *
     * @return {@code true} if the node is usable
     */
    boolean validate();

    /**
     * Delivers a non-audio payload (for example transcript text). Only nodes that recognise
     * the payload type accept it.
     *
     * @return {@code true} if the payload was recognised and handled
     */
    default boolean acceptData(Object payload, ProcessingContext context) {
        return false;
    }

    Optional<String> getOwnerPipelineId();

    void attach(String pipelineId, ApplicationEventPublisher eventPublisher);

    void detach();

    /**
     * Capability set derived from the trait interfaces this node implements.
     */
    default Set<NodeCapability> capabilities() {
        Set<NodeCapability> capabilities = EnumSet.noneOf(NodeCapability.class);
        if (this instanceof AudioInputCapable) {
            capabilities.add(NodeCapability.AUDIO_INPUT);
        }
        if (this instanceof AudioOutputCapable) {
            capabilities.add(NodeCapability.AUDIO_OUTPUT);
        }
        if (this instanceof StreamingCapable) {
            capabilities.add(NodeCapability.STREAMING);
        }
        return capabilities;
    }

    default boolean hasCapability(NodeCapability capability) {
        return capabilities().contains(capability);
    }
}
