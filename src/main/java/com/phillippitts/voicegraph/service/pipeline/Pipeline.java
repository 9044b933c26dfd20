package com.phillippitts.voicegraph.service.pipeline;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.exception.GraphException;
import com.phillippitts.voicegraph.exception.NoEntryPointsException;
import com.phillippitts.voicegraph.exception.PipelineExecutionException;
import com.phillippitts.voicegraph.service.event.DataTransferredEvent;
import com.phillippitts.voicegraph.service.event.EventPublishing;
import com.phillippitts.voicegraph.service.event.PipelineExecutionCancelledEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionCompletedEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionFailedEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionStartedEvent;
import com.phillippitts.voicegraph.service.node.AudioInputCapable;
import com.phillippitts.voicegraph.service.node.AudioOutputCapable;
import com.phillippitts.voicegraph.service.node.Node;
import com.phillippitts.voicegraph.service.node.NodeCapability;
import com.phillippitts.voicegraph.service.node.NodeConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Directed graph of nodes and connections with a single-pass execution algorithm.
 *
 * <p><b>Graph:</b> node and connection ids are unique within the pipeline. Entry points
 * (audio-input nodes that accept external audio) and exit points (audio-output nodes) are
 * maintained as nodes are added and removed. Connections are validated by
 * {@link #initialize()}, not when they are made.
 *
 * <p><b>Execution:</b> {@link #execute(AudioBuffer, ProcessingContext)} feeds the input to
 * every enabled entry point, fewest inbound connections first, then collects the latest
 * output of every enabled exit point in registration order. Nodes route data between
 * themselves through their outbound connections.
 *
 * <p><b>Thread Safety:</b> graph edits are synchronized on an internal monitor. At most one
 * execution pass runs at a time; concurrent callers of {@code execute} block on a fair
 * {@link ReentrantLock} until the running pass finishes.
 *
 * <p><b>Notifications:</b> execution started/completed/cancelled/failed events are published
 * to the supplied {@link ApplicationEventPublisher}. Nodes and connections publish through
 * the pipeline, which records every {@link DataTransferredEvent} in its execution log.
 *
 * @since 1.0
 */
public class Pipeline {

    private static final Logger LOG = LogManager.getLogger(Pipeline.class);

    static final String MDC_PIPELINE_ID = "pipelineId";
    static final String MDC_EXECUTION_ID = "executionId";
    static final String MDC_SESSION_ID = "sessionId";

    private final String id;
    private volatile String name;
    private final ApplicationEventPublisher externalPublisher;
    private final ApplicationEventPublisher internalPublisher;

    private final Object graphLock = new Object();
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, NodeConnection> connections = new LinkedHashMap<>();
    private final List<AudioInputCapable> entryPoints = new ArrayList<>();
    private final List<AudioOutputCapable> exitPoints = new ArrayList<>();

    private final ReentrantLock executionGuard = new ReentrantLock(true);
    private volatile boolean running;
    private final List<DataTransferredEvent> executionLog = new CopyOnWriteArrayList<>();

    public Pipeline(String id, String name) {
        this(id, name, null);
    }

    /**
     * @param eventPublisher receives pipeline and node notifications; may be {@code null}
     */
    public Pipeline(String id, String name, ApplicationEventPublisher eventPublisher) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Pipeline id must not be blank");
        }
        this.id = id;
        this.name = name == null || name.isBlank() ? id : name;
        this.externalPublisher = eventPublisher;
        this.internalPublisher = event -> {
            if (event instanceof DataTransferredEvent transferred) {
                executionLog.add(transferred);
            }
            EventPublishing.publish(externalPublisher, event);
        };
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    // ---------------------------------------------------------------- graph

    /**
     * Registers a node and takes ownership of it.
     *
     * @throws GraphException if the id is already present or the node belongs to another pipeline
     */
    public void addNode(Node node) {
        Objects.requireNonNull(node, "node");
        synchronized (graphLock) {
            if (nodes.containsKey(node.getId())) {
                throw new GraphException(id, node.getId(), "Node with ID '" + node.getId() + "' already exists");
            }
            String owner = node.getOwnerPipelineId().orElse(null);
            if (owner != null && !owner.equals(id)) {
                throw new GraphException(id, node.getId(),
                        "Node '" + node.getId() + "' already belongs to pipeline '" + owner + "'");
            }
            node.attach(id, internalPublisher);
            nodes.put(node.getId(), node);
            if (node.hasCapability(NodeCapability.AUDIO_INPUT) && ((AudioInputCapable) node).isEntryPoint()) {
                entryPoints.add((AudioInputCapable) node);
            }
            if (node.hasCapability(NodeCapability.AUDIO_OUTPUT)) {
                exitPoints.add((AudioOutputCapable) node);
            }
        }
        LOG.debug("Pipeline '{}' added node '{}' with capabilities {}", id, node.getId(), node.capabilities());
    }

    /**
     * Removes a node and every connection touching it, releasing ownership.
     *
     * @throws GraphException if the id is unknown
     */
    public void removeNode(String nodeId) {
        Node node;
        synchronized (graphLock) {
            node = nodes.get(nodeId);
            if (node == null) {
                throw new GraphException(id, nodeId, "Node with ID '" + nodeId + "' not found");
            }
            List<NodeConnection> touching = new ArrayList<>(node.getInputConnections());
            touching.addAll(node.getOutputConnections());
            for (NodeConnection connection : touching) {
                unlink(connection);
            }
            nodes.remove(nodeId);
            entryPoints.remove(node);
            exitPoints.remove(node);
            node.detach();
        }
        LOG.debug("Pipeline '{}' removed node '{}'", id, nodeId);
    }

    public NodeConnection connect(String sourceId, String targetId) {
        return connect(sourceId, targetId, null);
    }

    /**
     * Connects two registered nodes by id.
     *
     * @param connectionId explicit id, or {@code null} to generate one
     * @throws GraphException if a node id is unknown or the connection id is taken
     */
    public NodeConnection connect(String sourceId, String targetId, String connectionId) {
        synchronized (graphLock) {
            return link(requireNode(sourceId), requireNode(targetId), connectionId);
        }
    }

    /**
     * Connects two nodes that are registered in this pipeline.
     *
     * @throws GraphException if either node is not registered here or the connection id is taken
     */
    public NodeConnection connect(Node source, Node target, String connectionId) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        synchronized (graphLock) {
            if (nodes.get(source.getId()) != source) {
                throw new GraphException(id, source.getId(), "Source node '" + source.getId() + "' is not in this pipeline");
            }
            if (nodes.get(target.getId()) != target) {
                throw new GraphException(id, target.getId(), "Target node '" + target.getId() + "' is not in this pipeline");
            }
            return link(source, target, connectionId);
        }
    }

    /**
     * @throws GraphException if the id is unknown
     */
    public void removeConnection(String connectionId) {
        synchronized (graphLock) {
            NodeConnection connection = connections.get(connectionId);
            if (connection == null) {
                throw new GraphException(id, connectionId, "Connection with ID '" + connectionId + "' not found");
            }
            unlink(connection);
        }
        LOG.debug("Pipeline '{}' removed connection '{}'", id, connectionId);
    }

    private Node requireNode(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new GraphException(id, nodeId, "Node with ID '" + nodeId + "' not found");
        }
        return node;
    }

    private NodeConnection link(Node source, Node target, String connectionId) {
        String connId = connectionId;
        if (connId == null) {
            do {
                connId = "conn_" + source.getId() + "_" + target.getId() + "_"
                        + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
            } while (connections.containsKey(connId));
        } else if (connections.containsKey(connId)) {
            throw new GraphException(id, connId, "Connection with ID '" + connId + "' already exists");
        }
        NodeConnection connection = new NodeConnection(connId, source, target);
        connection.setEventPublisher(internalPublisher);
        source.addOutputConnection(connection);
        target.addInputConnection(connection);
        connections.put(connId, connection);
        LOG.debug("Pipeline '{}' connected {}", id, connection);
        return connection;
    }

    private void unlink(NodeConnection connection) {
        connection.getSource().removeOutputConnection(connection);
        connection.getTarget().removeInputConnection(connection);
        connection.setEventPublisher(null);
        connections.remove(connection.getId());
    }

    public Map<String, Node> getNodes() {
        synchronized (graphLock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        }
    }

    public Node getNode(String nodeId) {
        synchronized (graphLock) {
            return nodes.get(nodeId);
        }
    }

    public Map<String, NodeConnection> getConnections() {
        synchronized (graphLock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(connections));
        }
    }

    public NodeConnection getConnection(String connectionId) {
        synchronized (graphLock) {
            return connections.get(connectionId);
        }
    }

    public List<AudioInputCapable> getEntryPoints() {
        synchronized (graphLock) {
            return List.copyOf(entryPoints);
        }
    }

    public List<AudioOutputCapable> getExitPoints() {
        synchronized (graphLock) {
            return List.copyOf(exitPoints);
        }
    }

    // ------------------------------------------------------------ lifecycle

    /**
     * Initializes every node, then validates every connection.
     *
     * @return {@code true} if every connection passed its node self checks
     * @throws com.phillippitts.voicegraph.exception.ConnectionIncompatibleException if a
     *         connection's formats or capabilities do not match
     */
    public boolean initialize() {
        List<Node> nodeSnapshot = new ArrayList<>(getNodes().values());
        List<NodeConnection> connectionSnapshot = new ArrayList<>(getConnections().values());
        for (Node node : nodeSnapshot) {
            node.initialize();
        }
        boolean allValid = true;
        for (NodeConnection connection : connectionSnapshot) {
            if (!connection.validate()) {
                allValid = false;
            }
        }
        LOG.info("Pipeline '{}' initialized: {} nodes, {} connections, valid={}",
                id, nodeSnapshot.size(), connectionSnapshot.size(), allValid);
        return allValid;
    }

    /**
     * Shuts down every node. A failing node is logged and the remaining nodes still shut down.
     */
    public void shutdown() {
        for (Node node : getNodes().values()) {
            try {
                node.shutdown();
            } catch (RuntimeException e) {
                LOG.warn("Pipeline '{}' failed to shut down node '{}': {}", id, node.getId(), e.getMessage());
            }
        }
        LOG.info("Pipeline '{}' shut down", id);
    }

    /**
     * Clears the execution log and resets every node. Waits for a running pass to finish.
     */
    public void reset() {
        executionGuard.lock();
        try {
            executionLog.clear();
            for (Node node : getNodes().values()) {
                node.reset();
            }
        } finally {
            executionGuard.unlock();
        }
        LOG.debug("Pipeline '{}' reset", id);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Data transfers recorded since the last {@link #reset()}.
     */
    public List<DataTransferredEvent> getExecutionLog() {
        return List.copyOf(executionLog);
    }

    // ------------------------------------------------------------ execution

    public List<AudioBuffer> execute(AudioBuffer input) {
        return execute(input, null);
    }

    /**
     * Runs one propagation pass.
     *
     * @param context pass context, or {@code null} to create one
     * @return latest output of each enabled exit point; empty if the pass was cancelled
     * @throws NoEntryPointsException if no enabled entry point exists
     * @throws PipelineExecutionException if a node failed during the pass
     */
    public List<AudioBuffer> execute(AudioBuffer input, ProcessingContext context) {
        Objects.requireNonNull(input, "input");
        ProcessingContext ctx = context != null ? context : new ProcessingContext();
        UUID executionId = UUID.randomUUID();

        executionGuard.lock();
        try {
            running = true;
            ThreadContext.put(MDC_PIPELINE_ID, id);
            ThreadContext.put(MDC_EXECUTION_ID, executionId.toString());
            ThreadContext.put(MDC_SESSION_ID, ctx.getSessionId().toString());

            Instant startedAt = Instant.now();
            EventPublishing.publish(externalPublisher,
                    new PipelineExecutionStartedEvent(id, executionId, ctx, startedAt));

            List<AudioInputCapable> ordered = orderedEntryPoints();
            if (ordered.isEmpty()) {
                throw new NoEntryPointsException(id);
            }

            for (AudioInputCapable entryPoint : ordered) {
                if (ctx.isCancellationRequested()) {
                    return cancelled(executionId, ctx);
                }
                entryPoint.acceptAudio(input, ctx);
            }

            List<AudioBuffer> results = new ArrayList<>();
            for (AudioOutputCapable exitPoint : getExitPoints()) {
                if (ctx.isCancellationRequested()) {
                    return cancelled(executionId, ctx);
                }
                if (!exitPoint.isEnabled()) {
                    continue;
                }
                AudioBuffer output = exitPoint.pullAudioOutput(ctx);
                if (output != null) {
                    results.add(output);
                }
            }
            if (ctx.isCancellationRequested()) {
                return cancelled(executionId, ctx);
            }

            EventPublishing.publish(externalPublisher, new PipelineExecutionCompletedEvent(
                    id, executionId, ctx, startedAt, Instant.now(), results));
            LOG.debug("Pipeline '{}' produced {} output buffer(s)", id, results.size());
            return results;
        } catch (PipelineExecutionException e) {
            failed(executionId, ctx, e);
            throw e;
        } catch (RuntimeException e) {
            failed(executionId, ctx, e);
            throw new PipelineExecutionException(id, "Pipeline execution failed: " + e.getMessage(), e);
        } finally {
            running = false;
            ctx.clearTransientData();
            ThreadContext.remove(MDC_PIPELINE_ID);
            ThreadContext.remove(MDC_EXECUTION_ID);
            ThreadContext.remove(MDC_SESSION_ID);
            executionGuard.unlock();
        }
    }

    /**
     * Runs one pass per input with a shared context.
     *
     * @return outputs of every pass in order; empty if cancelled
     */
    public List<AudioBuffer> executeMultiple(List<AudioBuffer> inputs, ProcessingContext context) {
        ProcessingContext ctx = context != null ? context : new ProcessingContext();
        List<AudioBuffer> results = new ArrayList<>();
        for (AudioBuffer input : inputs) {
            if (ctx.isCancellationRequested()) {
                return List.of();
            }
            results.addAll(execute(input, ctx));
        }
        return ctx.isCancellationRequested() ? List.of() : results;
    }

    private List<AudioInputCapable> orderedEntryPoints() {
        List<AudioInputCapable> ordered = new ArrayList<>();
        for (AudioInputCapable entryPoint : getEntryPoints()) {
            if (entryPoint.isEnabled()) {
                ordered.add(entryPoint);
            }
        }
        ordered.sort(Comparator.comparingInt(node -> node.getInputConnections().size()));
        return ordered;
    }

    private List<AudioBuffer> cancelled(UUID executionId, ProcessingContext ctx) {
        LOG.info("Pipeline '{}' execution cancelled", id);
        EventPublishing.publish(externalPublisher,
                new PipelineExecutionCancelledEvent(id, executionId, ctx, Instant.now()));
        return List.of();
    }

    private void failed(UUID executionId, ProcessingContext ctx, RuntimeException e) {
        LOG.error("Pipeline '{}' execution failed: {}", id, e.getMessage(), e);
        EventPublishing.publish(externalPublisher,
                new PipelineExecutionFailedEvent(id, executionId, ctx, e, Instant.now()));
    }

    @Override
    public String toString() {
        return "Pipeline[" + id + ", nodes=" + getNodes().size() + ", connections=" + getConnections().size() + "]";
    }
}
