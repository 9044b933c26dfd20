package com.phillippitts.voicegraph.service.node;

import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.event.EventPublishing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Base class for nodes providing identity, configuration, connection bookkeeping, lifecycle
 * and downstream propagation.
 *
 * <p>This class implements the Template Method pattern: {@link #initialize()},
 * {@link #shutdown()} and {@link #reset()} handle state bookkeeping and delegate the
 * node-specific work to {@link #doInitialize()}, {@link #doShutdown()} and
 * {@link #doReset()}.
 *
 * <p><b>Thread Safety:</b> Lifecycle transitions are synchronized on {@link #lock}.
 * Connection lists are copy-on-write, so propagation iterates a stable snapshot even if the
 * graph is edited concurrently.
 *
 * <p><b>Idempotency:</b> {@link #initialize()} and {@link #shutdown()} are idempotent.
 *
 * @since 1.0
 */
public abstract class AbstractNode implements Node {

    private static final Logger LOG = LogManager.getLogger(AbstractNode.class);

    private static final Comparator<NodeConnection> BY_PRIORITY =
            Comparator.comparingInt(NodeConnection::getPriority);

    /**
     * Lock for synchronizing lifecycle transitions.
     */
    protected final Object lock = new Object();

    private final String id;
    private volatile String name;
    private volatile boolean enabled = true;
    private final Map<String, Object> configuration = new ConcurrentHashMap<>();
    private final List<NodeConnection> inputConnections = new CopyOnWriteArrayList<>();
    private final List<NodeConnection> outputConnections = new CopyOnWriteArrayList<>();
    private final NodeStatus status = new NodeStatus();
    private final Map<String, Object> diagnostics = new ConcurrentHashMap<>();

    private volatile String ownerPipelineId;
    private volatile ApplicationEventPublisher eventPublisher;

    protected AbstractNode(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        this.id = id;
        this.name = name == null || name.isBlank() ? id : name;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    /**
     * Stores a configuration value; {@code null} removes the key.
     */
    public void setConfigurationValue(String key, Object value) {
        if (value == null) {
            configuration.remove(key);
        } else {
            configuration.put(key, value);
        }
    }

    public <T> T getConfigurationValue(String key, Class<T> type, T defaultValue) {
        Object value = configuration.get(key);
        return type.isInstance(value) ? type.cast(value) : defaultValue;
    }

    /**
     * Reads a numeric configuration value regardless of its boxed type. Definitions decoded
     * from JSON may carry integers, longs or decimals for the same key.
     */
    protected double getConfigurationNumber(String key, double defaultValue) {
        Object value = configuration.get(key);
        return value instanceof Number number ? number.doubleValue() : defaultValue;
    }

    protected boolean getConfigurationFlag(String key, boolean defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text);
        }
        return defaultValue;
    }

    @Override
    public List<NodeConnection> getInputConnections() {
        return Collections.unmodifiableList(inputConnections);
    }

    @Override
    public List<NodeConnection> getOutputConnections() {
        return Collections.unmodifiableList(outputConnections);
    }

    @Override
    public void addInputConnection(NodeConnection connection) {
        inputConnections.add(Objects.requireNonNull(connection, "connection"));
    }

    @Override
    public void removeInputConnection(NodeConnection connection) {
        inputConnections.remove(connection);
    }

    @Override
    public void addOutputConnection(NodeConnection connection) {
        outputConnections.add(Objects.requireNonNull(connection, "connection"));
    }

    @Override
    public void removeOutputConnection(NodeConnection connection) {
        outputConnections.remove(connection);
    }

    @Override
    public NodeStatus getStatus() {
        return status;
    }

    @Override
    public Map<String, Object> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public Optional<String> getOwnerPipelineId() {
        return Optional.ofNullable(ownerPipelineId);
    }

    @Override
    public void attach(String pipelineId, ApplicationEventPublisher eventPublisher) {
        this.ownerPipelineId = Objects.requireNonNull(pipelineId, "pipelineId");
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void detach() {
        this.ownerPipelineId = null;
        this.eventPublisher = null;
    }

    /**
     * Initializes the node. Idempotent.
     */
    @Override
    public void initialize() {
        synchronized (lock) {
            if (status.isInitialized()) {
                return;
            }
            doInitialize();
            status.setInitialized(true);
            diagnostics.put("initializedAt", Instant.now());
            LOG.debug("Node '{}' initialized", id);
        }
    }

    /**
     * Releases node resources. Idempotent; a node that was never initialized is left alone.
     */
    @Override
    public void shutdown() {
        synchronized (lock) {
            if (!status.isInitialized()) {
                return;
            }
            doShutdown();
            status.setInitialized(false);
            diagnostics.put("shutdownAt", Instant.now());
            LOG.debug("Node '{}' shut down", id);
        }
    }

    /**
     * Clears processing counters and node-specific buffered state. Configuration is kept.
     */
    @Override
    public void reset() {
        synchronized (lock) {
            status.resetCounters();
            doReset();
        }
    }

    @Override
    public boolean validate() {
        return true;
    }

    public boolean isInitialized() {
        return status.isInitialized();
    }

    /**
     * Node-specific initialization, called once under {@link #lock}.
     */
    protected void doInitialize() {
    }

    /**
     * Node-specific cleanup, called once under {@link #lock}. Should not throw.
     */
    protected void doShutdown() {
    }

    /**
     * Node-specific reset of buffered state, called under {@link #lock}.
     */
    protected void doReset() {
    }

    /**
     * Publishes a notification through the owning pipeline's publisher, if attached.
     */
    protected void publish(Object event) {
        EventPublishing.publish(eventPublisher, event);
    }

    protected ApplicationEventPublisher getEventPublisher() {
        return eventPublisher;
    }

    protected void trackProcessing(Duration elapsed) {
        status.recordProcessing(elapsed);
    }

    /**
     * Offers {@code data} to every enabled outbound connection.
     *
     * @return {@code true} if at least one connection accepted the payload
     */
    protected boolean propagateToOutputs(Object data, ProcessingContext context) {
        return propagateToOutputs(data, context, connection -> true);
    }

    /**
     * Offers {@code data} to the enabled outbound connections matching {@code filter}, in
     * ascending priority order (ties keep connection order).
     *
     * @return {@code true} if at least one connection accepted the payload
     */
    protected boolean propagateToOutputs(Object data, ProcessingContext context,
                                         Predicate<NodeConnection> filter) {
        if (!enabled || data == null) {
            return false;
        }
        if (context != null && context.isCancellationRequested()) {
            return false;
        }
        List<NodeConnection> ordered = new ArrayList<>(outputConnections);
        ordered.sort(BY_PRIORITY);
        boolean delivered = false;
        for (NodeConnection connection : ordered) {
            if (!connection.isEnabled() || !filter.test(connection)) {
                continue;
            }
            if (connection.transferData(data, context)) {
                delivered = true;
            }
        }
        return delivered;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
