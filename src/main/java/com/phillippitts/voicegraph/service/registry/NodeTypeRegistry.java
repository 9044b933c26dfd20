package com.phillippitts.voicegraph.service.registry;

import com.phillippitts.voicegraph.service.node.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit map from node type key to {@link NodeFactory}, populated at start-up.
 *
 * <p>Each key is bound to the concrete node class it produces so that a live node can be
 * mapped back to its key when a pipeline is exported.
 *
 * <p><b>Thread Safety:</b> all methods are synchronized; registration normally happens once
 * during context start-up.
 *
 * @since 1.0
 */
public class NodeTypeRegistry {

    private static final Logger LOG = LogManager.getLogger(NodeTypeRegistry.class);

    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if the key is already registered
     */
    public synchronized void register(String typeKey, Class<? extends Node> nodeType, NodeFactory factory) {
        Objects.requireNonNull(typeKey, "typeKey");
        Objects.requireNonNull(nodeType, "nodeType");
        Objects.requireNonNull(factory, "factory");
        if (registrations.containsKey(typeKey)) {
            throw new IllegalArgumentException("Node type '" + typeKey + "' is already registered");
        }
        registrations.put(typeKey, new Registration(nodeType, factory));
        LOG.debug("Registered node type '{}' -> {}", typeKey, nodeType.getSimpleName());
    }

    public synchronized boolean isRegistered(String typeKey) {
        return registrations.containsKey(typeKey);
    }

    public synchronized Set<String> getTypeKeys() {
        return Set.copyOf(registrations.keySet());
    }

    /**
     * @throws IllegalArgumentException if the key is unknown
     */
    public Node createNode(String typeKey, String id, String name) {
        Registration registration;
        synchronized (this) {
            registration = registrations.get(typeKey);
        }
        if (registration == null) {
            throw new IllegalArgumentException("Unknown node type: " + typeKey);
        }
        return registration.factory().create(id, name);
    }

    /**
     * Finds the key whose registered class is exactly the node's class.
     */
    public synchronized Optional<String> typeKeyOf(Node node) {
        for (Map.Entry<String, Registration> entry : registrations.entrySet()) {
            if (entry.getValue().nodeType().equals(node.getClass())) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    private record Registration(Class<? extends Node> nodeType, NodeFactory factory) {
    }
}
