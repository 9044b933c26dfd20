package com.phillippitts.voicegraph.service.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted shape of a pipeline: {@code {id, name, nodes[], connections[]}}.
 *
 * @since 1.0
 */
public record PipelineDefinition(
        String id,
        String name,
        List<NodeDefinition> nodes,
        List<ConnectionDefinition> connections
) {
    public PipelineDefinition {
        Objects.requireNonNull(id, "id");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    /**
     * One node: {@code {id, name, type, enabled, configuration}}.
     */
    public record NodeDefinition(
            String id,
            String name,
            String type,
            boolean enabled,
            Map<String, Object> configuration
    ) {
        public NodeDefinition {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(type, "type");
            configuration = configuration == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
        }
    }

    /**
     * One connection: {@code {id, sourceId, targetId, label, enabled, priority, kind, configuration}}.
     */
    public record ConnectionDefinition(
            String id,
            String sourceId,
            String targetId,
            String label,
            boolean enabled,
            int priority,
            String kind,
            Map<String, Object> configuration
    ) {
        public ConnectionDefinition {
            Objects.requireNonNull(sourceId, "sourceId");
            Objects.requireNonNull(targetId, "targetId");
            configuration = configuration == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
        }
    }
}
