package com.phillippitts.voicegraph.service.registry;

import com.phillippitts.voicegraph.exception.GraphException;
import com.phillippitts.voicegraph.service.node.Node;
import com.phillippitts.voicegraph.service.node.NodeConnection;
import com.phillippitts.voicegraph.service.pipeline.Pipeline;
import com.phillippitts.voicegraph.service.pipeline.PipelineExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builds pipelines from {@link PipelineDefinition}s through the {@link NodeTypeRegistry}
 * and exports live pipelines back to definitions.
 *
 * <p>Every pipeline created here publishes to the application's event publisher, and
 * {@link #executorFor(Pipeline)} runs passes on the shared {@code pipelineExecutor} pool.
 *
 * @since 1.0
 */
@Service
public class PipelineFactory {

    private static final Logger LOG = LogManager.getLogger(PipelineFactory.class);

    private final NodeTypeRegistry registry;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor pipelineExecutor;

    public PipelineFactory(NodeTypeRegistry registry, ApplicationEventPublisher eventPublisher,
                           @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.eventPublisher = eventPublisher;
        this.pipelineExecutor = Objects.requireNonNull(pipelineExecutor, "pipelineExecutor");
    }

    public Pipeline create(String id, String name) {
        return new Pipeline(id, name, eventPublisher);
    }

    /**
     * Async runner for {@code pipeline} backed by the pipeline thread pool.
     */
    public PipelineExecutor executorFor(Pipeline pipeline) {
        return new PipelineExecutor(pipeline, pipelineExecutor);
    }

    /**
     * @throws GraphException on unknown node types, duplicate ids or dangling connection ids
     */
    public Pipeline fromDefinition(PipelineDefinition definition) {
        Pipeline pipeline = create(definition.id(), definition.name());

        for (PipelineDefinition.NodeDefinition nodeDef : definition.nodes()) {
            Node node;
            try {
                node = registry.createNode(nodeDef.type(), nodeDef.id(), nodeDef.name());
            } catch (IllegalArgumentException e) {
                throw new GraphException(definition.id(), nodeDef.id(), e.getMessage());
            }
            node.setEnabled(nodeDef.enabled());
            copyInto(nodeDef.configuration(), node.getConfiguration());
            pipeline.addNode(node);
        }

        for (PipelineDefinition.ConnectionDefinition connDef : definition.connections()) {
            NodeConnection connection = pipeline.connect(connDef.sourceId(), connDef.targetId(), connDef.id());
            if (connDef.label() != null) {
                connection.setLabel(connDef.label());
            }
            connection.setEnabled(connDef.enabled());
            connection.setPriority(connDef.priority());
            if (connDef.kind() != null) {
                connection.setKind(connDef.kind());
            }
            copyInto(connDef.configuration(), connection.getConfiguration());
        }

        LOG.info("Built pipeline '{}' with {} nodes and {} connections",
                definition.id(), definition.nodes().size(), definition.connections().size());
        return pipeline;
    }

    public Pipeline fromJson(String json) {
        return fromDefinition(PipelineDefinitionCodec.fromJson(json));
    }

    /**
     * @throws GraphException if a node's class has no registered type key
     */
    public PipelineDefinition toDefinition(Pipeline pipeline) {
        List<PipelineDefinition.NodeDefinition> nodes = new ArrayList<>();
        for (Node node : pipeline.getNodes().values()) {
            String type = registry.typeKeyOf(node).orElseThrow(() -> new GraphException(pipeline.getId(),
                    node.getId(), "No registered type for " + node.getClass().getSimpleName()));
            nodes.add(new PipelineDefinition.NodeDefinition(
                    node.getId(), node.getName(), type, node.isEnabled(), node.getConfiguration()));
        }
        List<PipelineDefinition.ConnectionDefinition> connections = new ArrayList<>();
        for (NodeConnection connection : pipeline.getConnections().values()) {
            connections.add(new PipelineDefinition.ConnectionDefinition(
                    connection.getId(),
                    connection.getSource().getId(),
                    connection.getTarget().getId(),
                    connection.getLabel(),
                    connection.isEnabled(),
                    connection.getPriority(),
                    connection.getKind(),
                    connection.getConfiguration()));
        }
        return new PipelineDefinition(pipeline.getId(), pipeline.getName(), nodes, connections);
    }

    public String toJson(Pipeline pipeline) {
        return PipelineDefinitionCodec.toJson(toDefinition(pipeline));
    }

    private static void copyInto(Map<String, Object> source, Map<String, Object> target) {
        source.forEach((key, value) -> {
            if (value != null) {
                target.put(key, value);
            }
        });
    }
}
