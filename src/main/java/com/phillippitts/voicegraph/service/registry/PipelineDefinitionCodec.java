package com.phillippitts.voicegraph.service.registry;

import com.phillippitts.voicegraph.service.node.NodeConnection;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of {@link PipelineDefinition} with org.json.
 *
 * <p>Decoded configuration values keep JSON's number types (integers, longs or
 * {@link java.math.BigDecimal}); nodes read numbers through {@link Number}.
 *
 * @since 1.0
 */
public final class PipelineDefinitionCodec {

    private static final int INDENT = 2;

    private PipelineDefinitionCodec() {
        // Utility class
    }

    public static String toJson(PipelineDefinition definition) {
        JSONObject root = new JSONObject();
        root.put("id", definition.id());
        root.put("name", definition.name());

        JSONArray nodes = new JSONArray();
        for (PipelineDefinition.NodeDefinition node : definition.nodes()) {
            nodes.put(new JSONObject()
                    .put("id", node.id())
                    .put("name", node.name())
                    .put("type", node.type())
                    .put("enabled", node.enabled())
                    .put("configuration", new JSONObject(node.configuration())));
        }
        root.put("nodes", nodes);

        JSONArray connections = new JSONArray();
        for (PipelineDefinition.ConnectionDefinition connection : definition.connections()) {
            connections.put(new JSONObject()
                    .put("id", connection.id())
                    .put("sourceId", connection.sourceId())
                    .put("targetId", connection.targetId())
                    .put("label", connection.label())
                    .put("enabled", connection.enabled())
                    .put("priority", connection.priority())
                    .put("kind", connection.kind())
                    .put("configuration", new JSONObject(connection.configuration())));
        }
        root.put("connections", connections);
        return root.toString(INDENT);
    }

    /**
     * @throws IllegalArgumentException if the document is not valid JSON or misses a required field
     */
    public static PipelineDefinition fromJson(String json) {
        try {
            JSONObject root = new JSONObject(json);
            String id = root.getString("id");
            String name = root.optString("name", id);

            List<PipelineDefinition.NodeDefinition> nodes = new ArrayList<>();
            JSONArray nodeArray = root.optJSONArray("nodes");
            if (nodeArray != null) {
                for (int i = 0; i < nodeArray.length(); i++) {
                    JSONObject node = nodeArray.getJSONObject(i);
                    String nodeId = node.getString("id");
                    nodes.add(new PipelineDefinition.NodeDefinition(
                            nodeId,
                            node.optString("name", nodeId),
                            node.getString("type"),
                            node.optBoolean("enabled", true),
                            configurationOf(node)));
                }
            }

            List<PipelineDefinition.ConnectionDefinition> connections = new ArrayList<>();
            JSONArray connectionArray = root.optJSONArray("connections");
            if (connectionArray != null) {
                for (int i = 0; i < connectionArray.length(); i++) {
                    JSONObject connection = connectionArray.getJSONObject(i);
                    connections.add(new PipelineDefinition.ConnectionDefinition(
                            connection.optString("id", null),
                            connection.getString("sourceId"),
                            connection.getString("targetId"),
                            connection.optString("label", null),
                            connection.optBoolean("enabled", true),
                            connection.optInt("priority", 0),
                            connection.optString("kind", NodeConnection.KIND_AUDIO),
                            configurationOf(connection)));
                }
            }
            return new PipelineDefinition(id, name, nodes, connections);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid pipeline definition: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> configurationOf(JSONObject element) {
        JSONObject configuration = element.optJSONObject("configuration");
        return configuration == null ? Map.of() : configuration.toMap();
    }
}
