package com.phillippitts.voicegraph.service.pipeline;

import com.phillippitts.voicegraph.service.node.AudioInputCapable;
import com.phillippitts.voicegraph.service.node.AudioOutputCapable;
import com.phillippitts.voicegraph.service.node.Node;
import com.phillippitts.voicegraph.service.node.NodeConnection;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Read-only graph queries and export over a {@link Pipeline}.
 *
 * @since 1.0
 */
public final class PipelineGraphs {

    private PipelineGraphs() {
        // Utility class
    }

    /**
     * Checks whether some enabled entry point reaches some enabled exit point over enabled
     * connections and nodes (breadth-first search).
     */
    public static boolean hasValidPath(Pipeline pipeline) {
        Set<String> exits = new HashSet<>();
        for (AudioOutputCapable exit : pipeline.getExitPoints()) {
            if (exit.isEnabled()) {
                exits.add(exit.getId());
            }
        }
        if (exits.isEmpty()) {
            return false;
        }

        Deque<Node> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        for (AudioInputCapable entry : pipeline.getEntryPoints()) {
            if (entry.isEnabled() && visited.add(entry.getId())) {
                queue.add(entry);
            }
        }
        while (!queue.isEmpty()) {
            Node node = queue.poll();
            if (exits.contains(node.getId())) {
                return true;
            }
            for (NodeConnection connection : node.getOutputConnections()) {
                Node target = connection.getTarget();
                if (connection.isEnabled() && target.isEnabled() && visited.add(target.getId())) {
                    queue.add(target);
                }
            }
        }
        return false;
    }

    /**
     * Renders the pipeline as a Graphviz DOT digraph. Disabled nodes and connections are
     * drawn dashed.
     */
    public static String toDot(Pipeline pipeline) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(pipeline.getName())).append("\" {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  node [shape=box];\n");
        for (Node node : pipeline.getNodes().values()) {
            sb.append("  \"").append(escape(node.getId())).append("\" [label=\"")
                    .append(escape(node.getName())).append("\\n(").append(node.getClass().getSimpleName()).append(")\"");
            if (!node.isEnabled()) {
                sb.append(", style=dashed");
            }
            sb.append("];\n");
        }
        for (NodeConnection connection : pipeline.getConnections().values()) {
            sb.append("  \"").append(escape(connection.getSource().getId())).append("\" -> \"")
                    .append(escape(connection.getTarget().getId())).append("\" [label=\"")
                    .append(escape(connection.getLabel())).append("\"");
            if (!connection.isEnabled()) {
                sb.append(", style=dashed");
            }
            sb.append("];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
