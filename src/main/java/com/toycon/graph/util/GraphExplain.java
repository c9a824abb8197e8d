package com.toycon.graph.util;

import com.toycon.graph.api.Node;
import com.toycon.graph.core.InputPort;
import com.toycon.graph.core.OutputPort;
import com.toycon.graph.engine.Connection;
import com.toycon.graph.engine.Evaluator;
import com.toycon.graph.engine.Graph;

/**
 * Diagnostic utility for inspecting graph state and wiring.
 *
 * <p>
 * Produces human-readable dumps of the node list (in evaluation order) and a
 * Mermaid diagram of the connections. Edges that point backwards in the
 * evaluation order carry a one-tick delay and are drawn dotted.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and log output. Do <b>not</b>
 * use on the tick path.
 */
public final class GraphExplain {
    private final Graph graph;
    private final Evaluator evaluator;

    public GraphExplain(Evaluator evaluator) {
        this.graph = evaluator.graph();
        this.evaluator = evaluator;
    }

    public GraphExplain(Graph graph) {
        this.graph = graph;
        this.evaluator = null;
    }

    /**
     * Dumps detailed state of a single node.
     *
     * @throws IllegalArgumentException if there is no node with that id.
     */
    public String explainNode(int nodeId) {
        Node node = graph.require(nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.name()).append('#').append(node.id()).append('\n')
                .append("  Index: ").append(graph.indexOf(node)).append('\n')
                .append("  Kind: ").append(node.kind().typeName()).append('\n')
                .append("  Position: (").append(node.x()).append(", ").append(node.y()).append(")\n");
        if (!node.data().isEmpty())
            sb.append("  Data: ").append(node.data()).append('\n');
        for (InputPort in : node.inputs()) {
            sb.append("  in  ").append(in.name()).append(" = ").append(in.value());
            if (in.isConnected()) {
                sb.append(" <- ");
                for (int i = 0; i < in.sources().size(); i++) {
                    OutputPort src = in.sources().get(i);
                    if (i > 0)
                        sb.append(", ");
                    sb.append('#').append(src.ownerId()).append('.').append(src.name());
                }
            }
            sb.append('\n');
        }
        for (OutputPort out : node.outputs())
            sb.append("  out ").append(out.name()).append(" = ").append(out.value()).append('\n');
        return sb.toString();
    }

    /** Summary of the last tick pass. */
    public String explainLastTick() {
        if (evaluator == null)
            return "No evaluator";
        return "Epoch: " + evaluator.epoch() + ", Evaluated: " + evaluator.lastEvaluatedCount() + "/" + graph.size()
                + (evaluator.isHealthy() ? "" : " (UNHEALTHY)");
    }

    /** Dumps the node list with each node's downstream targets. */
    public String dumpGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.size()).append(" nodes):\n");
        var connections = graph.connections();
        for (int i = 0; i < graph.size(); i++) {
            Node node = graph.nodes().get(i);
            sb.append("  [").append(i).append("] ").append(node.name()).append('#').append(node.id());
            boolean first = true;
            for (Connection c : connections) {
                if (c.sourceId() != node.id())
                    continue;
                sb.append(first ? " -> " : ", ");
                first = false;
                Node target = graph.node(c.targetId());
                sb.append(target.name()).append('#').append(target.id())
                        .append('.').append(target.inputs().get(c.targetSlot()).name());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, nodes in evaluation order, each
     * edge labelled with the target input name.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        for (Node node : graph.nodes()) {
            String value = node.outputs().isEmpty() ? "" : String.format("%.4f", node.outputs().get(0).value());
            sb.append("  n").append(node.id()).append("[\"").append(sanitize(node.name()))
                    .append("<br/>").append(node.kind().typeName());
            if (!value.isEmpty())
                sb.append("<br/><b>").append(value).append("</b>");
            sb.append("\"];\n");
        }

        for (Connection c : graph.connections()) {
            Node source = graph.node(c.sourceId());
            Node target = graph.node(c.targetId());
            String label = target.inputs().get(c.targetSlot()).name();
            boolean delayed = graph.indexOf(source) >= graph.indexOf(target);
            sb.append("  n").append(c.sourceId())
                    .append(delayed ? " -. \"" : " -- \"").append(label)
                    .append(delayed ? "\" .-> n" : "\" --> n").append(c.targetId()).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[\"<>]", "_");
    }
}
