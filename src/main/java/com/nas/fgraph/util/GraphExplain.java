package com.nas.fgraph.util;

import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.NodeFlags;

import java.util.List;

/**
 * Diagnostic utility for inspecting an annotated graph.
 *
 * <p>
 * Generates human-readable views of the flags, calculator values and
 * back-references attached to each node. Stages that have not run are shown
 * as {@code -}.
 *
 * <p>
 * <b>Usage:</b> intended for debugging sessions and error logs.
 */
public final class GraphExplain {
    private final ModelGraph graph;

    public GraphExplain(ModelGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps the annotations of a single node.
     */
    public String explainNode(String nodeName) {
        GraphNode node = graph.node(nodeName);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Op: ").append(node.op().traceName()).append('\n')
                .append("  Target: ").append(node.target()).append('\n')
                .append("  Shape: ").append(node.shape().map(Object::toString).orElse("-")).append('\n')
                .append("  Category: ").append(node.flags().map(NodeFlags::category).map(Enum::name).orElse("-"))
                .append('\n')
                .append("  Untouchable: ").append(node.flags().map(NodeFlags::untouchable).map(Object::toString)
                        .orElse("-"))
                .append('\n')
                .append("  Features: ").append(features(node)).append('\n')
                .append("  Input features set by: ")
                .append(node.inputFeaturesSetBy().map(Object::toString).orElse("-")).append('\n');
        appendNames(sb.append("  Predecessors: "), graph.predecessors(node));
        appendNames(sb.append("  Successors: "), graph.successors(node));
        return sb.toString();
    }

    /**
     * One line per node, in declaration order.
     */
    public String dumpAnnotations() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph ").append(graph.name()).append(" (").append(graph.nodeCount()).append(" nodes):\n");
        for (GraphNode node : graph.nodes()) {
            sb.append("  ").append(node.name())
                    .append(" [").append(node.flags().map(NodeFlags::category).map(Enum::name).orElse("-"))
                    .append("] features=").append(features(node))
                    .append(" setBy=").append(node.inputFeaturesSetBy().map(Object::toString).orElse("-"))
                    .append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram, one box per node labelled with its
     * category and channel count.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in declaration order
        for (GraphNode node : graph.nodes()) {
            String category = node.flags().map(NodeFlags::category).map(Enum::name).orElse("UNANNOTATED");
            sb.append("  ").append(sanitize(node.name()))
                    .append("[\"").append(node.name())
                    .append("<br/>").append(category)
                    .append("<br/><b>").append(features(node)).append("</b>\"];\n");
        }

        // 2. Declare all edges afterwards
        for (GraphNode node : graph.nodes()) {
            for (GraphNode child : graph.successors(node)) {
                sb.append("  ").append(sanitize(node.name())).append(" --> ").append(sanitize(child.name()))
                        .append(";\n");
            }
        }
        return sb.toString();
    }

    private static String features(GraphNode node) {
        return node.featuresCalculator().map(fc -> String.valueOf(fc.features())).orElse("-");
    }

    private static void appendNames(StringBuilder sb, List<GraphNode> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            sb.append(nodes.get(i).name());
            if (i < nodes.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
