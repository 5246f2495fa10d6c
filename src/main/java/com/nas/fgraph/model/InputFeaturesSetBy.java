package com.nas.fgraph.model;

import java.util.List;

/**
 * Back-reference from a node to whoever sets its number of input channels:
 * a single node, or the ordered inputs of a concatenation.
 */
public final class InputFeaturesSetBy {
    private final List<GraphNode> nodes;
    private final boolean concatenation;

    private InputFeaturesSetBy(List<GraphNode> nodes, boolean concatenation) {
        this.nodes = nodes;
        this.concatenation = concatenation;
    }

    public static InputFeaturesSetBy single(GraphNode node) {
        if (node == null)
            throw new IllegalArgumentException("Back-reference target must not be null");
        return new InputFeaturesSetBy(List.of(node), false);
    }

    public static InputFeaturesSetBy concatenation(List<GraphNode> inputs) {
        if (inputs == null || inputs.isEmpty())
            throw new IllegalArgumentException("Concatenation back-reference needs at least one node");
        return new InputFeaturesSetBy(List.copyOf(inputs), true);
    }

    /** True when this reference lists the inputs of a concatenation node. */
    public boolean isConcatenation() {
        return concatenation;
    }

    /**
     * The single setter node.
     *
     * @throws IllegalStateException for a concatenation reference.
     */
    public GraphNode node() {
        if (concatenation)
            throw new IllegalStateException("Concatenation back-reference has " + nodes.size() + " nodes");
        return nodes.get(0);
    }

    /** All setter nodes, in input order. A single reference yields a one-element list. */
    public List<GraphNode> nodes() {
        return nodes;
    }

    @Override
    public String toString() {
        if (!concatenation)
            return nodes.get(0).name();
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < nodes.size(); i++) {
            sb.append(nodes.get(i).name());
            if (i < nodes.size() - 1)
                sb.append(", ");
        }
        return sb.append(']').toString();
    }
}
