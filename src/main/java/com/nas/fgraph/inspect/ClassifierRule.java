package com.nas.fgraph.inspect;

import com.nas.fgraph.api.NodeCategory;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;

import java.util.Optional;

/**
 * Caller-supplied classification, consulted before the allow-list table.
 * Rules must be pure: the annotation pass may call them several times for
 * the same node.
 */
@FunctionalInterface
public interface ClassifierRule {

    /**
     * @return the node's category, or empty for "no opinion".
     */
    Optional<NodeCategory> classify(GraphNode node, ModelGraph graph);
}
