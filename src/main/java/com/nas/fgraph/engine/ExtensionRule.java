package com.nas.fgraph.engine;

import com.nas.fgraph.calc.FeaturesCalculator;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;

import java.util.Optional;

/**
 * Caller-supplied calculator construction, tried before the built-in rules
 * of {@link FeaturesCalculatorPass}. Search methods use it to attach the
 * calculator of a layer they are about to make prunable.
 *
 * When a rule is invoked, every predecessor of the node already carries its
 * calculator, and {@code graph.modules()} resolves module targets to layer
 * types.
 */
@FunctionalInterface
public interface ExtensionRule {

    /**
     * @return the node's calculator, or empty for "no opinion".
     */
    Optional<FeaturesCalculator> apply(GraphNode node, ModelGraph graph);
}
