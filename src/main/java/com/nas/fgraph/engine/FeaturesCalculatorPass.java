package com.nas.fgraph.engine;

import com.nas.fgraph.api.UnsupportedNodeException;
import com.nas.fgraph.calc.*;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.NodeFlags;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Second pass: attaches a {@link FeaturesCalculator} to every node.
 *
 * Algorithm:
 * A FIFO queue is seeded with the input nodes. When a popped node still has
 * a predecessor without a calculator it goes back to the tail of the queue;
 * otherwise its calculator is built and its successors are enqueued. On an
 * acyclic graph every deferred node eventually unblocks, so this evaluates
 * the graph in topological order without computing the order up front.
 *
 * Construction precedence (first match wins):
 * 1. Extension rules, in registration order.
 * 2. Flatten -- multiplies the upstream count when it merges into channels.
 * 3. Squeeze -- same, for the squeezed channel dimension.
 * 4. Concatenate -- sum of the predecessors' calculators, in input order.
 * 5. Shared-input -- the first predecessor's calculator.
 * 6. Features-defining -- constant from the node's own output shape.
 * 7. Features-propagating -- passthrough of the single predecessor.
 *
 * Requires the annotation pass to have run. Discards previous calculators
 * and back-references before the walk.
 */
@Log4j2
public final class FeaturesCalculatorPass {
    private final List<ExtensionRule> rules;

    public FeaturesCalculatorPass() {
        this(List.of());
    }

    public FeaturesCalculatorPass(List<ExtensionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * @return the number of times a node was deferred because a predecessor
     *         was not ready.
     */
    public int run(ModelGraph graph) {
        for (GraphNode n : graph.nodes()) {
            n.setFeaturesCalculator(null);
            n.setInputFeaturesSetBy(null);
        }

        Deque<GraphNode> queue = new ArrayDeque<>(graph.inputNodes());
        int deferred = 0;

        while (!queue.isEmpty()) {
            GraphNode n = queue.poll();
            if (n.hasFeaturesCalculator())
                continue;

            if (!predecessorsReady(n, graph)) {
                queue.add(n);
                deferred++;
                continue;
            }

            FeaturesCalculator fc = build(n, graph);
            n.setFeaturesCalculator(fc);
            log.debug("Calculator of {}: {} ({} features)", n.name(), fc.getClass().getSimpleName(), fc.features());

            queue.addAll(graph.successors(n));
        }
        return deferred;
    }

    private static boolean predecessorsReady(GraphNode n, ModelGraph graph) {
        for (GraphNode p : graph.predecessors(n)) {
            if (!p.hasFeaturesCalculator())
                return false;
        }
        return true;
    }

    private FeaturesCalculator build(GraphNode n, ModelGraph graph) {
        for (ExtensionRule rule : rules) {
            Optional<FeaturesCalculator> fc = rule.apply(n, graph);
            if (fc.isPresent())
                return fc.get();
        }

        NodeFlags flags = n.requireFlags();
        List<GraphNode> preds = graph.predecessors(n);

        if (flags.flatten() || flags.squeeze()) {
            FeaturesCalculator upstream = preds.get(0).requireFeaturesCalculator();
            Reshapes.Effect effect = flags.flatten()
                    ? Reshapes.flatten(n, preds.get(0).requireShape())
                    : Reshapes.squeeze(n, preds.get(0).requireShape());
            return effect.altersChannels()
                    ? new FlattenFeaturesCalculator(upstream, effect.multiplier())
                    : new PassthroughFeaturesCalculator(upstream);
        }
        if (flags.featuresConcatenate()) {
            List<FeaturesCalculator> inputs = new ArrayList<>(preds.size());
            for (GraphNode p : preds)
                inputs.add(p.requireFeaturesCalculator());
            return new ConcatFeaturesCalculator(inputs);
        }
        if (flags.sharedInputFeatures()) {
            // Equal channel counts across inputs are the caller's invariant
            return preds.get(0).requireFeaturesCalculator();
        }
        if (flags.featuresDefining())
            return new ConstFeaturesCalculator(n.requireShape().channels());
        if (flags.featuresPropagating())
            return new PassthroughFeaturesCalculator(preds.get(0).requireFeaturesCalculator());

        throw new UnsupportedNodeException(n.name(), n.op(), n.target());
    }
}
