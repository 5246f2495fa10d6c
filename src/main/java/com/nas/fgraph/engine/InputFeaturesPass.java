package com.nas.fgraph.engine;

import com.nas.fgraph.api.UnsupportedNodeException;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.InputFeaturesSetBy;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.NodeFlags;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Third pass: records, for every node, which upstream node sets its number of
 * input channels.
 *
 * Rules, by the category of the node's first predecessor {@code prev}:
 * - flatten/squeeze: {@code prev} itself if it merged dimensions into the
 * channels, otherwise {@code prev}'s own back-reference;
 * - features-defining or concatenate: {@code prev};
 * - features-propagating or shared-input: {@code prev}'s back-reference.
 *
 * Input nodes point at themselves. A concatenation node records the ordered
 * list of its predecessors.
 *
 * Unlike {@link FeaturesCalculatorPass}, a node whose inputs are not resolved
 * yet is not re-enqueued: it is skipped silently and picked up again when a
 * later predecessor completes and enqueues its successors.
 */
@Log4j2
public final class InputFeaturesPass {

    /**
     * @return the number of silent skips.
     */
    public int run(ModelGraph graph) {
        for (GraphNode n : graph.nodes())
            n.setInputFeaturesSetBy(null);

        Deque<GraphNode> queue = new ArrayDeque<>(graph.inputNodes());
        int skipped = 0;

        while (!queue.isEmpty()) {
            GraphNode n = queue.poll();
            if (n.hasInputFeaturesSetBy())
                continue;

            InputFeaturesSetBy ref = resolve(n, graph);
            if (ref == null) {
                skipped++;
            } else {
                n.setInputFeaturesSetBy(ref);
                log.debug("Input features of {} set by {}", n.name(), ref);
            }
            queue.addAll(graph.successors(n));
        }
        return skipped;
    }

    /**
     * Expands a back-reference that points at a concatenation node into the
     * nodes feeding that concatenation, in input order.
     */
    public static List<GraphNode> producersOf(GraphNode n) {
        InputFeaturesSetBy ref = n.requireInputFeaturesSetBy();
        if (ref.isConcatenation())
            return ref.nodes();
        GraphNode setter = ref.node();
        if (setter != n && setter.requireFlags().featuresConcatenate())
            return setter.requireInputFeaturesSetBy().nodes();
        return List.of(setter);
    }

    // Returns null when the node's inputs are not resolved yet
    private static InputFeaturesSetBy resolve(GraphNode n, ModelGraph graph) {
        List<GraphNode> preds = graph.predecessors(n);
        if (preds.isEmpty())
            return InputFeaturesSetBy.single(n);

        if (n.requireFlags().featuresConcatenate()) {
            for (GraphNode p : preds) {
                if (!p.hasInputFeaturesSetBy())
                    return null;
            }
            return InputFeaturesSetBy.concatenation(preds);
        }

        GraphNode prev = preds.get(0);
        if (!prev.hasInputFeaturesSetBy())
            return null;

        NodeFlags pf = prev.requireFlags();
        switch (pf.category()) {
            case FLATTEN:
            case SQUEEZE:
                return Reshapes.of(prev, graph).altersChannels()
                        ? InputFeaturesSetBy.single(prev)
                        : prev.requireInputFeaturesSetBy();
            case FEATURES_CONCATENATE:
            case FEATURES_DEFINING:
                return InputFeaturesSetBy.single(prev);
            case FEATURES_PROPAGATING:
            case SHARED_INPUT_FEATURES:
                return prev.requireInputFeaturesSetBy();
            default:
                throw new UnsupportedNodeException(n.name(), n.op(), n.target());
        }
    }
}
