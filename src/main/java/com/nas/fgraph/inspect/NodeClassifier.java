package com.nas.fgraph.inspect;

import com.nas.fgraph.api.NodeCategory;
import com.nas.fgraph.api.OpKind;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.TensorShape;

import java.util.List;
import java.util.Optional;

/**
 * Pure predicates mapping a node to its semantic category.
 *
 * Lookup order for a node that is neither an input nor an output:
 * 1. Caller-supplied {@link ClassifierRule}s, first opinion wins.
 * 2. The {@link ClassificationTable}, keyed by layer type for module calls
 * and by target otherwise.
 *
 * Input nodes are always features-defining and output nodes always
 * features-propagating. Table entries carry two structural conditions: a
 * shared-input combiner needs more than one input, and a concatenation must
 * run along the channel axis.
 */
public final class NodeClassifier {
    private final ClassificationTable table;
    private final List<ClassifierRule> rules;

    public NodeClassifier(ClassificationTable table) {
        this(table, List.of());
    }

    public NodeClassifier(ClassificationTable table, List<ClassifierRule> rules) {
        this.table = table;
        this.rules = List.copyOf(rules);
    }

    public static NodeClassifier withDefaults() {
        return new NodeClassifier(ClassificationTable.defaults());
    }

    public ClassificationTable table() {
        return table;
    }

    /**
     * Returns the single semantic category of {@code n}, or empty when nothing
     * in the allow-list recognizes it.
     */
    public Optional<NodeCategory> classify(GraphNode n, ModelGraph graph) {
        if (n.op() == OpKind.INPUT)
            return Optional.of(NodeCategory.FEATURES_DEFINING);
        if (n.op() == OpKind.OUTPUT)
            return Optional.of(NodeCategory.FEATURES_PROPAGATING);

        for (ClassifierRule rule : rules) {
            Optional<NodeCategory> opinion = rule.classify(n, graph);
            if (opinion.isPresent())
                return opinion;
        }

        Optional<NodeCategory> category = table.lookup(n.op(), tableKey(n, graph));
        if (category.isEmpty())
            return category;
        switch (category.get()) {
            case SHARED_INPUT_FEATURES:
                if (isZeroOrOneInput(n, graph))
                    return Optional.empty();
                break;
            case FEATURES_CONCATENATE:
                if (!concatenatesChannels(n))
                    return Optional.empty();
                break;
            default:
                break;
        }
        return category;
    }

    public boolean isFeaturesDefining(GraphNode n, ModelGraph graph) {
        return is(n, graph, NodeCategory.FEATURES_DEFINING);
    }

    public boolean isFeaturesPropagating(GraphNode n, ModelGraph graph) {
        return is(n, graph, NodeCategory.FEATURES_PROPAGATING);
    }

    public boolean isSharedInputFeaturesOp(GraphNode n, ModelGraph graph) {
        return is(n, graph, NodeCategory.SHARED_INPUT_FEATURES);
    }

    public boolean isFlatten(GraphNode n, ModelGraph graph) {
        return is(n, graph, NodeCategory.FLATTEN);
    }

    public boolean isSqueeze(GraphNode n, ModelGraph graph) {
        return is(n, graph, NodeCategory.SQUEEZE);
    }

    public boolean isFeaturesConcatenate(GraphNode n, ModelGraph graph) {
        return is(n, graph, NodeCategory.FEATURES_CONCATENATE);
    }

    /** Output nodes, plus targets or layer types the table marks untouchable. */
    public boolean isUntouchable(GraphNode n, ModelGraph graph) {
        if (n.op() == OpKind.OUTPUT)
            return true;
        if (table.isUntouchable(n.target()))
            return true;
        return n.op() == OpKind.CALL_MODULE && table.isUntouchable(tableKey(n, graph));
    }

    public boolean isZeroOrOneInput(GraphNode n, ModelGraph graph) {
        return graph.predecessors(n).size() <= 1;
    }

    /** True if {@code n} calls a module whose concrete type is {@code layerType}. */
    public boolean isLayer(GraphNode n, ModelGraph graph, String layerType) {
        if (n.op() != OpKind.CALL_MODULE)
            return false;
        return layerType.equals(graph.modules().requireLayerType(n.target()));
    }

    private boolean is(GraphNode n, ModelGraph graph, NodeCategory category) {
        return classify(n, graph).orElse(null) == category;
    }

    private static String tableKey(GraphNode n, ModelGraph graph) {
        if (n.op() == OpKind.CALL_MODULE)
            return graph.modules().requireLayerType(n.target());
        return n.target();
    }

    // torch.cat defaults to dim 0, which would concatenate along the batch
    private static boolean concatenatesChannels(GraphNode n) {
        int dim = n.intArgument(0, "dim", 0);
        if (dim == TensorShape.CHANNEL_DIM)
            return true;
        if (dim < 0 && n.shape().isPresent())
            return n.shape().get().rank() + dim == TensorShape.CHANNEL_DIM;
        return false;
    }
}
