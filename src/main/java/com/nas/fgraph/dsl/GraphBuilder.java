package com.nas.fgraph.dsl;

import com.nas.fgraph.api.OpKind;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.TensorShape;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Graph Builder -- fluent API for describing a traced network by hand.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("net");
 * 2. Define inputs: g.input("x", TensorShape.of(1, 3, 32, 32));
 * 3. Define layers and ops in trace order:
 * g.module("conv0", "Conv2d", TensorShape.of(1, 16, 32, 32), "x");
 * 4. Close with the output: g.output("output", "conv0");
 * 5. Build: ModelGraph graph = g.build();
 *
 * Shapes stand in for what shape inference would produce; pass null where a
 * node's own shape is irrelevant.
 */
public final class GraphBuilder {
    private final ModelGraph.Builder graph;

    // Flag to prevent modification after building
    private boolean built;

    private GraphBuilder(String graphName) {
        this.graph = ModelGraph.builder(graphName);
    }

    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    // ── Inputs and outputs ───────────────────────────────────────

    public GraphBuilder input(String name, TensorShape shape) {
        return add(new GraphNode(name, OpKind.INPUT, null, List.of()), shape);
    }

    public GraphBuilder output(String name, String... inputs) {
        return add(new GraphNode(name, OpKind.OUTPUT, null, Arrays.asList(inputs)), null);
    }

    // ── Calls ────────────────────────────────────────────────────

    /**
     * A layer call whose module path equals the node name.
     *
     * @param layerType Concrete layer type, e.g. {@code Conv2d}.
     */
    public GraphBuilder module(String name, String layerType, TensorShape shape, String... inputs) {
        return module(name, name, layerType, shape, inputs);
    }

    public GraphBuilder module(String name, String target, String layerType, TensorShape shape, String... inputs) {
        checkNotBuilt();
        graph.registerModule(target, layerType);
        return add(new GraphNode(name, OpKind.CALL_MODULE, target, Arrays.asList(inputs)), shape);
    }

    public GraphBuilder function(String name, String target, TensorShape shape, String... inputs) {
        return add(new GraphNode(name, OpKind.CALL_FUNCTION, target, Arrays.asList(inputs)), shape);
    }

    public GraphBuilder method(String name, String target, TensorShape shape, String... inputs) {
        return add(new GraphNode(name, OpKind.CALL_METHOD, target, Arrays.asList(inputs)), shape);
    }

    /** {@code torch.flatten(input, startDim, endDim)}. */
    public GraphBuilder flatten(String name, String input, int startDim, int endDim, TensorShape shape) {
        return add(new GraphNode(name, OpKind.CALL_FUNCTION, "torch.flatten", List.of(input),
                List.of(startDim, endDim), Map.of()), shape);
    }

    /** {@code input.flatten(start_dim=startDim)}. */
    public GraphBuilder flatten(String name, String input, int startDim, TensorShape shape) {
        return add(new GraphNode(name, OpKind.CALL_METHOD, "flatten", List.of(input),
                List.of(), Map.of("start_dim", startDim)), shape);
    }

    /** {@code torch.squeeze(input, dim)}. */
    public GraphBuilder squeeze(String name, String input, int dim, TensorShape shape) {
        return add(new GraphNode(name, OpKind.CALL_FUNCTION, "torch.squeeze", List.of(input),
                List.of(dim), Map.of()), shape);
    }

    /** {@code torch.cat(inputs, dim=1)}. */
    public GraphBuilder cat(String name, TensorShape shape, String... inputs) {
        return add(new GraphNode(name, OpKind.CALL_FUNCTION, "torch.cat", Arrays.asList(inputs),
                List.of(), Map.of("dim", 1)), shape);
    }

    /** {@code a + b}. */
    public GraphBuilder add(String name, TensorShape shape, String... inputs) {
        return add(new GraphNode(name, OpKind.CALL_FUNCTION, "operator.add", Arrays.asList(inputs)), shape);
    }

    /** Adds a fully specified node. */
    public GraphBuilder node(GraphNode node) {
        return add(node, node.shape().orElse(null));
    }

    public ModelGraph build() {
        checkNotBuilt();
        built = true;
        return graph.build();
    }

    private GraphBuilder add(GraphNode node, TensorShape shape) {
        checkNotBuilt();
        if (shape != null)
            node.setShape(shape);
        graph.addNode(node);
        return this;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }
}
