package com.nas.fgraph.engine;

import com.nas.fgraph.dsl.GraphBuilder;
import com.nas.fgraph.inspect.NodeClassifier;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.InputFeaturesSetBy;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.TensorShape;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class InputFeaturesPassTest {
    private static final TensorShape IN = TensorShape.of(1, 3, 8, 8);
    private static final TensorShape S16 = TensorShape.of(1, 16, 8, 8);
    private static final TensorShape S24 = TensorShape.of(1, 24, 8, 8);
    private static final TensorShape S40 = TensorShape.of(1, 40, 8, 8);

    private static int run(ModelGraph g) {
        new AnnotationPass(NodeClassifier.withDefaults()).run(g);
        new FeaturesCalculatorPass().run(g);
        return new InputFeaturesPass().run(g);
    }

    private static GraphNode setBy(ModelGraph g, String name) {
        return g.node(name).requireInputFeaturesSetBy().node();
    }

    private static ModelGraph concatGraph(String first, String second) {
        return GraphBuilder.create("cat")
                .input("x", IN)
                .module("conv0", "Conv2d", S16, "x")
                .module("conv1", "Conv2d", S24, "x")
                .cat("cat", S40, first, second)
                .module("conv2", "Conv2d", TensorShape.of(1, 32, 8, 8), "cat")
                .output("output", "conv2")
                .build();
    }

    @Test
    public void testInputSetsItself() {
        ModelGraph g = concatGraph("conv0", "conv1");
        run(g);
        assertSame(g.node("x"), setBy(g, "x"));
        assertSame(g.node("x"), setBy(g, "conv0"));
        assertSame(g.node("x"), setBy(g, "conv1"));
    }

    @Test
    public void testConcatenation() {
        ModelGraph g = concatGraph("conv0", "conv1");
        assertEquals(0, run(g));

        InputFeaturesSetBy cat = g.node("cat").requireInputFeaturesSetBy();
        assertTrue(cat.isConcatenation());
        assertEquals(List.of(g.node("conv0"), g.node("conv1")), cat.nodes());
        assertEquals("[conv0, conv1]", cat.toString());

        assertSame(g.node("cat"), setBy(g, "conv2"));
        assertEquals(40, GraphAnnotator.inputFeatures(g, g.node("conv2")).features());
        assertEquals(List.of(g.node("conv0"), g.node("conv1")), InputFeaturesPass.producersOf(g.node("conv2")));
        assertEquals(List.of(g.node("conv0"), g.node("conv1")), InputFeaturesPass.producersOf(g.node("cat")));
        assertSame(g.node("conv2"), setBy(g, "output"));
    }

    @Test
    public void testConcatenationKeepsInputOrder() {
        ModelGraph g = concatGraph("conv1", "conv0");
        run(g);
        assertEquals(List.of(g.node("conv1"), g.node("conv0")), g.node("cat").requireInputFeaturesSetBy().nodes());
        assertEquals(40, g.node("cat").requireFeaturesCalculator().features());
    }

    @Test
    public void testUnresolvedNodesSkippedThenRevisited() {
        ModelGraph g = GraphBuilder.create("deferral")
                .input("x", IN)
                .module("a", "Conv2d", S16, "x")
                .module("b", "ReLU", IN, "x")
                .module("c", "Conv2d", S24, "b")
                .cat("cat", S40, "a", "c")
                .output("output", "cat")
                .build();

        // cat is reached before c is resolved, and output before cat
        assertEquals(2, run(g));

        assertSame(g.node("x"), setBy(g, "c"));
        assertEquals(List.of(g.node("a"), g.node("c")), g.node("cat").requireInputFeaturesSetBy().nodes());
        assertSame(g.node("cat"), setBy(g, "output"));
        for (GraphNode n : g.nodes())
            assertTrue(n.name(), n.hasInputFeaturesSetBy());
    }

    @Test
    public void testPropagatingChainForwardsBackReference() {
        ModelGraph g = GraphBuilder.create("chain")
                .input("x", IN)
                .module("conv", "Conv2d", S16, "x")
                .module("bn", "BatchNorm2d", S16, "conv")
                .module("relu", "ReLU", S16, "bn")
                .module("pool", "MaxPool2d", TensorShape.of(1, 16, 4, 4), "relu")
                .module("fc", "Conv2d", TensorShape.of(1, 8, 4, 4), "pool")
                .build();
        run(g);
        assertSame(g.node("conv"), setBy(g, "bn"));
        assertSame(g.node("conv"), setBy(g, "relu"));
        assertSame(g.node("conv"), setBy(g, "pool"));
        assertSame(g.node("conv"), setBy(g, "fc"));
    }

    @Test
    public void testFlattenIntoChannelsSetsInputFeatures() {
        ModelGraph g = GraphBuilder.create("head")
                .input("x", IN)
                .module("conv", "Conv2d", TensorShape.of(1, 32, 4, 4), "x")
                .module("relu", "ReLU", TensorShape.of(1, 32, 4, 4), "conv")
                .flatten("flat", "relu", 1, -1, TensorShape.of(1, 512))
                .module("fc", "Linear", TensorShape.of(1, 10), "flat")
                .output("output", "fc")
                .build();
        run(g);
        assertSame(g.node("conv"), setBy(g, "flat"));
        assertSame(g.node("flat"), setBy(g, "fc"));
        assertEquals(512, GraphAnnotator.inputFeatures(g, g.node("fc")).features());
        assertSame(g.node("fc"), setBy(g, "output"));
    }

    @Test
    public void testFlattenBehindChannelsIsTransparent() {
        ModelGraph g = GraphBuilder.create("head")
                .input("x", IN)
                .module("conv", "Conv1d", TensorShape.of(1, 32, 4, 4), "x")
                .flatten("flat", "conv", 2, TensorShape.of(1, 32, 16))
                .module("fc", "Conv1d", TensorShape.of(1, 10, 16), "flat")
                .build();
        run(g);
        assertSame(g.node("conv"), setBy(g, "fc"));
        assertEquals(32, GraphAnnotator.inputFeatures(g, g.node("fc")).features());
    }

    @Test
    public void testSharedInputForwardsFirstSetter() {
        ModelGraph g = GraphBuilder.create("residual")
                .input("x", IN)
                .module("conv_a", "Conv2d", S16, "x")
                .module("conv_b", "Conv2d", S16, "x")
                .add("add", S16, "conv_a", "conv_b")
                .module("conv_c", "Conv2d", S24, "add")
                .build();
        run(g);
        assertSame(g.node("conv_a"), setBy(g, "add"));
        assertSame(g.node("conv_a"), setBy(g, "conv_c"));
        assertEquals(List.of(g.node("conv_a")), InputFeaturesPass.producersOf(g.node("conv_c")));
    }

    @Test(expected = IllegalStateException.class)
    public void testSingleAccessorRejectsConcatenation() {
        ModelGraph g = concatGraph("conv0", "conv1");
        run(g);
        g.node("cat").requireInputFeaturesSetBy().node();
    }
}
