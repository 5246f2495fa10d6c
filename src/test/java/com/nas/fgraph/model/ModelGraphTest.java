package com.nas.fgraph.model;

import com.nas.fgraph.api.MalformedGraphException;
import com.nas.fgraph.api.NodeCategory;
import com.nas.fgraph.api.OpKind;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ModelGraphTest {

    private static GraphNode input(String name) {
        return new GraphNode(name, OpKind.INPUT, null, List.of());
    }

    private static GraphNode module(String name, String... inputs) {
        return new GraphNode(name, OpKind.CALL_MODULE, name, List.of(inputs));
    }

    @Test
    public void testEmptyGraph() {
        ModelGraph g = ModelGraph.builder("empty").build();
        assertEquals(0, g.nodeCount());
        assertTrue(g.inputNodes().isEmpty());
    }

    @Test
    public void testDiamondEdges() {
        // x
        // / \
        // a b
        // \ /
        // add -> output
        ModelGraph g = ModelGraph.builder("diamond")
                .registerModule("a", "Conv2d")
                .registerModule("b", "Conv2d")
                .addNode(input("x"))
                .addNode(module("a", "x"))
                .addNode(module("b", "x"))
                .addNode(new GraphNode("add", OpKind.CALL_FUNCTION, "operator.add", List.of("b", "a")))
                .addNode(new GraphNode("output", OpKind.OUTPUT, null, List.of("add")))
                .build();

        assertEquals(5, g.nodeCount());
        assertEquals(List.of(g.node("x")), g.inputNodes());
        assertEquals(List.of(g.node("output")), g.outputNodes());

        // Predecessors keep argument order
        assertEquals(List.of(g.node("b"), g.node("a")), g.predecessors(g.node("add")));
        // Successors keep declaration order
        assertEquals(List.of(g.node("a"), g.node("b")), g.successors(g.node("x")));
        assertTrue(g.successors(g.node("output")).isEmpty());
        assertEquals("Conv2d", g.modules().requireLayerType("a"));
    }

    @Test
    public void testRepeatedInputCollapsed() {
        ModelGraph g = ModelGraph.builder("twice")
                .addNode(input("x"))
                .addNode(new GraphNode("add", OpKind.CALL_FUNCTION, "operator.add", List.of("x", "x")))
                .build();
        assertEquals(1, g.predecessors(g.node("add")).size());
        assertEquals(1, g.successors(g.node("x")).size());
    }

    @Test(expected = MalformedGraphException.class)
    public void testNonInputWithoutPredecessors() {
        ModelGraph.builder("bad")
                .addNode(input("x"))
                .addNode(new GraphNode("ones", OpKind.CALL_FUNCTION, "torch.ones", List.of()))
                .build();
    }

    @Test(expected = MalformedGraphException.class)
    public void testInputWithPredecessors() {
        ModelGraph.builder("bad")
                .addNode(input("x"))
                .addNode(new GraphNode("y", OpKind.INPUT, null, List.of("x")))
                .build();
    }

    @Test(expected = MalformedGraphException.class)
    public void testUnregisteredModule() {
        ModelGraph.builder("bad")
                .addNode(input("x"))
                .addNode(module("conv", "x"))
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownInput() {
        ModelGraph.builder("bad")
                .addNode(new GraphNode("relu", OpKind.CALL_FUNCTION, "torch.relu", List.of("missing")))
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeName() {
        ModelGraph.builder("bad")
                .addNode(input("x"))
                .addNode(input("x"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSelfEdge() {
        ModelGraph.builder("bad")
                .addNode(new GraphNode("loop", OpKind.CALL_FUNCTION, "torch.relu", List.of("loop")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNodeLookup() {
        ModelGraph.builder("g").addNode(input("x")).build().node("y");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testForeignNodeEdges() {
        ModelGraph g = ModelGraph.builder("g").addNode(input("x")).build();
        g.successors(input("x"));
    }

    @Test
    public void testClearAnnotationsKeepsShape() {
        ModelGraph g = ModelGraph.builder("g").addNode(input("x")).build();
        GraphNode x = g.node("x");
        x.setShape(TensorShape.of(1, 3));
        x.setFlags(NodeFlags.of(NodeCategory.FEATURES_DEFINING, false, true));
        g.clearAnnotations();
        assertFalse(x.flags().isPresent());
        assertEquals(TensorShape.of(1, 3), x.requireShape());
    }
}
