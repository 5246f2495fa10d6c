package com.nas.fgraph.dsl;

import com.nas.fgraph.api.OpKind;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.TensorShape;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphBuilderTest {

    @Test
    public void testBuildsNodesInOrder() {
        ModelGraph g = GraphBuilder.create("net")
                .input("x", TensorShape.of(1, 3, 8, 8))
                .module("conv", "features.0", "Conv2d", TensorShape.of(1, 16, 8, 8), "x")
                .squeeze("sq", "conv", 2, TensorShape.of(1, 16, 8))
                .flatten("flat", "sq", 1, -1, TensorShape.of(1, 128))
                .output("output", "flat")
                .build();

        assertEquals(List.of("x", "conv", "sq", "flat", "output"),
                g.nodes().stream().map(GraphNode::name).toList());

        GraphNode conv = g.node("conv");
        assertEquals("features.0", conv.target());
        assertEquals("Conv2d", g.modules().requireLayerType("features.0"));

        GraphNode sq = g.node("sq");
        assertEquals(OpKind.CALL_FUNCTION, sq.op());
        assertEquals("torch.squeeze", sq.target());
        assertEquals(Integer.valueOf(2), sq.intArgument(0, "dim", null));

        GraphNode flat = g.node("flat");
        assertEquals(Integer.valueOf(1), flat.intArgument(0, "start_dim", 0));
        assertEquals(Integer.valueOf(-1), flat.intArgument(1, "end_dim", -1));
        assertEquals(TensorShape.of(1, 128), flat.requireShape());

        assertFalse(g.node("output").shape().isPresent());
    }

    @Test
    public void testHelpersUseTracedTargets() {
        TensorShape s = TensorShape.of(1, 8, 4, 4);
        ModelGraph g = GraphBuilder.create("helpers")
                .input("a", s)
                .input("b", s)
                .cat("cat", TensorShape.of(1, 16, 4, 4), "a", "b")
                .add("add", s, "a", "b")
                .method("mflat", "flatten", TensorShape.of(1, 128), "a")
                .flatten("kflat", "b", 1, TensorShape.of(1, 128))
                .build();

        assertEquals("torch.cat", g.node("cat").target());
        assertEquals(Integer.valueOf(1), g.node("cat").intArgument(0, "dim", 0));
        assertEquals("operator.add", g.node("add").target());
        assertEquals(OpKind.CALL_METHOD, g.node("mflat").op());
        assertEquals(OpKind.CALL_METHOD, g.node("kflat").op());
        assertEquals(Integer.valueOf(1), g.node("kflat").kwargs().get("start_dim"));
    }

    @Test(expected = IllegalStateException.class)
    public void testNoChangesAfterBuild() {
        GraphBuilder b = GraphBuilder.create("done").input("x", TensorShape.of(1, 3));
        b.build();
        b.input("y", TensorShape.of(1, 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateName() {
        GraphBuilder.create("dup")
                .input("x", TensorShape.of(1, 3))
                .input("x", TensorShape.of(1, 3));
    }
}
