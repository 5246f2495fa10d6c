package com.nas.fgraph;

import com.nas.fgraph.api.NodeCategory;
import com.nas.fgraph.model.GraphNode;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.junit.Assert.*;

public class FeaturesGraphTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private String json;

    @Before
    public void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/two_branch_concat.json")) {
            json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    public void testTwoBranchConcat() {
        FeaturesGraph fg = FeaturesGraph.fromJson(json);

        assertEquals(16, fg.features("conv0"));
        assertEquals(24, fg.features("conv1"));
        assertEquals(40, fg.features("cat"));
        assertEquals(40, fg.inputFeatures("conv2"));
        assertEquals("cat", fg.inputFeaturesSetBy("conv2").node().name());
        assertEquals(List.of("conv0", "conv1"),
                fg.producersOf("conv2").stream().map(GraphNode::name).toList());

        assertEquals(32, fg.inputFeatures("flatten"));
        assertEquals("conv2", fg.inputFeaturesSetBy("flatten").node().name());
        assertEquals(512, fg.features("flatten"));
        assertEquals(512, fg.inputFeatures("fc"));
        assertEquals("flatten", fg.inputFeaturesSetBy("fc").node().name());
        assertEquals("fc", fg.inputFeaturesSetBy("output").node().name());
        assertEquals(10, fg.features("output"));

        assertEquals(NodeCategory.FEATURES_CONCATENATE, fg.graph().node("cat").requireFlags().category());
        assertTrue(fg.graph().node("output").requireFlags().untouchable());
    }

    @Test
    public void testFromFile() throws Exception {
        File f = folder.newFile("net.json");
        Files.writeString(f.toPath(), json);
        FeaturesGraph fg = new FeaturesGraph(f.toPath());
        assertEquals(40, fg.inputFeatures("conv2"));
        assertTrue(fg.explain().dumpAnnotations().contains("cat [FEATURES_CONCATENATE] features=40"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNode() {
        FeaturesGraph.fromJson(json).features("conv9");
    }
}
