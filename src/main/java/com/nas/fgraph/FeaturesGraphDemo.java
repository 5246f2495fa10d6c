package com.nas.fgraph;

import com.nas.fgraph.model.GraphNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Annotates a two-branch network whose branches are concatenated along the
 * channel axis before a third convolution.
 */
public class FeaturesGraphDemo {
    private static final Logger log = LogManager.getLogger(FeaturesGraphDemo.class);

    public static void main(String[] args) throws IOException {
        log.info("Starting Features Graph Demo...");

        String json;
        try (InputStream in = FeaturesGraphDemo.class.getResourceAsStream("/two_branch_concat.json")) {
            if (in == null)
                throw new IllegalStateException("Missing resource two_branch_concat.json");
            json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        var graph = FeaturesGraph.fromJson(json);
        log.info("\n{}", graph.explain().dumpAnnotations());

        log.info("conv2 input features: {}", graph.inputFeatures("conv2"));
        log.info("conv2 input features set by: {}", graph.inputFeaturesSetBy("conv2"));
        log.info("conv2 input producers: {}",
                graph.producersOf("conv2").stream().map(GraphNode::name).toList());
        log.info("classifier input features: {}", graph.inputFeatures("fc"));

        log.info("Demo complete.");
    }
}
