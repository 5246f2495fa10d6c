package com.nas.fgraph;

import com.nas.fgraph.calc.FeaturesCalculator;
import com.nas.fgraph.engine.GraphAnnotator;
import com.nas.fgraph.engine.InputFeaturesPass;
import com.nas.fgraph.io.JsonGraphLoader;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.InputFeaturesSetBy;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.util.GraphExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A high-level wrapper that loads a shape-annotated graph definition and runs
 * the channel annotation passes over it.
 * <p>
 * This class handles:
 * <ul>
 * <li>Parsing JSON graph definitions with {@link JsonGraphLoader}</li>
 * <li>Annotating the graph with a {@link GraphAnnotator}</li>
 * <li>Simple lookups of channel counts and back-references by node name</li>
 * </ul>
 */
public class FeaturesGraph {
    private static final Logger log = LogManager.getLogger(FeaturesGraph.class);

    private final ModelGraph graph;

    /**
     * Loads and annotates a graph with the default allow-list.
     *
     * @param jsonPath Path to the JSON graph definition.
     */
    public FeaturesGraph(Path jsonPath) throws IOException {
        this(JsonGraphLoader.parseFile(jsonPath), GraphAnnotator.withDefaults());
    }

    /**
     * Annotates an already built graph.
     */
    public FeaturesGraph(ModelGraph graph, GraphAnnotator annotator) {
        this.graph = graph;
        annotator.annotate(graph);
        if (log.isDebugEnabled())
            log.debug("\n{}", new GraphExplain(graph).dumpAnnotations());
    }

    public static FeaturesGraph fromJson(String json) {
        return new FeaturesGraph(JsonGraphLoader.parse(json), GraphAnnotator.withDefaults());
    }

    public ModelGraph graph() {
        return graph;
    }

    /** Current number of output channels of a node. */
    public int features(String nodeName) {
        return graph.node(nodeName).requireFeaturesCalculator().features();
    }

    /** Current number of input channels of a node. */
    public int inputFeatures(String nodeName) {
        return inputFeaturesCalculator(nodeName).features();
    }

    public FeaturesCalculator inputFeaturesCalculator(String nodeName) {
        return GraphAnnotator.inputFeatures(graph, graph.node(nodeName));
    }

    public InputFeaturesSetBy inputFeaturesSetBy(String nodeName) {
        return graph.node(nodeName).requireInputFeaturesSetBy();
    }

    /** The nodes whose outputs make up a node's input channels, resolved through concatenations. */
    public List<GraphNode> producersOf(String nodeName) {
        return InputFeaturesPass.producersOf(graph.node(nodeName));
    }

    public GraphExplain explain() {
        return new GraphExplain(graph);
    }
}
