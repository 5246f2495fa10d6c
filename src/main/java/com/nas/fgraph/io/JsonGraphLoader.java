package com.nas.fgraph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nas.fgraph.api.OpKind;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.TensorShape;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a {@link ModelGraph} from its JSON {@link GraphDefinition}.
 *
 * <pre>
 * {"graph": {
 *   "name": "net",
 *   "modules": {"conv0": "Conv2d"},
 *   "nodes": [
 *     {"name": "x", "op": "placeholder", "shape": [1, 3, 32, 32]},
 *     {"name": "conv0", "op": "call_module", "target": "conv0", "inputs": ["x"], "shape": [1, 16, 32, 32]},
 *     {"name": "flat", "op": "call_function", "target": "torch.flatten", "inputs": ["conv0"], "args": [1]},
 *     {"name": "output", "op": "output", "inputs": ["flat"]}
 *   ]}}
 * </pre>
 */
public final class JsonGraphLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonGraphLoader() {
        // Utility class
    }

    /** Parses a JSON file into a graph. */
    public static ModelGraph parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses a JSON string into a graph.
     *
     * @throws IllegalArgumentException if the JSON is malformed or lacks the
     *                                  {@code graph} key.
     */
    public static ModelGraph parse(String json) {
        GraphDefinition def;
        try {
            def = MAPPER.readValue(json, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph definition: " + e.getOriginalMessage(), e);
        }
        return compile(def);
    }

    /** Builds the graph described by an already parsed definition. */
    public static ModelGraph compile(GraphDefinition def) {
        GraphDefinition.GraphInfo info = def.getGraph();
        if (info == null)
            throw new IllegalArgumentException("Missing 'graph' key");

        ModelGraph.Builder builder = ModelGraph.builder(info.getName() != null ? info.getName() : "graph");
        if (info.getModules() != null)
            builder.registerModules(info.getModules());

        if (info.getNodes() != null) {
            for (GraphDefinition.NodeDef nd : info.getNodes()) {
                if (nd.getOp() == null)
                    throw new IllegalArgumentException("Node " + nd.getName() + " has no 'op'");
                GraphNode node = new GraphNode(nd.getName(), OpKind.fromString(nd.getOp()), nd.getTarget(),
                        nd.getInputs(), nd.getArgs(), nd.getKwargs());
                if (nd.getShape() != null && !nd.getShape().isEmpty())
                    node.setShape(TensorShape.of(nd.getShape()));
                builder.addNode(node);
            }
        }
        return builder.build();
    }
}
