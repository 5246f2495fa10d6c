package com.nas.fgraph.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a traced model graph, with the shapes produced by
 * shape inference.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** The graph itself: name, module types and nodes in trace order. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String name;
        private Map<String, String> modules;
        private List<NodeDef> nodes;
    }

    /** Definition of a single node. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, op, target;
        private List<String> inputs;
        private List<Object> args;
        private Map<String, Object> kwargs;
        private List<Integer> shape;
    }
}
