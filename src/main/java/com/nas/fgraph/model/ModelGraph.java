package com.nas.fgraph.model;

import com.nas.fgraph.api.MalformedGraphException;
import com.nas.fgraph.api.OpKind;

import java.util.*;

/**
 * Read-only adapter over a traced computation graph.
 *
 * Nodes are kept in declaration order. Edges are derived from each node's
 * input names, so predecessor order is argument order, and successor lists
 * are built once at construction.
 *
 * The graph is static: any topology edit means building a new instance, and
 * all annotations on the old one become meaningless.
 *
 * Cycles are not detected. The annotation passes assume an acyclic graph and
 * do not terminate on a cyclic one.
 */
public final class ModelGraph {
    private final String name;
    private final List<GraphNode> nodes;
    private final Map<String, GraphNode> nodesByName;
    private final Map<GraphNode, List<GraphNode>> predecessors;
    private final Map<GraphNode, List<GraphNode>> successors;
    private final List<GraphNode> inputNodes;
    private final List<GraphNode> outputNodes;
    private final ModuleRegistry modules;

    private ModelGraph(String name, List<GraphNode> nodes, Map<String, GraphNode> nodesByName,
            Map<GraphNode, List<GraphNode>> predecessors, Map<GraphNode, List<GraphNode>> successors,
            List<GraphNode> inputNodes, List<GraphNode> outputNodes, ModuleRegistry modules) {
        this.name = name;
        this.nodes = nodes;
        this.nodesByName = nodesByName;
        this.predecessors = predecessors;
        this.successors = successors;
        this.inputNodes = inputNodes;
        this.outputNodes = outputNodes;
        this.modules = modules;
    }

    public String name() {
        return name;
    }

    /** All nodes in declaration order. */
    public List<GraphNode> nodes() {
        return nodes;
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Resolves a node by name.
     *
     * @throws IllegalArgumentException if no such node exists.
     */
    public GraphNode node(String nodeName) {
        GraphNode n = nodesByName.get(nodeName);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        return n;
    }

    public boolean contains(String nodeName) {
        return nodesByName.containsKey(nodeName);
    }

    /** Nodes with no predecessors, i.e. network inputs. */
    public List<GraphNode> inputNodes() {
        return inputNodes;
    }

    public List<GraphNode> outputNodes() {
        return outputNodes;
    }

    public List<GraphNode> predecessors(GraphNode n) {
        return edges(predecessors, n);
    }

    public List<GraphNode> successors(GraphNode n) {
        return edges(successors, n);
    }

    /** The layer types behind {@code call_module} targets. */
    public ModuleRegistry modules() {
        return modules;
    }

    /** Drops every annotation on every node. */
    public void clearAnnotations() {
        for (GraphNode n : nodes)
            n.clearAnnotations();
    }

    private List<GraphNode> edges(Map<GraphNode, List<GraphNode>> index, GraphNode n) {
        List<GraphNode> list = index.get(n);
        if (list == null)
            throw new IllegalArgumentException("Node " + n.name() + " does not belong to graph " + name);
        return list;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Collects nodes and module types, then validates and indexes the edges.
     */
    public static final class Builder {
        private final String name;
        private final List<GraphNode> nodes = new ArrayList<>();
        private final Map<String, GraphNode> nameToNode = new HashMap<>();
        private final Map<String, String> moduleTypes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder addNode(GraphNode node) {
            if (nameToNode.containsKey(node.name()))
                throw new IllegalArgumentException("Duplicate node name: " + node.name());
            if (node.inputNames().contains(node.name()))
                throw new IllegalArgumentException("Self-edge not allowed: " + node.name());
            nodes.add(node);
            nameToNode.put(node.name(), node);
            return this;
        }

        public Builder registerModule(String target, String layerType) {
            moduleTypes.put(target, layerType);
            return this;
        }

        public Builder registerModules(Map<String, String> types) {
            moduleTypes.putAll(types);
            return this;
        }

        /**
         * Resolves input names into edges and validates the structure.
         *
         * @throws IllegalArgumentException if an input name is unknown.
         * @throws MalformedGraphException  if a non-input node has no
         *                                  predecessors, an input node has
         *                                  some, or a module target has no
         *                                  registered layer type.
         */
        public ModelGraph build() {
            Map<GraphNode, List<GraphNode>> preds = new IdentityHashMap<>(nodes.size() * 2);
            Map<GraphNode, List<GraphNode>> succs = new IdentityHashMap<>(nodes.size() * 2);
            for (GraphNode n : nodes)
                succs.put(n, new ArrayList<>());

            List<GraphNode> inputs = new ArrayList<>();
            List<GraphNode> outputs = new ArrayList<>();
            ModuleRegistry modules = new ModuleRegistry(moduleTypes);

            for (GraphNode n : nodes) {
                List<GraphNode> p = new ArrayList<>(n.inputNames().size());
                for (String in : n.inputNames()) {
                    GraphNode src = nameToNode.get(in);
                    if (src == null)
                        throw new IllegalArgumentException("Unknown input '" + in + "' of node " + n.name());
                    p.add(src);
                    succs.get(src).add(n);
                }
                preds.put(n, Collections.unmodifiableList(p));

                if (n.op() == OpKind.INPUT) {
                    if (!p.isEmpty())
                        throw new MalformedGraphException("Input node " + n.name() + " has predecessors");
                    inputs.add(n);
                } else if (p.isEmpty()) {
                    throw new MalformedGraphException("Non-input node " + n.name() + " ("
                            + n.op().traceName() + ", target: " + n.target() + ") has no predecessors");
                }
                if (n.op() == OpKind.OUTPUT)
                    outputs.add(n);
                if (n.op() == OpKind.CALL_MODULE && !modules.contains(n.target()))
                    throw new MalformedGraphException("Node " + n.name() + " calls unregistered module " + n.target());
            }

            for (GraphNode n : nodes)
                succs.put(n, Collections.unmodifiableList(succs.get(n)));

            Map<String, GraphNode> byName = new LinkedHashMap<>(nodes.size() * 2);
            for (GraphNode n : nodes)
                byName.put(n.name(), n);

            return new ModelGraph(name, List.copyOf(nodes), Collections.unmodifiableMap(byName),
                    preds, succs, List.copyOf(inputs), List.copyOf(outputs), modules);
        }
    }
}
