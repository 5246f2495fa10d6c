package com.nas.fgraph.model;

import com.nas.fgraph.api.OpKind;
import com.nas.fgraph.calc.FeaturesCalculator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One operation in a traced forward computation.
 *
 * A node has a fixed identity (name, operation kind, target, input names and
 * constant arguments) and a small set of derived fields, one per annotation
 * stage. The derived fields start empty and are filled by the annotation
 * passes in order:
 *
 * 1. flags -- written by the annotation pass.
 * 2. featuresCalculator -- written by the calculator propagation pass.
 * 3. inputFeaturesSetBy -- written by the back-reference pass.
 *
 * The {@code requireXxx()} accessors throw {@link IllegalStateException} when
 * a stage has not run yet, which makes running the passes out of order a
 * visible failure rather than a missing map key.
 *
 * Identity is reference identity: nodes belong to exactly one graph.
 */
public final class GraphNode {
    private final String name;
    private final OpKind op;
    private final String target;
    private final List<String> inputNames;
    private final List<Object> args;
    private final Map<String, Object> kwargs;

    // Written by the shape-inference collaborator before propagation
    private TensorShape shape;

    // Derived state, one field per pass
    private NodeFlags flags;
    private FeaturesCalculator featuresCalculator;
    private InputFeaturesSetBy inputFeaturesSetBy;

    public GraphNode(String name, OpKind op, String target, List<String> inputNames) {
        this(name, op, target, inputNames, List.of(), Map.of());
    }

    /**
     * @param name       Unique name within the graph.
     * @param op         Operation kind.
     * @param target     Module path, qualified function name or method name.
     *                   May be null for inputs and outputs, in which case the
     *                   node name is used.
     * @param inputNames Names of the predecessor nodes, in argument order.
     *                   Repeated names are collapsed.
     * @param args       Constant positional arguments following the tensor
     *                   inputs (e.g. {@code start_dim} of a flatten).
     * @param kwargs     Constant keyword arguments.
     */
    public GraphNode(String name, OpKind op, String target, List<String> inputNames,
            List<Object> args, Map<String, Object> kwargs) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Node name must not be blank");
        if (op == null)
            throw new IllegalArgumentException("Node " + name + " has no operation kind");
        this.name = name;
        this.op = op;
        this.target = target != null ? target : name;
        this.inputNames = inputNames == null ? List.of() : List.copyOf(new LinkedHashSet<>(inputNames));
        this.args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        this.kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public String name() {
        return name;
    }

    public OpKind op() {
        return op;
    }

    public String target() {
        return target;
    }

    public List<String> inputNames() {
        return inputNames;
    }

    public List<Object> args() {
        return args;
    }

    public Map<String, Object> kwargs() {
        return kwargs;
    }

    /**
     * Looks up a constant argument, first by position, then by keyword.
     *
     * @param position     Index among the constant positional arguments.
     * @param keyword      Keyword name.
     * @param defaultValue Returned when neither is present.
     */
    public Object argument(int position, String keyword, Object defaultValue) {
        if (args.size() > position)
            return args.get(position);
        Object v = kwargs.get(keyword);
        return v != null ? v : defaultValue;
    }

    /**
     * Integer variant of {@link #argument(int, String, Object)}.
     *
     * @return the argument, or {@code defaultValue} (which may be null).
     * @throws IllegalArgumentException if the argument is not an integer.
     */
    public Integer intArgument(int position, String keyword, Integer defaultValue) {
        Object v = argument(position, keyword, defaultValue);
        if (v == null)
            return null;
        if (v instanceof Number n)
            return n.intValue();
        try {
            return Integer.parseInt(v.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Argument '" + keyword + "' of node " + name + " is not an integer: " + v, e);
        }
    }

    // ── Shape ────────────────────────────────────────────────────

    public Optional<TensorShape> shape() {
        return Optional.ofNullable(shape);
    }

    /**
     * @throws IllegalStateException if shape inference has not populated this
     *                               node.
     */
    public TensorShape requireShape() {
        if (shape == null)
            throw new IllegalStateException("Node " + name + " has no shape; run shape inference first");
        return shape;
    }

    public void setShape(TensorShape shape) {
        this.shape = shape;
    }

    // ── Annotation stage ─────────────────────────────────────────

    public Optional<NodeFlags> flags() {
        return Optional.ofNullable(flags);
    }

    public NodeFlags requireFlags() {
        if (flags == null)
            throw new IllegalStateException("Node " + name + " is not annotated; run the annotation pass first");
        return flags;
    }

    public void setFlags(NodeFlags flags) {
        this.flags = flags;
    }

    // ── Calculator stage ─────────────────────────────────────────

    public Optional<FeaturesCalculator> featuresCalculator() {
        return Optional.ofNullable(featuresCalculator);
    }

    public boolean hasFeaturesCalculator() {
        return featuresCalculator != null;
    }

    public FeaturesCalculator requireFeaturesCalculator() {
        if (featuresCalculator == null)
            throw new IllegalStateException("Node " + name + " has no features calculator");
        return featuresCalculator;
    }

    public void setFeaturesCalculator(FeaturesCalculator featuresCalculator) {
        this.featuresCalculator = featuresCalculator;
    }

    // ── Back-reference stage ─────────────────────────────────────

    public Optional<InputFeaturesSetBy> inputFeaturesSetBy() {
        return Optional.ofNullable(inputFeaturesSetBy);
    }

    public boolean hasInputFeaturesSetBy() {
        return inputFeaturesSetBy != null;
    }

    public InputFeaturesSetBy requireInputFeaturesSetBy() {
        if (inputFeaturesSetBy == null)
            throw new IllegalStateException("Node " + name + " has no input features back-reference");
        return inputFeaturesSetBy;
    }

    public void setInputFeaturesSetBy(InputFeaturesSetBy inputFeaturesSetBy) {
        this.inputFeaturesSetBy = inputFeaturesSetBy;
    }

    /** Drops all derived state. The shape is kept, it comes from outside. */
    public void clearAnnotations() {
        flags = null;
        featuresCalculator = null;
        inputFeaturesSetBy = null;
    }

    @Override
    public String toString() {
        return name;
    }
}
