package com.nas.fgraph.engine;

import com.nas.fgraph.api.GraphAnnotationException;
import com.nas.fgraph.calc.FeaturesCalculator;
import com.nas.fgraph.inspect.ClassificationTable;
import com.nas.fgraph.inspect.ClassifierRule;
import com.nas.fgraph.inspect.NodeClassifier;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Runs the three annotation passes over a graph, strictly in order:
 *
 * 1. {@link AnnotationPass} -- classification flags.
 * 2. {@link FeaturesCalculatorPass} -- one calculator per node.
 * 3. {@link InputFeaturesPass} -- back-references to input-channel setters.
 *
 * The shape-inference collaborator must have populated node shapes before
 * {@link #annotate(ModelGraph)} is called. Running the passes again on an
 * annotated graph rebuilds everything from scratch and yields the same
 * values.
 *
 * Single-threaded: the calling thread must own the graph for the duration of
 * the call. A cyclic graph makes the passes loop forever.
 */
@Log4j2
public final class GraphAnnotator {
    private final AnnotationPass annotationPass;
    private final FeaturesCalculatorPass calculatorPass;
    private final InputFeaturesPass inputFeaturesPass;

    private GraphAnnotator(NodeClassifier classifier, List<ExtensionRule> extensionRules) {
        this.annotationPass = new AnnotationPass(classifier);
        this.calculatorPass = new FeaturesCalculatorPass(extensionRules);
        this.inputFeaturesPass = new InputFeaturesPass();
    }

    /** Annotator with the bundled allow-list and no extension rules. */
    public static GraphAnnotator withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Annotates every node reachable from the graph inputs.
     *
     * @throws GraphAnnotationException if a node is unsupported, a reshape is
     *                                  invalid or the graph is malformed.
     * @throws IllegalStateException    if a features-defining node has no shape.
     */
    public void annotate(ModelGraph graph) {
        long start = System.nanoTime();
        try {
            int annotated = annotationPass.run(graph);
            int deferred = calculatorPass.run(graph);
            int skipped = inputFeaturesPass.run(graph);
            log.info("Annotated graph '{}': {} of {} nodes, {} deferred, {} skipped, {} us",
                    graph.name(), annotated, graph.nodeCount(), deferred, skipped,
                    (System.nanoTime() - start) / 1_000);
        } catch (GraphAnnotationException | IllegalStateException e) {
            log.error("Annotation of graph '{}' failed: {}", graph.name(), e.getMessage());
            throw e;
        }
    }

    /**
     * The calculator feeding a node, i.e. its first predecessor's calculator.
     * This is what a masked layer sizes its input against.
     *
     * @throws IllegalArgumentException for input nodes.
     */
    public static FeaturesCalculator inputFeatures(ModelGraph graph, GraphNode node) {
        List<GraphNode> preds = graph.predecessors(node);
        if (preds.isEmpty())
            throw new IllegalArgumentException("Input node " + node.name() + " has no input features");
        return preds.get(0).requireFeaturesCalculator();
    }

    /**
     * Configures the allow-list and the caller-supplied rules.
     */
    public static final class Builder {
        private ClassificationTable table;
        private final List<ClassifierRule> classifierRules = new ArrayList<>();
        private final List<ExtensionRule> extensionRules = new ArrayList<>();

        private Builder() {
        }

        public Builder table(ClassificationTable table) {
            this.table = table;
            return this;
        }

        public Builder classifierRule(ClassifierRule rule) {
            classifierRules.add(rule);
            return this;
        }

        public Builder extensionRule(ExtensionRule rule) {
            extensionRules.add(rule);
            return this;
        }

        public GraphAnnotator build() {
            ClassificationTable t = table != null ? table : ClassificationTable.defaults();
            return new GraphAnnotator(new NodeClassifier(t, classifierRules), extensionRules);
        }
    }
}
