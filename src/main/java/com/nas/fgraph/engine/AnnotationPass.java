package com.nas.fgraph.engine;

import com.nas.fgraph.api.UnsupportedNodeException;
import com.nas.fgraph.inspect.NodeClassifier;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.NodeFlags;

import java.util.ArrayDeque;
import java.util.Deque;

import lombok.extern.log4j.Log4j2;

/**
 * First pass: writes {@link NodeFlags} into every node reachable from an input.
 *
 * Walks the graph forward with a FIFO queue seeded with the input nodes.
 * Each popped node gets all eight predicates evaluated and its successors
 * enqueued. A node reached a second time through another predecessor is
 * skipped, since the predicates are pure.
 *
 * All derived state on the graph is discarded before the walk.
 */
@Log4j2
public final class AnnotationPass {
    private final NodeClassifier classifier;

    public AnnotationPass(NodeClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @return the number of nodes annotated.
     * @throws UnsupportedNodeException if a node matches no semantic category.
     */
    public int run(ModelGraph graph) {
        graph.clearAnnotations();
        Deque<GraphNode> queue = new ArrayDeque<>(graph.inputNodes());
        int annotated = 0;

        while (!queue.isEmpty()) {
            GraphNode n = queue.poll();
            if (n.flags().isPresent())
                continue;

            NodeFlags flags = new NodeFlags(
                    classifier.isFeaturesPropagating(n, graph),
                    classifier.isFeaturesDefining(n, graph),
                    classifier.isSharedInputFeaturesOp(n, graph),
                    classifier.isFlatten(n, graph),
                    classifier.isSqueeze(n, graph),
                    classifier.isFeaturesConcatenate(n, graph),
                    classifier.isUntouchable(n, graph),
                    classifier.isZeroOrOneInput(n, graph));
            if (!(flags.featuresPropagating() || flags.featuresDefining() || flags.sharedInputFeatures()
                    || flags.flatten() || flags.squeeze() || flags.featuresConcatenate()))
                throw new UnsupportedNodeException(n.name(), n.op(), n.target());

            n.setFlags(flags);
            annotated++;
            log.debug("Annotated {} as {}", n.name(), flags.category());

            queue.addAll(graph.successors(n));
        }
        return annotated;
    }
}
