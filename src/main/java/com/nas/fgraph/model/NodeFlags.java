package com.nas.fgraph.model;

import com.nas.fgraph.api.NodeCategory;

/**
 * Classification flags written by the annotation pass.
 *
 * The first six flags are semantic and mutually exclusive. The last two are
 * structural hints for search logic built on top of the graph.
 */
public record NodeFlags(
        boolean featuresPropagating,
        boolean featuresDefining,
        boolean sharedInputFeatures,
        boolean flatten,
        boolean squeeze,
        boolean featuresConcatenate,
        boolean untouchable,
        boolean zeroOrOneInput) {

    /** Builds the flag set for a single semantic category. */
    public static NodeFlags of(NodeCategory category, boolean untouchable, boolean zeroOrOneInput) {
        return new NodeFlags(
                category == NodeCategory.FEATURES_PROPAGATING,
                category == NodeCategory.FEATURES_DEFINING,
                category == NodeCategory.SHARED_INPUT_FEATURES,
                category == NodeCategory.FLATTEN,
                category == NodeCategory.SQUEEZE,
                category == NodeCategory.FEATURES_CONCATENATE,
                untouchable,
                zeroOrOneInput);
    }

    /** Returns the single semantic category these flags describe. */
    public NodeCategory category() {
        if (featuresPropagating)
            return NodeCategory.FEATURES_PROPAGATING;
        if (featuresDefining)
            return NodeCategory.FEATURES_DEFINING;
        if (sharedInputFeatures)
            return NodeCategory.SHARED_INPUT_FEATURES;
        if (flatten)
            return NodeCategory.FLATTEN;
        if (squeeze)
            return NodeCategory.SQUEEZE;
        if (featuresConcatenate)
            return NodeCategory.FEATURES_CONCATENATE;
        throw new IllegalStateException("No semantic flag set");
    }
}
